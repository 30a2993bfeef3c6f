package quest.gekko.trend.exception;

/**
 * The forecasting model could not be fitted or produced unusable numbers.
 */
public class ForecastModelException extends ChannelTrendException {
    private static final String DEFAULT_ERROR_CODE = "ERR-FC-002";

    public ForecastModelException(String message) {
        super(message);
    }

    public ForecastModelException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
