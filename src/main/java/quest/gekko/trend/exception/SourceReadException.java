package quest.gekko.trend.exception;

/**
 * The document source could not be reached or the cursor failed mid-read.
 */
public class SourceReadException extends ChannelTrendException {
    private static final String DEFAULT_ERROR_CODE = "ERR-SRC-001";

    public SourceReadException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
