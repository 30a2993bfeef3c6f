package quest.gekko.trend.exception;

/**
 * The bulk append failed; the enclosing transaction has been rolled back.
 */
public class SinkWriteException extends ChannelTrendException {
    private static final String DEFAULT_ERROR_CODE = "ERR-SINK-001";

    public SinkWriteException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
