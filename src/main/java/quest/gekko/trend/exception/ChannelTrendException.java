package quest.gekko.trend.exception;

import lombok.Getter;

/**
 * Base class of the failures the pipelines report to their caller. Each subclass carries
 * a stable error code.
 */
@Getter
public abstract class ChannelTrendException extends RuntimeException {
    private final String errorCode;

    protected ChannelTrendException(String message) {
        super(message);
        this.errorCode = getDefaultErrorCode();
    }

    protected ChannelTrendException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = getDefaultErrorCode();
    }

    protected abstract String getDefaultErrorCode();
}
