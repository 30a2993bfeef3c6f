package quest.gekko.trend.exception;

import lombok.Getter;
import quest.gekko.trend.domain.Metric;

/**
 * Fewer than two observations exist for the requested channel and metric, so no trend can be fitted.
 */
@Getter
public class InsufficientHistoryException extends ChannelTrendException {
    private static final String DEFAULT_ERROR_CODE = "ERR-FC-001";
    public static final int MINIMUM_POINTS = 2;

    private final String channelId;
    private final Metric metric;
    private final int found;

    public InsufficientHistoryException(String channelId, Metric metric, int found) {
        super(String.format("Insufficient data points for channel '%s' (%s). Found %d rows. Need at least %d.",
                channelId, metric, found, MINIMUM_POINTS));
        this.channelId = channelId;
        this.metric = metric;
        this.found = found;
    }

    public InsufficientHistoryException(int found) {
        super(String.format("Insufficient data points to fit a trend. Found %d points. Need at least %d.",
                found, MINIMUM_POINTS));
        this.channelId = null;
        this.metric = null;
        this.found = found;
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
