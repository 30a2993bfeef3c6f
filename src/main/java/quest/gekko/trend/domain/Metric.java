package quest.gekko.trend.domain;

import java.util.Arrays;
import java.util.function.ToLongFunction;

/**
 * The metric columns of {@code channel_metrics} that can be read back as a series.
 */
public enum Metric {
    VIEW_COUNT("view_count", "viewCount", ChannelMetric::getViewCount),
    SUBSCRIBER_COUNT("subscriber_count", "subscriberCount", ChannelMetric::getSubscriberCount),
    VIDEO_COUNT("video_count", "videoCount", ChannelMetric::getVideoCount);

    private final String column;
    private final String statisticsField;
    private final ToLongFunction<ChannelMetric> accessor;

    Metric(final String column, final String statisticsField, final ToLongFunction<ChannelMetric> accessor) {
        this.column = column;
        this.statisticsField = statisticsField;
        this.accessor = accessor;
    }

    public String column() { return column; }

    /** Name of the matching field under {@code statistics} in the source documents. */
    public String statisticsField() { return statisticsField; }

    public long valueOf(final ChannelMetric row) {
        return accessor.applyAsLong(row);
    }

    /**
     * Resolves a column name ({@code subscriber_count}), a document field name ({@code subscriberCount})
     * or a constant name, ignoring case.
     */
    public static Metric fromName(final String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Metric name must not be blank");
        }
        final String wanted = name.trim();
        return Arrays.stream(values())
                .filter(m -> m.column.equalsIgnoreCase(wanted)
                        || m.statisticsField.equalsIgnoreCase(wanted)
                        || m.name().equalsIgnoreCase(wanted))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown metric '" + name
                        + "', expected one of " + Arrays.stream(values()).map(Metric::column).toList()));
    }

    @Override
    public String toString() {
        return column;
    }
}
