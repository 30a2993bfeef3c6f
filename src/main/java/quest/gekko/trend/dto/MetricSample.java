package quest.gekko.trend.dto;

import java.time.Instant;
import java.util.Objects;

/**
 * A normalized snapshot of one channel, ready for the sink. Every sample of one ingestion
 * run carries the same {@code capturedAt}.
 */
public record MetricSample(
        Instant capturedAt,
        String entityId,

        long viewCount,
        long subscriberCount,
        long videoCount
) {
    public MetricSample {
        Objects.requireNonNull(capturedAt, "capturedAt");
        if (entityId == null || entityId.isBlank()) {
            throw new IllegalArgumentException("entityId must not be blank");
        }
        if (viewCount < 0 || subscriberCount < 0 || videoCount < 0) {
            throw new IllegalArgumentException("Counts must be non-negative for " + entityId);
        }
    }
}
