package quest.gekko.trend.dto;

import java.time.Instant;
import java.util.List;

/**
 * Output of one normalization pass: the samples plus what was left out and why.
 */
public record NormalizedBatch(
        Instant capturedAt,
        List<MetricSample> samples,

        int documentsRead,
        int skippedMissingId,
        int rejected
) {
    public NormalizedBatch {
        samples = List.copyOf(samples);
    }

    public boolean isEmpty() {
        return samples.isEmpty();
    }
}
