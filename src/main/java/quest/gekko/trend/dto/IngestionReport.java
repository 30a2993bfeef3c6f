package quest.gekko.trend.dto;

import java.time.Instant;

public record IngestionReport(
        Instant capturedAt,

        int documentsRead,
        int samples,
        int skippedMissingId,
        int rejected,
        int inserted
) {
    public static IngestionReport of(final NormalizedBatch batch, final int inserted) {
        return new IngestionReport(batch.capturedAt(), batch.documentsRead(), batch.samples().size(),
                batch.skippedMissingId(), batch.rejected(), inserted);
    }
}
