package quest.gekko.trend.service.ingest;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import quest.gekko.trend.dto.IngestionReport;
import quest.gekko.trend.dto.NormalizedBatch;
import quest.gekko.trend.exception.SinkWriteException;
import quest.gekko.trend.exception.SourceReadException;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Map;
import java.util.stream.Stream;

/**
 * One ingestion run: extract, normalize, append. The capture time is taken once so every row of
 * the run shares the same {@code time}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IngestionService {
    private final ChannelDocumentSource documentSource;
    private final ChannelStatsNormalizer normalizer;
    private final MetricSinkWriter sinkWriter;
    private final Clock clock;

    public IngestionReport runOnce() {
        // timestamptz keeps microseconds
        Instant capturedAt = clock.instant().truncatedTo(ChronoUnit.MICROS);
        log.info("Starting channel metrics ingestion at {}", capturedAt);

        NormalizedBatch batch = readSnapshot(capturedAt);
        log.info("Read {} channel documents: {} samples, {} without id, {} rejected",
                batch.documentsRead(), batch.samples().size(), batch.skippedMissingId(), batch.rejected());

        if (batch.isEmpty()) {
            log.info("No data collected from the document source, nothing written");
            return IngestionReport.of(batch, 0);
        }

        int inserted;
        try {
            inserted = sinkWriter.write(batch.samples());
        } catch (TransactionException e) {
            throw new SinkWriteException("Committing snapshot " + capturedAt + " failed", e);
        }
        log.info("Inserted {} records for snapshot {} ({} already present)",
                inserted, capturedAt, batch.samples().size() - inserted);
        return IngestionReport.of(batch, inserted);
    }

    private NormalizedBatch readSnapshot(final Instant capturedAt) {
        try (Stream<Map<String, Object>> cursor = documentSource.openCursor()) {
            return normalizer.normalize(cursor, capturedAt);
        } catch (DataAccessException e) {
            throw new SourceReadException("Reading channel documents failed", e);
        }
    }
}
