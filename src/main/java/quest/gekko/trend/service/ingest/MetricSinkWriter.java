package quest.gekko.trend.service.ingest;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import quest.gekko.trend.config.MetricsProperties;
import quest.gekko.trend.dto.MetricSample;
import quest.gekko.trend.exception.SinkWriteException;
import quest.gekko.trend.repository.ChannelMetricRepository;

import java.util.List;

/**
 * Appends one snapshot to {@code channel_metrics} in a single transaction. Rows whose
 * {@code (time, channel_id)} already exist are left untouched, so re-running a snapshot is harmless.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MetricSinkWriter {
    private final ChannelMetricRepository channelMetricRepository;
    private final MetricsProperties.Ingestion ingestion;

    @Transactional
    public int write(final List<MetricSample> samples) {
        if (samples == null || samples.isEmpty()) {
            throw new IllegalArgumentException("Nothing to write: sample batch is empty");
        }
        try {
            int inserted = channelMetricRepository.insertIgnoringConflicts(samples, ingestion.pageSize());
            log.debug("Appended {} of {} samples in pages of {}", inserted, samples.size(), ingestion.pageSize());
            return inserted;
        } catch (DataAccessException e) {
            throw new SinkWriteException("Bulk append of " + samples.size() + " samples failed, batch rolled back", e);
        }
    }
}
