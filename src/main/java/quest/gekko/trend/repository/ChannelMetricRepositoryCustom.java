package quest.gekko.trend.repository;

import quest.gekko.trend.dto.MetricSample;

import java.util.List;

public interface ChannelMetricRepositoryCustom {

    /**
     * Appends the samples, silently keeping any row whose {@code (time, channel_id)} already exists.
     * Statements are sent in JDBC batches of {@code pageSize}; transaction demarcation is left to the caller.
     *
     * @return number of rows actually inserted
     */
    int insertIgnoringConflicts(final List<MetricSample> samples, final int pageSize);
}
