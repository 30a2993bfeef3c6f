package quest.gekko.trend.repository;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import quest.gekko.trend.dto.MetricSample;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

@RequiredArgsConstructor
public class ChannelMetricRepositoryCustomImpl implements ChannelMetricRepositoryCustom {
    // No conflict target: the primary key (time, channel_id) is the only unique constraint
    private static final String INSERT_IGNORING_CONFLICTS = """
            INSERT INTO channel_metrics ("time", channel_id, view_count, subscriber_count, video_count)
            VALUES (?, ?, ?, ?, ?)
            ON CONFLICT DO NOTHING
            """;

    private final JdbcTemplate jdbc;

    @Override
    public int insertIgnoringConflicts(final List<MetricSample> samples, final int pageSize) {
        int[][] pages = jdbc.batchUpdate(INSERT_IGNORING_CONFLICTS, samples, pageSize, (ps, sample) -> {
            ps.setObject(1, OffsetDateTime.ofInstant(sample.capturedAt(), ZoneOffset.UTC));
            ps.setString(2, sample.entityId());
            ps.setLong(3, sample.viewCount());
            ps.setLong(4, sample.subscriberCount());
            ps.setLong(5, sample.videoCount());
        });

        int inserted = 0;
        for (int[] page : pages) {
            for (int count : page) {
                if (count > 0) inserted += count;
            }
        }
        return inserted;
    }
}
