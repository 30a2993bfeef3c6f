package quest.gekko.trend.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import quest.gekko.trend.domain.ChannelMetric;
import quest.gekko.trend.domain.ChannelMetricId;

import java.time.Instant;
import java.util.List;

public interface ChannelMetricRepository extends JpaRepository<ChannelMetric, ChannelMetricId>, ChannelMetricRepositoryCustom {
    List<ChannelMetric> findByIdChannelIdOrderByIdTimeAsc(final String channelId);

    long countByIdTime(final Instant time);
}
