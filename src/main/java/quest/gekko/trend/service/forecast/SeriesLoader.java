package quest.gekko.trend.service.forecast;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import quest.gekko.trend.domain.ChannelMetric;
import quest.gekko.trend.domain.Metric;
import quest.gekko.trend.dto.SeriesPoint;
import quest.gekko.trend.exception.InsufficientHistoryException;
import quest.gekko.trend.repository.ChannelMetricRepository;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class SeriesLoader {
    private final ChannelMetricRepository channelMetricRepository;

    /**
     * Full history of one metric for one channel, oldest first.
     *
     * @throws InsufficientHistoryException if fewer than two observations exist
     */
    @Transactional(readOnly = true)
    public List<SeriesPoint> load(final String channelId, final Metric metric) {
        List<ChannelMetric> rows = channelMetricRepository.findByIdChannelIdOrderByIdTimeAsc(channelId);
        if (rows.size() < InsufficientHistoryException.MINIMUM_POINTS) {
            throw new InsufficientHistoryException(channelId, metric, rows.size());
        }
        log.info("Retrieved {} data points of {} for channel '{}'", rows.size(), metric, channelId);
        return rows.stream()
                .map(row -> new SeriesPoint(row.getId().getTime(), metric.valueOf(row)))
                .toList();
    }
}
