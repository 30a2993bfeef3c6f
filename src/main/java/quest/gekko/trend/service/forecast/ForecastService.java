package quest.gekko.trend.service.forecast;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import quest.gekko.trend.domain.Metric;
import quest.gekko.trend.dto.ForecastPoint;
import quest.gekko.trend.dto.SeriesPoint;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class ForecastService {
    private final SeriesLoader seriesLoader;
    private final Forecaster forecaster;

    /**
     * Loads the channel's history of {@code metric} and projects it {@code horizonDays} days ahead.
     *
     * @throws quest.gekko.trend.exception.InsufficientHistoryException with fewer than two observations;
     *         no model is fitted in that case
     * @throws quest.gekko.trend.exception.ForecastModelException if the model cannot be fitted
     */
    public List<ForecastPoint> forecast(final String channelId, final int horizonDays, final Metric metric) {
        if (horizonDays <= 0) {
            throw new IllegalArgumentException("Horizon must be positive, got " + horizonDays);
        }
        log.info("Starting prediction of {} for channel '{}'", metric, channelId);

        List<SeriesPoint> history = seriesLoader.load(channelId, metric);
        List<ForecastPoint> predictions = forecaster.forecast(history, horizonDays);

        log.info("Generated {} predictions for the next {} days", predictions.size(), horizonDays);
        return predictions;
    }
}
