package quest.gekko.trend.service.forecast;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.springframework.stereotype.Component;
import quest.gekko.trend.config.MetricsProperties;
import quest.gekko.trend.dto.ForecastPoint;
import quest.gekko.trend.dto.SeriesPoint;
import quest.gekko.trend.exception.InsufficientHistoryException;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Stateless forecaster: every call fits a new {@link AdditiveModel} and projects whole days after the
 * last observation, so no fitted in-sample point ever reaches the output.
 */
@Slf4j
@Component
public class AdditiveTrendForecaster implements Forecaster {
    private final double intervalWidth;
    private final double z;

    public AdditiveTrendForecaster(final MetricsProperties.Forecast forecast) {
        this.intervalWidth = forecast.intervalWidth();
        this.z = new NormalDistribution().inverseCumulativeProbability(0.5 + intervalWidth / 2.0);
    }

    @Override
    public List<ForecastPoint> forecast(final List<SeriesPoint> history, final int horizonDays) {
        if (horizonDays <= 0) {
            throw new IllegalArgumentException("Horizon must be positive, got " + horizonDays);
        }
        if (history == null || history.size() < InsufficientHistoryException.MINIMUM_POINTS) {
            throw new InsufficientHistoryException(history == null ? 0 : history.size());
        }

        AdditiveModel model = AdditiveModel.fit(history);
        log.debug("Fitted additive model on {} points (weekly={}, yearly={}, interval={})", history.size(),
                model.hasWeeklySeasonality(), model.hasYearlySeasonality(), intervalWidth);

        Instant last = history.get(history.size() - 1).time();
        List<ForecastPoint> projection = new ArrayList<>(horizonDays);
        for (int day = 1; day <= horizonDays; day++) {
            projection.add(model.predict(last.plus(day, ChronoUnit.DAYS), z));
        }
        return projection;
    }
}
