package quest.gekko.trend.service.forecast;

import quest.gekko.trend.dto.ForecastPoint;
import quest.gekko.trend.dto.SeriesPoint;

import java.util.List;

public interface Forecaster {

    /**
     * Fits a fresh model on {@code history} and projects {@code horizonDays} daily points after its
     * last observation.
     *
     * @param history at least two points, strictly ascending in time
     * @throws quest.gekko.trend.exception.ForecastModelException if the model cannot be fitted
     */
    List<ForecastPoint> forecast(List<SeriesPoint> history, int horizonDays);
}
