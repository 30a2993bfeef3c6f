package quest.gekko.trend.dto;

import java.time.Instant;

public record ForecastPoint(
        Instant timestamp,

        double pointEstimate,
        double lowerBound,
        double upperBound
) {}
