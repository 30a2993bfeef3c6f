package quest.gekko.trend.dto;

import java.time.Instant;

public record SeriesPoint(Instant time, double value) {}
