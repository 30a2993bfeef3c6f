package quest.gekko.trend.runner;

import quest.gekko.trend.dto.ForecastPoint;

import java.util.List;
import java.util.Locale;

final class ForecastTable {
    private static final String ROW = "%-22s %16s %16s %16s%n";

    private ForecastTable() {}

    static String render(final List<ForecastPoint> predictions) {
        StringBuilder table = new StringBuilder();
        table.append(String.format(Locale.ROOT, ROW, "ds", "yhat", "yhat_lower", "yhat_upper"));
        for (ForecastPoint p : predictions) {
            table.append(String.format(Locale.ROOT, ROW, p.timestamp(),
                    decimal(p.pointEstimate()), decimal(p.lowerBound()), decimal(p.upperBound())));
        }
        return table.toString();
    }

    private static String decimal(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }
}
