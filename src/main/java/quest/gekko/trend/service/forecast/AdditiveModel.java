package quest.gekko.trend.service.forecast;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularMatrixException;
import quest.gekko.trend.dto.ForecastPoint;
import quest.gekko.trend.dto.SeriesPoint;
import quest.gekko.trend.exception.ForecastModelException;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Linear trend plus optional weekly and yearly Fourier seasonality, fitted by ridge-penalized
 * least squares on a day-based time axis. Seasonal coefficients are shrunk, trend ones are not.
 * Instances are immutable and built per fit.
 */
final class AdditiveModel {
    static final double SECONDS_PER_DAY = 86_400.0;

    static final double WEEK_DAYS = 7.0;
    static final int WEEKLY_ORDER = 3;
    static final double WEEKLY_MIN_SPAN_DAYS = 14.0;

    static final double YEAR_DAYS = 365.25;
    static final int YEARLY_ORDER = 10;
    static final double YEARLY_MIN_SPAN_DAYS = 730.0;

    // 1 / prior_scale^2 with a seasonality prior scale of 10
    private static final double SEASONAL_PENALTY = 0.01;
    private static final double PIVOT_TOLERANCE = 1e-10;

    private final Instant origin;
    private final double span;
    private final double scale;
    private final boolean weekly;
    private final boolean yearly;
    private final RealVector beta;
    private final RealMatrix covariance;
    private final double sigma;

    private AdditiveModel(Instant origin, double span, double scale, boolean weekly, boolean yearly,
                          RealVector beta, RealMatrix covariance, double sigma) {
        this.origin = origin;
        this.span = span;
        this.scale = scale;
        this.weekly = weekly;
        this.yearly = yearly;
        this.beta = beta;
        this.covariance = covariance;
        this.sigma = sigma;
    }

    static AdditiveModel fit(final List<SeriesPoint> history) {
        int n = history.size();
        Instant origin = history.get(0).time();
        double[] t = new double[n];
        double[] y = new double[n];
        double scale = 0.0;
        Instant previous = null;
        for (int i = 0; i < n; i++) {
            SeriesPoint point = history.get(i);
            if (!Double.isFinite(point.value())) {
                throw new ForecastModelException("Non-finite value " + point.value() + " at " + point.time());
            }
            if (previous != null && !point.time().isAfter(previous)) {
                throw new ForecastModelException("History is not strictly ascending at " + point.time());
            }
            previous = point.time();
            t[i] = days(origin, point.time());
            y[i] = point.value();
            scale = Math.max(scale, Math.abs(point.value()));
        }
        double span = t[n - 1];
        if (!(span > 0.0)) {
            throw new ForecastModelException("History spans no time");
        }
        if (scale == 0.0) {
            scale = 1.0;
        }

        int trendParams = 2;
        boolean weekly = span >= WEEKLY_MIN_SPAN_DAYS && n > trendParams + 2 * WEEKLY_ORDER;
        int params = trendParams + (weekly ? 2 * WEEKLY_ORDER : 0);
        boolean yearly = span >= YEARLY_MIN_SPAN_DAYS && n > params + 2 * YEARLY_ORDER;
        params += yearly ? 2 * YEARLY_ORDER : 0;

        RealMatrix design = new Array2DRowRealMatrix(n, params);
        RealVector target = new ArrayRealVector(n);
        for (int i = 0; i < n; i++) {
            design.setRow(i, features(t[i], span, weekly, yearly, params));
            target.setEntry(i, y[i] / scale);
        }
        RealMatrix gram = design.transpose().multiply(design);
        for (int a = trendParams; a < params; a++) {
            gram.addToEntry(a, a, SEASONAL_PENALTY);
        }

        RealMatrix covariance;
        try {
            covariance = new LUDecomposition(gram, PIVOT_TOLERANCE).getSolver().getInverse();
        } catch (SingularMatrixException e) {
            throw new ForecastModelException("Design matrix is singular, the series is degenerate", e);
        }
        RealVector beta = covariance.operate(design.transpose().operate(target));

        RealVector residuals = target.subtract(design.operate(beta));
        double sigma = Math.sqrt(residuals.dotProduct(residuals) / Math.max(1, n - params));
        if (!Double.isFinite(sigma)) {
            throw new ForecastModelException("Residual error is not finite");
        }
        return new AdditiveModel(origin, span, scale, weekly, yearly, beta, covariance, sigma);
    }

    /**
     * Point estimate at {@code time} with a symmetric prediction interval of {@code z} residual
     * standard errors, widened by the leverage of the point.
     */
    ForecastPoint predict(final Instant time, final double z) {
        RealVector x = new ArrayRealVector(features(days(origin, time), span, weekly, yearly, beta.getDimension()), false);
        double estimate = x.dotProduct(beta) * scale;
        double leverage = Math.max(0.0, x.dotProduct(covariance.operate(x)));
        double halfWidth = z * sigma * Math.sqrt(1.0 + leverage) * scale;
        if (!Double.isFinite(estimate) || !Double.isFinite(halfWidth)) {
            throw new ForecastModelException("Projection at " + time + " is not finite");
        }
        return new ForecastPoint(time, estimate, estimate - halfWidth, estimate + halfWidth);
    }

    boolean hasWeeklySeasonality() { return weekly; }

    boolean hasYearlySeasonality() { return yearly; }

    private static double[] features(double day, double span, boolean weekly, boolean yearly, int params) {
        double[] x = new double[params];
        x[0] = 1.0;
        x[1] = day / span;
        int next = 2;
        if (weekly) next = fourier(x, next, day, WEEK_DAYS, WEEKLY_ORDER);
        if (yearly) fourier(x, next, day, YEAR_DAYS, YEARLY_ORDER);
        return x;
    }

    private static int fourier(double[] x, int offset, double day, double period, int order) {
        for (int k = 1; k <= order; k++) {
            double angle = 2.0 * Math.PI * k * day / period;
            x[offset++] = Math.sin(angle);
            x[offset++] = Math.cos(angle);
        }
        return offset;
    }

    private static double days(Instant from, Instant to) {
        Duration between = Duration.between(from, to);
        return (between.getSeconds() + between.getNano() / 1e9) / SECONDS_PER_DAY;
    }
}
