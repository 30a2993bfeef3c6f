package quest.gekko.trend.runner;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import quest.gekko.trend.config.MetricsProperties;
import quest.gekko.trend.domain.Metric;
import quest.gekko.trend.dto.ForecastPoint;
import quest.gekko.trend.dto.IngestionReport;
import quest.gekko.trend.exception.ChannelTrendException;
import quest.gekko.trend.exception.ForecastModelException;
import quest.gekko.trend.exception.InsufficientHistoryException;
import quest.gekko.trend.service.forecast.ForecastService;
import quest.gekko.trend.service.ingest.IngestionService;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Command line entry point.
 * <pre>
 *   (no arguments) | ingest                                      one ingestion run
 *   forecast --channel=ID [--horizon=60] [--metric=subscriber_count]
 * </pre>
 * A failed ingestion fails the process. A forecast that cannot be produced prints {@code None} and
 * sets a distinct exit code instead.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PipelineCommandRunner implements ApplicationRunner, ExitCodeGenerator {
    static final int EXIT_INSUFFICIENT_DATA = 2;
    static final int EXIT_MODEL_FAILURE = 3;
    static final int EXIT_USAGE = 64;

    private final IngestionService ingestionService;
    private final ForecastService forecastService;
    private final MetricsProperties.Forecast forecastProperties;

    private int exitCode;

    @Override
    public void run(final ApplicationArguments args) {
        List<String> commands = args.getNonOptionArgs();
        String command = commands.isEmpty() ? "ingest" : commands.get(0);
        switch (command) {
            case "ingest" -> ingest();
            case "forecast" -> forecast(args);
            default -> usage("Unknown command '" + command + "'");
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private void ingest() {
        try {
            IngestionReport report = ingestionService.runOnce();
            log.info("Ingestion completed: {}", report);
        } catch (ChannelTrendException e) {
            log.error("Ingestion failed [{}]: {}", e.getErrorCode(), e.getMessage());
            throw e;
        }
    }

    private void forecast(final ApplicationArguments args) {
        String channelId = option(args, "channel");
        if (channelId == null || channelId.isBlank()) {
            usage("forecast requires --channel=<id>");
            return;
        }

        int horizon;
        Metric metric;
        try {
            String horizonOption = option(args, "horizon");
            horizon = horizonOption == null ? forecastProperties.defaultHorizon() : Integer.parseInt(horizonOption.trim());
            String metricOption = option(args, "metric");
            metric = Metric.fromName(metricOption == null ? forecastProperties.defaultMetric() : metricOption);
        } catch (IllegalArgumentException e) {
            usage(e.getMessage());
            return;
        }
        if (horizon <= 0) {
            usage("--horizon must be positive");
            return;
        }

        try {
            List<ForecastPoint> predictions = forecastService.forecast(channelId, horizon, metric);
            System.out.println();
            System.out.println("--- Predictions for the next " + horizon + " days ---");
            System.out.print(ForecastTable.render(predictions));
        } catch (InsufficientHistoryException e) {
            log.warn(e.getMessage());
            System.out.println("None");
            exitCode = EXIT_INSUFFICIENT_DATA;
        } catch (ForecastModelException e) {
            log.error("Error training forecast model for channel '{}': {}", channelId, e.getMessage(), e);
            System.out.println("None");
            exitCode = EXIT_MODEL_FAILURE;
        }
    }

    private void usage(final String problem) {
        log.error("{}. Usage: [ingest] | forecast --channel=<id> [--horizon=<days>] [--metric=<{}>]",
                problem, Arrays.stream(Metric.values()).map(Metric::column).collect(Collectors.joining("|")));
        exitCode = EXIT_USAGE;
    }

    private static String option(final ApplicationArguments args, final String name) {
        List<String> values = args.getOptionValues(name);
        return values == null || values.isEmpty() ? null : values.get(values.size() - 1);
    }
}
