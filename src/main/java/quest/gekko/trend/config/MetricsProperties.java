package quest.gekko.trend.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the document source, the time-series sink and both jobs.
 * Connection settings are fed from environment variables in application.yml; a blank value
 * fails startup before any connection is opened.
 */
@Configuration
@EnableConfigurationProperties({
        MetricsProperties.Source.class,
        MetricsProperties.Sink.class,
        MetricsProperties.Ingestion.class,
        MetricsProperties.Forecast.class
})
public class MetricsProperties {

    @Validated
    @ConfigurationProperties("metrics.source")
    public record Source(@NotBlank String uri, @NotBlank String database, @NotBlank String collection) {}

    @Validated
    @ConfigurationProperties("metrics.sink")
    public record Sink(@NotBlank String host,
                       @NotNull @Positive Integer port,
                       @NotBlank String database,
                       @NotBlank String user,
                       @NotBlank String password,
                       @DefaultValue("require") String sslMode) {

        public String jdbcUrl() {
            return "jdbc:postgresql://" + host + ":" + port + "/" + database + "?sslmode=" + sslMode;
        }

        @Override
        public String toString() {
            return "Sink[host=" + host + ", port=" + port + ", database=" + database + ", user=" + user + "]";
        }
    }

    @Validated
    @ConfigurationProperties("metrics.ingestion")
    public record Ingestion(@DefaultValue("1000") @Positive int pageSize,
                            @DefaultValue("data.channel_info") String documentRoot) {}

    @Validated
    @ConfigurationProperties("metrics.forecast")
    public record Forecast(@DefaultValue("60") @Positive int defaultHorizon,
                           @DefaultValue("subscriber_count") @NotBlank String defaultMetric,
                           @DefaultValue("0.80") @DecimalMin(value = "0.0", inclusive = false)
                           @DecimalMax(value = "1.0", inclusive = false) double intervalWidth) {}
}
