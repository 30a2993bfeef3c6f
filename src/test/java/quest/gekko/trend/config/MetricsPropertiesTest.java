package quest.gekko.trend.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.assertj.core.api.Assertions.assertThat;

class MetricsPropertiesTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(MetricsProperties.class);

    private static final String[] COMPLETE = {
            "metrics.source.uri=mongodb://localhost:27017",
            "metrics.source.database=social",
            "metrics.source.collection=channels",
            "metrics.sink.host=tsdb.internal",
            "metrics.sink.port=5432",
            "metrics.sink.database=metrics",
            "metrics.sink.user=ingest",
            "metrics.sink.password=secret"
    };

    @Test
    void completeConfigurationBindsWithDefaults() {
        contextRunner.withPropertyValues(COMPLETE).run(context -> {
            assertThat(context).hasNotFailed();
            MetricsProperties.Sink sink = context.getBean(MetricsProperties.Sink.class);
            assertThat(sink.jdbcUrl()).isEqualTo("jdbc:postgresql://tsdb.internal:5432/metrics?sslmode=require");
            assertThat(sink.toString()).doesNotContain("secret");
            assertThat(context.getBean(MetricsProperties.Ingestion.class).pageSize()).isEqualTo(1000);
            assertThat(context.getBean(MetricsProperties.Ingestion.class).documentRoot()).isEqualTo("data.channel_info");
            assertThat(context.getBean(MetricsProperties.Forecast.class).defaultHorizon()).isEqualTo(60);
            assertThat(context.getBean(MetricsProperties.Forecast.class).intervalWidth()).isEqualTo(0.80);
        });
    }

    @Test
    void blankSourceVariableFailsStartup() {
        contextRunner.withPropertyValues(COMPLETE).withPropertyValues("metrics.source.uri=").run(context ->
                assertThat(context).hasFailed());
    }

    @Test
    void missingSinkPortFailsStartup() {
        contextRunner.withPropertyValues(COMPLETE).withPropertyValues("metrics.sink.port=").run(context ->
                assertThat(context).hasFailed());
    }

    @Test
    void intervalWidthOutsideUnitIntervalFailsStartup() {
        contextRunner.withPropertyValues(COMPLETE).withPropertyValues("metrics.forecast.interval-width=1.5")
                .run(context -> assertThat(context).hasFailed());
    }
}
