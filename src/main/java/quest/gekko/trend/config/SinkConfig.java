package quest.gekko.trend.config;

import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

@Configuration
public class SinkConfig {

    @Bean
    public DataSource dataSource(final MetricsProperties.Sink sink) {
        return DataSourceBuilder.create()
                .driverClassName("org.postgresql.Driver")
                .url(sink.jdbcUrl())
                .username(sink.user())
                .password(sink.password())
                .build();
    }
}
