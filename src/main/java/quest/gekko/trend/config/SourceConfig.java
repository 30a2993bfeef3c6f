package quest.gekko.trend.config;

import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;

@Configuration
public class SourceConfig {

    @Bean(destroyMethod = "close")
    public MongoClient mongoClient(final MetricsProperties.Source source) {
        return MongoClients.create(source.uri());
    }

    @Bean
    public MongoTemplate mongoTemplate(final MongoClient mongoClient, final MetricsProperties.Source source) {
        return new MongoTemplate(mongoClient, source.database());
    }
}
