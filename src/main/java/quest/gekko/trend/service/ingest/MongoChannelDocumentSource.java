package quest.gekko.trend.service.ingest;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Service;
import quest.gekko.trend.config.MetricsProperties;
import quest.gekko.trend.domain.Metric;

import java.util.Map;
import java.util.stream.Stream;

@Slf4j
@Service
@RequiredArgsConstructor
public class MongoChannelDocumentSource implements ChannelDocumentSource {
    private final MongoTemplate mongoTemplate;
    private final MetricsProperties.Source source;
    private final MetricsProperties.Ingestion ingestion;

    @Override
    public Stream<Map<String, Object>> openCursor() {
        Query query = projection(ingestion.documentRoot());
        log.debug("Streaming collection '{}' with projection {}", source.collection(), query.getFieldsObject());
        return mongoTemplate.stream(query, Document.class, source.collection())
                .<Map<String, Object>>map(document -> document);
    }

    static Query projection(final String documentRoot) {
        String prefix = documentRoot == null || documentRoot.isBlank() ? "" : documentRoot.trim() + ".";
        Query query = new Query();
        query.fields().include(prefix + "id");
        for (Metric metric : Metric.values()) {
            query.fields().include(prefix + "statistics." + metric.statisticsField());
        }
        return query;
    }
}
