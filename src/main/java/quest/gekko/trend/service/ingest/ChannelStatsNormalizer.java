package quest.gekko.trend.service.ingest;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import quest.gekko.trend.config.MetricsProperties;
import quest.gekko.trend.domain.Metric;
import quest.gekko.trend.dto.MetricSample;
import quest.gekko.trend.dto.NormalizedBatch;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Turns raw channel documents into {@link MetricSample}s. A document without id is skipped quietly;
 * a document with a statistic that is present but not a non-negative integer is rejected with a
 * warning. Neither aborts the batch. Absent statistics count as zero.
 */
@Slf4j
@Component
public class ChannelStatsNormalizer {
    private static final String ID = "id";
    private static final String STATISTICS = "statistics";

    private final List<String> rootPath;

    public ChannelStatsNormalizer(final MetricsProperties.Ingestion ingestion) {
        String root = ingestion.documentRoot();
        this.rootPath = root == null || root.isBlank() ? List.of() : Arrays.asList(root.trim().split("\\."));
    }

    public NormalizedBatch normalize(final Stream<? extends Map<String, Object>> documents, final Instant capturedAt) {
        Objects.requireNonNull(capturedAt, "capturedAt");
        List<MetricSample> samples = new ArrayList<>();
        int read = 0;
        int skipped = 0;
        int rejected = 0;

        Iterator<? extends Map<String, Object>> cursor = documents.iterator();
        while (cursor.hasNext()) {
            Map<String, Object> document = cursor.next();
            read++;
            try {
                Map<String, Object> root = resolve(document, rootPath);
                String channelId = channelId(root);
                if (channelId == null) {
                    skipped++;
                    log.debug("Skipping channel document {} without id", document.get("_id"));
                    continue;
                }
                Map<String, Object> statistics = child(root, STATISTICS);
                samples.add(new MetricSample(capturedAt, channelId,
                        count(statistics, Metric.VIEW_COUNT),
                        count(statistics, Metric.SUBSCRIBER_COUNT),
                        count(statistics, Metric.VIDEO_COUNT)));
            } catch (MalformedDocumentException e) {
                rejected++;
                log.warn("Could not convert channel document {}: {}", document.get("_id"), e.getMessage());
            }
        }
        return new NormalizedBatch(capturedAt, samples, read, skipped, rejected);
    }

    private static Map<String, Object> resolve(final Map<String, Object> document, final List<String> path)
            throws MalformedDocumentException {
        Map<String, Object> current = document;
        for (String key : path) {
            current = child(current, key);
        }
        return current;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> child(final Map<String, Object> parent, final String key)
            throws MalformedDocumentException {
        Object value = parent.get(key);
        if (value == null) return Map.of();
        if (value instanceof Map<?, ?> map) return (Map<String, Object>) map;
        throw new MalformedDocumentException("'" + key + "' is not a document but " + value.getClass().getSimpleName());
    }

    private static String channelId(final Map<String, Object> root) {
        Object id = root.get(ID);
        if (id == null) return null;
        String value = id.toString().trim();
        return value.isEmpty() ? null : value;
    }

    private static long count(final Map<String, Object> statistics, final Metric metric)
            throws MalformedDocumentException {
        Object raw = statistics.get(metric.statisticsField());
        long value;
        try {
            value = toLong(raw);
        } catch (NumberFormatException | ArithmeticException e) {
            throw new MalformedDocumentException(metric.statisticsField() + "=" + raw + " is not an integer");
        }
        if (value < 0) {
            throw new MalformedDocumentException(metric.statisticsField() + "=" + raw + " is negative");
        }
        return value;
    }

    static long toLong(final Object raw) {
        if (raw == null) return 0L;
        if (raw instanceof Long || raw instanceof Integer || raw instanceof Short || raw instanceof Byte) {
            return ((Number) raw).longValue();
        }
        if (raw instanceof Number number) {
            // Decimal128, Double and friends: truncate toward zero, NaN and infinities fail to parse
            return new BigDecimal(number.toString()).toBigInteger().longValueExact();
        }
        if (raw instanceof CharSequence text) {
            return Long.parseLong(text.toString().trim());
        }
        throw new NumberFormatException("unsupported type " + raw.getClass().getSimpleName());
    }

    private static final class MalformedDocumentException extends Exception {
        MalformedDocumentException(String message) {
            super(message);
        }
    }
}
