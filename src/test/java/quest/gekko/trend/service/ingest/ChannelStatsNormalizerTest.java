package quest.gekko.trend.service.ingest;

import org.bson.Document;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import quest.gekko.trend.config.MetricsProperties;
import quest.gekko.trend.dto.MetricSample;
import quest.gekko.trend.dto.NormalizedBatch;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class ChannelStatsNormalizerTest {

    private static final Instant CAPTURED_AT = Instant.parse("2025-03-01T02:10:00Z");

    private final ChannelStatsNormalizer normalizer =
            new ChannelStatsNormalizer(new MetricsProperties.Ingestion(1000, "data.channel_info"));

    @Test
    void wellFormedDocumentBecomesSample() {
        NormalizedBatch batch = normalize(channel("doc-1", "A", stats("100", "10", "5")));

        assertThat(batch.samples()).containsExactly(new MetricSample(CAPTURED_AT, "A", 100, 10, 5));
        assertThat(batch.documentsRead()).isEqualTo(1);
        assertThat(batch.rejected()).isZero();
        assertThat(batch.skippedMissingId()).isZero();
    }

    @Test
    void documentWithoutIdIsSkippedWithoutCountingAsFailure() {
        NormalizedBatch batch = normalize(
                channel("doc-1", null, stats("1", "2", "3")),
                channel("doc-2", "  ", stats("1", "2", "3")),
                new Document("_id", "doc-3"));

        assertThat(batch.samples()).isEmpty();
        assertThat(batch.skippedMissingId()).isEqualTo(3);
        assertThat(batch.rejected()).isZero();
        assertThat(batch.isEmpty()).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"viewCount", "subscriberCount", "videoCount"})
    void nonNumericStatisticRejectsOnlyThatDocument(String field) {
        Map<String, Object> bad = stats("100", "10", "5");
        bad.put(field, "abc");

        NormalizedBatch batch = normalize(
                channel("doc-1", "A", stats("1", "1", "1")),
                channel("doc-2", "B", bad),
                channel("doc-3", "C", stats("3", "3", "3")));

        assertThat(batch.samples()).extracting(MetricSample::entityId).containsExactly("A", "C");
        assertThat(batch.rejected()).isEqualTo(1);
    }

    @Test
    void absentOrNullStatisticDefaultsToZero() {
        Map<String, Object> partial = new HashMap<>();
        partial.put("viewCount", "42");
        partial.put("videoCount", null);

        NormalizedBatch batch = normalize(
                channel("doc-1", "A", partial),
                new Document("data", new Document("channel_info", new Document("id", "B"))));

        assertThat(batch.samples()).containsExactly(
                new MetricSample(CAPTURED_AT, "A", 42, 0, 0),
                new MetricSample(CAPTURED_AT, "B", 0, 0, 0));
    }

    @Test
    void numericTypesAreAcceptedAndDecimalsTruncated() {
        Map<String, Object> typed = new HashMap<>();
        typed.put("viewCount", 1_000_000_000_000L);
        typed.put("subscriberCount", 12.9d);
        typed.put("videoCount", new BigDecimal("7"));

        NormalizedBatch batch = normalize(channel("doc-1", "A", typed),
                channel("doc-2", "B", stats(" 15 ", "+3", "0")));

        assertThat(batch.samples()).containsExactly(
                new MetricSample(CAPTURED_AT, "A", 1_000_000_000_000L, 12, 7),
                new MetricSample(CAPTURED_AT, "B", 15, 3, 0));
    }

    @Test
    void unconvertibleValuesAreRejectedRatherThanZeroFilled() {
        Map<String, Object> fractionalText = stats("1.5", "1", "1");
        Map<String, Object> negative = stats("-4", "1", "1");
        Map<String, Object> bool = stats("1", "1", "1");
        bool.put("videoCount", Boolean.TRUE);
        Map<String, Object> notANumber = stats("1", "1", "1");
        notANumber.put("viewCount", Double.NaN);

        NormalizedBatch batch = normalize(
                channel("d1", "A", fractionalText),
                channel("d2", "B", negative),
                channel("d3", "C", bool),
                channel("d4", "D", notANumber));

        assertThat(batch.samples()).isEmpty();
        assertThat(batch.rejected()).isEqualTo(4);
    }

    @Test
    void nonDocumentStatisticsIsMalformed() {
        Document doc = new Document("_id", "d1")
                .append("data", new Document("channel_info", new Document("id", "A").append("statistics", "oops")));

        NormalizedBatch batch = normalize(doc);

        assertThat(batch.samples()).isEmpty();
        assertThat(batch.rejected()).isEqualTo(1);
    }

    @Test
    void allSamplesShareTheBatchTimestamp() {
        NormalizedBatch batch = normalize(
                channel("d1", "A", stats("1", "1", "1")),
                channel("d2", "B", stats("2", "2", "2")),
                channel("d3", "C", stats("3", "3", "3")));

        assertThat(batch.samples()).extracting(MetricSample::capturedAt).containsOnly(CAPTURED_AT);
        assertThat(batch.capturedAt()).isEqualTo(CAPTURED_AT);
    }

    @Test
    void emptyRootReadsTopLevelFields() {
        ChannelStatsNormalizer flat = new ChannelStatsNormalizer(new MetricsProperties.Ingestion(1000, ""));
        Document doc = new Document("id", "A").append("statistics", new Document(stats("9", "8", "7")));

        NormalizedBatch batch = flat.normalize(Stream.of(doc), CAPTURED_AT);

        assertThat(batch.samples()).containsExactly(new MetricSample(CAPTURED_AT, "A", 9, 8, 7));
    }

    private NormalizedBatch normalize(Document... documents) {
        return normalizer.normalize(Stream.of(documents), CAPTURED_AT);
    }

    static Document channel(String documentId, String channelId, Map<String, Object> statistics) {
        Document info = new Document();
        if (channelId != null) info.append("id", channelId);
        info.append("statistics", new Document(statistics));
        return new Document("_id", documentId).append("data", new Document("channel_info", info));
    }

    static Map<String, Object> stats(String views, String subscribers, String videos) {
        Map<String, Object> stats = new HashMap<>();
        stats.put("viewCount", views);
        stats.put("subscriberCount", subscribers);
        stats.put("videoCount", videos);
        return stats;
    }

    static List<Document> scenarioDocuments() {
        return List.of(
                channel("doc-a", "A", stats("100", "10", "5")),
                channel("doc-no-id", null, stats("1", "1", "1")),
                channel("doc-bad", "C", stats("1", "abc", "1")));
    }
}
