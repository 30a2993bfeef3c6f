package quest.gekko.trend.domain;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MetricTest {

    @Test
    void resolvesColumnFieldAndConstantNames() {
        assertThat(Metric.fromName("subscriber_count")).isEqualTo(Metric.SUBSCRIBER_COUNT);
        assertThat(Metric.fromName("viewCount")).isEqualTo(Metric.VIEW_COUNT);
        assertThat(Metric.fromName(" VIDEO_COUNT ")).isEqualTo(Metric.VIDEO_COUNT);
    }

    @Test
    void unknownOrInjectedNamesAreRejected() {
        assertThatThrownBy(() -> Metric.fromName("likes")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Metric.fromName("view_count; DROP TABLE channel_metrics"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Metric.fromName(" ")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void readsMatchingColumnFromRow() {
        ChannelMetric row = new ChannelMetric();
        row.setId(new ChannelMetricId(Instant.EPOCH, "A"));
        row.setViewCount(100);
        row.setSubscriberCount(10);
        row.setVideoCount(5);

        assertThat(Metric.VIEW_COUNT.valueOf(row)).isEqualTo(100);
        assertThat(Metric.SUBSCRIBER_COUNT.valueOf(row)).isEqualTo(10);
        assertThat(Metric.VIDEO_COUNT.valueOf(row)).isEqualTo(5);
    }
}
