package quest.gekko.trend.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

/**
 * One persisted snapshot row. Rows are only ever inserted by the sink writer, the
 * composite key {@code (time, channel_id)} being the idempotency key.
 */
@Entity
@Table(name = "channel_metrics")
@Getter @Setter
public class ChannelMetric {
    @EmbeddedId
    ChannelMetricId id;

    @Column(name = "view_count", nullable = false)
    long viewCount;

    @Column(name = "subscriber_count", nullable = false)
    long subscriberCount;

    @Column(name = "video_count", nullable = false)
    long videoCount;
}
