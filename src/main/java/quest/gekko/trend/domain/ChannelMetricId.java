package quest.gekko.trend.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;

@Embeddable
@Getter
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode
public class ChannelMetricId implements Serializable {

    @Column(name = "`time`", nullable = false)
    Instant time;

    @Column(name = "channel_id", nullable = false)
    String channelId;
}
