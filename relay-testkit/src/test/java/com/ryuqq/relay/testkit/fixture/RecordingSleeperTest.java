package com.ryuqq.relay.testkit.fixture;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * RecordingSleeper 테스트.
 *
 * @author Relay Team
 * @since 1.0.0
 */
class RecordingSleeperTest {

    @Test
    void recording_대기_시간을_순서대로_기록() {
        RecordingSleeper sleeper = RecordingSleeper.recording();

        sleeper.sleep(Duration.ofSeconds(1));
        sleeper.sleep(Duration.ofSeconds(2));

        assertThat(sleeper.delays()).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2));
        assertThat(sleeper.totalSlept()).isEqualTo(Duration.ofSeconds(3));
    }

    @Test
    void advancing_대기한_만큼_Clock_전진() {
        MutableClock clock = MutableClock.create();
        RecordingSleeper sleeper = RecordingSleeper.advancing(clock);

        sleeper.sleep(Duration.ofMillis(1500));

        assertThat(clock.instant()).isEqualTo(MutableClock.DEFAULT_START.plusMillis(1500));
    }
}
