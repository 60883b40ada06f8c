package tech.cids.platform.discovery.retry;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class BackoffPolicyTest {

    @Test
    @DisplayName("baseDelay should grow by the factor and stop at the cap")
    void baseDelay_shouldGrowExponentially_andCap() {
        BackoffPolicy policy = new BackoffPolicy(Duration.ofSeconds(1), 2.0, Duration.ofSeconds(5), 0.1, () -> 0.0);

        assertThat(policy.baseDelay(0)).isEqualTo(Duration.ofSeconds(1));
        assertThat(policy.baseDelay(1)).isEqualTo(Duration.ofSeconds(2));
        assertThat(policy.baseDelay(2)).isEqualTo(Duration.ofSeconds(4));
        assertThat(policy.baseDelay(3)).isEqualTo(Duration.ofSeconds(5));
        assertThat(policy.baseDelay(30)).isEqualTo(Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("nextDelay should add jitter proportional to the capped delay")
    void nextDelay_shouldAddBoundedJitter() {
        BackoffPolicy noJitter = new BackoffPolicy(Duration.ofSeconds(1), 2.0, Duration.ofSeconds(5), 0.5, () -> 0.0);
        BackoffPolicy halfJitter = new BackoffPolicy(Duration.ofSeconds(1), 2.0, Duration.ofSeconds(5), 0.5, () -> 0.5);

        assertThat(noJitter.nextDelay(1)).isEqualTo(Duration.ofSeconds(2));
        assertThat(halfJitter.nextDelay(1)).isEqualTo(Duration.ofMillis(2500));
        assertThat(halfJitter.nextDelay(10)).isEqualTo(Duration.ofMillis(6250));
    }

    @Test
    @DisplayName("nextDelay should clamp out-of-range jitter samples")
    void nextDelay_shouldClampJitterSample() {
        BackoffPolicy policy = new BackoffPolicy(Duration.ofSeconds(1), 2.0, Duration.ofSeconds(5), 0.5, () -> 7.0);

        assertThat(policy.nextDelay(0)).isEqualTo(Duration.ofMillis(1500));
    }

    @Test
    @DisplayName("constructor should reject a shrinking factor and negative values")
    void constructor_shouldRejectInvalidSettings() {
        assertThatThrownBy(() -> new BackoffPolicy(Duration.ofSeconds(1), 0.5, Duration.ofSeconds(5), 0.1))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BackoffPolicy(Duration.ofSeconds(-1), 2.0, Duration.ofSeconds(5), 0.1))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BackoffPolicy(Duration.ofSeconds(1), 2.0, Duration.ofSeconds(5), -0.1))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
