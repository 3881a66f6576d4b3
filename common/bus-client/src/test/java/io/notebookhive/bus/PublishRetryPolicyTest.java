package io.notebookhive.bus;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class PublishRetryPolicyTest {

    @Test
    void backoffGrowsExponentiallyAndIsCapped() {
        PublishRetryPolicy policy =
            new PublishRetryPolicy(6, Duration.ofMillis(200), 2.0, Duration.ofMillis(1000));

        assertThat(policy.backoffAfter(1)).isEqualTo(Duration.ofMillis(200));
        assertThat(policy.backoffAfter(2)).isEqualTo(Duration.ofMillis(400));
        assertThat(policy.backoffAfter(3)).isEqualTo(Duration.ofMillis(800));
        assertThat(policy.backoffAfter(4)).isEqualTo(Duration.ofMillis(1000));
    }

    @Test
    void multiplierBelowOneKeepsDelayConstant() {
        PublishRetryPolicy policy =
            new PublishRetryPolicy(3, Duration.ofMillis(50), 0.5, Duration.ofSeconds(1));

        assertThat(policy.backoffAfter(3)).isEqualTo(Duration.ofMillis(50));
    }

    @Test
    void requiresAtLeastOneAttempt() {
        assertThatThrownBy(() -> new PublishRetryPolicy(0, Duration.ZERO, 1.0, Duration.ZERO))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
