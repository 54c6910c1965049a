package com.ai.flashcards.client;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RetryPolicyTest {

    @Test
    void shouldDoubleDelayUntilMaximum() {
        RetryPolicy policy = RetryPolicy.defaultPolicy();

        assertThat(policy.getMaxRetries()).isEqualTo(2);
        assertThat(policy.delayForAttempt(0)).isEqualTo(500);
        assertThat(policy.delayForAttempt(1)).isEqualTo(1000);
        assertThat(policy.delayForAttempt(2)).isEqualTo(2000);
        assertThat(policy.delayForAttempt(3)).isEqualTo(3000);
        assertThat(policy.delayForAttempt(40)).isEqualTo(3000);
    }
}
