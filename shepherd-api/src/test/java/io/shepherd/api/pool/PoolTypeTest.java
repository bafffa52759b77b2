package io.shepherd.api.pool;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PoolTypeTest {

    @Test
    void shouldCompareByValue() {
        assertThat(PoolType.of("working")).isEqualTo(PoolType.WORKING);
        assertThat(PoolType.SCHEDULER).hasToString("scheduler");
    }

    @Test
    void shouldRejectBlankValue() {
        assertThatThrownBy(() -> PoolType.of(" ")).isInstanceOf(IllegalArgumentException.class);
    }
}
