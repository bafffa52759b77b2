package io.shepherd.api.manager;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ManagerConfigTest {

    @Test
    void shouldDefaultToUnboundedShutdown() {
        var config = ManagerConfig.create();

        assertThat(config.commandQueueCapacity()).isEqualTo(10);
        assertThat(config.shutdownTimeout()).isEmpty();
        assertThat(config.threadNamePrefix()).isEqualTo("shepherd");
    }

    @Test
    void shouldApplyFluentSettings() {
        var config = ManagerConfig.create()
                .commandQueueCapacity(32)
                .shutdownTimeout(Duration.ofSeconds(30))
                .threadNamePrefix("farm");

        assertThat(config.commandQueueCapacity()).isEqualTo(32);
        assertThat(config.shutdownTimeout()).contains(Duration.ofSeconds(30));
        assertThat(config.threadNamePrefix()).isEqualTo("farm");
    }

    @Test
    void shouldRejectInvalidValues() {
        var config = ManagerConfig.create();

        assertThatThrownBy(() -> config.commandQueueCapacity(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> config.shutdownTimeout(Duration.ofSeconds(-1)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> config.threadNamePrefix("")).isInstanceOf(IllegalArgumentException.class);
    }
}
