package com.controlplane.core.model;

import com.controlplane.core.exception.ValidationException;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class TaskConfigTest {

    @Test
    void validate_shouldAcceptClusterConfig() {
        TaskConfig config = new TaskConfig("prod", "do-account", CloudProvider.DIGITALOCEAN,
            Map.of("token", "secret"), null, null, null, null);

        assertThatCode(config::validate).doesNotThrowAnyException();
    }

    @Test
    void validate_shouldRejectBlankClusterName() {
        TaskConfig config = new TaskConfig("  ", "do-account", CloudProvider.DIGITALOCEAN,
            null, null, null, null, null);

        assertThatThrownBy(config::validate)
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("config.clusterName");
    }

    @Test
    void validate_shouldRejectMissingProvider() {
        TaskConfig config = new TaskConfig("prod", "do-account", null, null, null, null, null, null);

        assertThatThrownBy(config::validate)
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("config.provider");
    }

    @Test
    void withoutCredentials_shouldDropSecretsOnly() {
        TaskConfig config = new TaskConfig("prod", "do-account", CloudProvider.DIGITALOCEAN,
            Map.of("token", "secret"), null, null, NodeSpec.named("worker-1"), null);

        TaskConfig stripped = config.withoutCredentials();

        assertThat(stripped.credentials()).isEmpty();
        assertThat(stripped.node().name()).isEqualTo("worker-1");
    }
}
