package com.controlplane.api.steps;

import com.controlplane.core.model.CloudProvider;
import com.controlplane.core.model.TaskConfig;
import com.controlplane.core.step.CancellationToken;
import com.controlplane.core.step.StepContext;
import com.controlplane.core.step.StepException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class SimulatedStepTest {

    private static final TaskConfig CONFIG = new TaskConfig("alpha", "do-main", CloudProvider.DIGITALOCEAN,
        Map.of(), null, null, null, null);

    private final ByteArrayOutputStream output = new ByteArrayOutputStream();

    private StepContext context(CancellationToken token) {
        return new StepContext("task-1", "DigitalOceanDeleteCluster", "do_delete_keys", CONFIG, output, token);
    }

    @Test
    @DisplayName("Writes its action to the task log")
    void testLogsAction() throws Exception {
        SimulatedStep step = new SimulatedStep("do_delete_keys",
            c -> "Deleting ssh keys of cluster " + c.clusterName(), Duration.ofMillis(10), false);

        step.run(context(CancellationToken.create()));

        assertThat(output.toString(StandardCharsets.UTF_8))
            .contains("[do_delete_keys] Deleting ssh keys of cluster alpha", "[do_delete_keys] done");
    }

    @Test
    void testConfiguredFailure() {
        SimulatedStep step = new SimulatedStep("do_delete_keys", c -> "x", Duration.ZERO, true);

        assertThatThrownBy(() -> step.run(context(CancellationToken.create())))
            .isInstanceOf(StepException.class)
            .hasMessage("simulated failure of do_delete_keys");
    }

    @Test
    @DisplayName("Stops waiting once the token is cancelled")
    void testCancelled() {
        SimulatedStep step = new SimulatedStep("do_delete_keys", c -> "x", Duration.ofMinutes(5), false);
        CancellationToken token = CancellationToken.withTimeout(Duration.ofMillis(50));

        assertThatThrownBy(() -> step.run(context(token)))
            .isInstanceOf(StepException.class)
            .hasMessage("cancelled: deadline exceeded");
    }
}
