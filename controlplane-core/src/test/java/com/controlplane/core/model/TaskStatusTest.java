package com.controlplane.core.model;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

class TaskStatusTest {

    @Test
    void isTerminal_shouldIdentifyTerminalStates() {
        assertTrue(TaskStatus.SUCCESS.isTerminal());
        assertTrue(TaskStatus.FAILURE.isTerminal());

        assertFalse(TaskStatus.PENDING.isTerminal());
        assertFalse(TaskStatus.RUNNING.isTerminal());
    }

    @Test
    void canTransitionTo_fromPending_shouldOnlyAllowRunning() {
        assertTrue(TaskStatus.PENDING.canTransitionTo(TaskStatus.RUNNING));

        assertFalse(TaskStatus.PENDING.canTransitionTo(TaskStatus.SUCCESS));
        assertFalse(TaskStatus.PENDING.canTransitionTo(TaskStatus.FAILURE));
    }

    @Test
    void canTransitionTo_fromRunning_shouldAllowBothTerminalStates() {
        assertTrue(TaskStatus.RUNNING.canTransitionTo(TaskStatus.SUCCESS));
        assertTrue(TaskStatus.RUNNING.canTransitionTo(TaskStatus.FAILURE));

        assertFalse(TaskStatus.RUNNING.canTransitionTo(TaskStatus.PENDING));
        assertFalse(TaskStatus.RUNNING.canTransitionTo(TaskStatus.RUNNING));
    }

    @Test
    void canTransitionTo_fromTerminalStates_shouldNotAllowAny() {
        for (TaskStatus target : TaskStatus.values()) {
            assertFalse(TaskStatus.SUCCESS.canTransitionTo(target));
            assertFalse(TaskStatus.FAILURE.canTransitionTo(target));
        }
    }
}
