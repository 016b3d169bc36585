package com.skillflow.observability;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class EngineMetricsTest {

    @Test
    void countersAreSharedPerTagSet() {
        var metrics = new EngineMetrics();
        metrics.skillExecutions("read_file", "completed").increment();
        metrics.skillExecutions("read_file", "completed").increment();
        metrics.skillExecutions("read_file", "failed").increment();

        assertEquals(2.0, metrics.skillExecutions("read_file", "completed").count());
        assertEquals(1.0, metrics.skillExecutions("read_file", "failed").count());
    }

    @Test
    void registersUnderEngineNames() {
        var registry = new SimpleMeterRegistry();
        var metrics = new EngineMetrics(registry);
        metrics.approvalDecisions("approved").increment();
        metrics.workflowRuns("failed").increment();
        metrics.skillDuration("echo").record(Duration.ofMillis(5));

        assertEquals(1.0, registry.get("skillflow.approval.decisions").tag("decision", "approved").counter().count());
        assertEquals(1.0, registry.get("skillflow.workflow.runs").tag("result", "failed").counter().count());
        assertEquals(1, registry.get("skillflow.skill.duration").tag("skill", "echo").timer().count());
        assertSame(registry, metrics.registry());
    }
}
