package com.skillflow.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

public class EngineMetrics {

    private final MeterRegistry registry;

    public EngineMetrics() {
        this(new SimpleMeterRegistry());
    }

    public EngineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public MeterRegistry registry() { return registry; }

    public Counter skillExecutions(String skillId, String status) {
        return Counter.builder("skillflow.skill.executions")
                .tag("skill", skillId)
                .tag("status", status)
                .register(registry);
    }

    public Timer skillDuration(String skillId) {
        return Timer.builder("skillflow.skill.duration").tag("skill", skillId).register(registry);
    }

    public Counter approvalDecisions(String decision) {
        return Counter.builder("skillflow.approval.decisions").tag("decision", decision).register(registry);
    }

    public Counter workflowRuns(String result) {
        return Counter.builder("skillflow.workflow.runs").tag("result", result).register(registry);
    }
}
