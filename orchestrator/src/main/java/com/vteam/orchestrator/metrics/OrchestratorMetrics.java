package com.vteam.orchestrator.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Micrometer meters for the orchestrator.
 */
@Service
public class OrchestratorMetrics {

    private final MeterRegistry registry;

    public OrchestratorMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordEvent(String type) {
        Counter.builder("vteam.workflow.events")
                .tag("type", type)
                .register(registry)
                .increment();
    }

    /**
     * @param outcome "changed", "unchanged", "lost_race" or "unavailable"
     */
    public void recordReconcile(String outcome, Duration elapsed) {
        Timer.builder("vteam.reconcile.duration")
                .tag("outcome", outcome)
                .register(registry)
                .record(elapsed);
    }

    /**
     * @param outcome "launched" or "failed"
     */
    public void recordLaunch(String phase, String outcome) {
        Counter.builder("vteam.agent.launches")
                .tag("phase", phase)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }
}
