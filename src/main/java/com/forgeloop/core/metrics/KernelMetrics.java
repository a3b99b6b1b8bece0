package com.forgeloop.core.metrics;

import com.forgeloop.core.model.VoteTier;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Locale;

/**
 * Centralised Micrometer metrics for the orchestration cycle.
 */
@Service
public class KernelMetrics {

    private final MeterRegistry registry;

    public KernelMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordCycle(boolean hadWork) {
        Counter.builder("forgeloop.cycles.total")
                .tag("had_work", String.valueOf(hadWork))
                .register(registry)
                .increment();
    }

    public void recordScheduledLanes(int lanes, int speculate) {
        DistributionSummary.builder("forgeloop.schedule.lanes")
                .description("Lanes admitted per cycle")
                .register(registry)
                .record(lanes);
        DistributionSummary.builder("forgeloop.schedule.speculate_lanes")
                .description("Speculative lanes admitted per cycle")
                .register(registry)
                .record(speculate);
    }

    public void recordDispatch(String toolchain, boolean success, long ms) {
        Timer.builder("forgeloop.dispatch.duration")
                .tag("toolchain", toolchain == null ? "none" : toolchain)
                .tag("success", String.valueOf(success))
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * @param resolution "done", "ready" or "escalated"
     */
    public void recordResolution(String resolution) {
        Counter.builder("forgeloop.issues.resolved")
                .tag("resolution", resolution)
                .register(registry)
                .increment();
    }

    public void recordVote(VoteTier tier) {
        Counter.builder("forgeloop.vote.outcomes")
                .description("Speculative votes by winning tier")
                .tag("tier", tier.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    public void incrementEscalations(boolean created) {
        Counter.builder("forgeloop.escalations.total")
                .tag("created", String.valueOf(created))
                .register(registry)
                .increment();
    }

    public void recordTransitionLogFailure() {
        Counter.builder("forgeloop.transitions.failures")
                .description("Transition records that could not be stored")
                .register(registry)
                .increment();
    }

    public void recordWorkcellOperation(String operation, boolean success) {
        Counter.builder("forgeloop.workcell.operations")
                .tag("operation", operation)
                .tag("success", String.valueOf(success))
                .register(registry)
                .increment();
    }

    public void recordLaneError() {
        Counter.builder("forgeloop.lanes.errors")
                .description("Lanes that ended with an unexpected exception")
                .register(registry)
                .increment();
    }
}
