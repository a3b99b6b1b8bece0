package com.forgeloop.core.routing;

import com.forgeloop.core.config.KernelProperties;
import com.forgeloop.core.model.ControlDecision;
import com.forgeloop.core.transition.TransitionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.OptionalDouble;

/**
 * Adjusts sampling temperature and speculative width from the recent verified rate.
 * <p>
 * The decision is recomputed once per cycle by {@link #refresh()} and then held
 * fixed, so every scheduling and dispatch decision inside a cycle sees the same snapshot.
 * <ul>
 *   <li>no history: {@code baseline}</li>
 *   <li>rate below {@code action-low}: {@code explore}, hotter sampling and wider fan-out</li>
 *   <li>rate above {@code action-high}: {@code exploit}, cooler sampling</li>
 *   <li>otherwise: {@code hold}</li>
 * </ul>
 */
@Service
public class ExplorationController {

    private static final Logger log = LoggerFactory.getLogger(ExplorationController.class);

    private final KernelProperties properties;
    private final TransitionStore transitionStore;
    private volatile ControlDecision current;

    public ExplorationController(KernelProperties properties, TransitionStore transitionStore) {
        this.properties = properties;
        this.transitionStore = transitionStore;
        this.current = baseline("no history yet");
    }

    public ControlDecision current() {
        return current;
    }

    public ControlDecision refresh() {
        KernelProperties.Control control = properties.getControl();
        if (!control.isEnabled()) {
            current = baseline("controller disabled");
            return current;
        }

        OptionalDouble rate;
        try {
            rate = transitionStore.verifiedRate(control.getWindow());
        } catch (RuntimeException e) {
            log.warn("Could not read verified rate, keeping baseline: {}", e.getMessage());
            rate = OptionalDouble.empty();
        }

        ControlDecision decision;
        if (rate.isEmpty()) {
            decision = baseline("no history yet");
        } else {
            decision = decide(control, rate.getAsDouble());
        }
        if (!decision.mode().equals(current.mode())) {
            log.info("Exploration mode {} -> {} ({})", current.mode(), decision.mode(), decision.reason());
        }
        current = decision;
        return decision;
    }

    private ControlDecision decide(KernelProperties.Control control, double rate) {
        int baseWidth = properties.getSpeculation().getDefaultParallelism();
        int maxWidth = properties.getSpeculation().getMaxParallelism();
        double base = control.getTemperatureBase();

        if (rate < control.getActionLow()) {
            double temperature = Math.min(control.getTemperatureMax(), base + control.getTemperatureStep());
            int width = Math.min(maxWidth, baseWidth + control.getParallelismStep());
            return new ControlDecision("explore",
                    "verified rate %.2f below %.2f".formatted(rate, control.getActionLow()),
                    rate, temperature, Math.max(1, width));
        }
        if (rate > control.getActionHigh()) {
            double temperature = Math.max(control.getTemperatureMin(), base - control.getTemperatureStep());
            return new ControlDecision("exploit",
                    "verified rate %.2f above %.2f".formatted(rate, control.getActionHigh()),
                    rate, temperature, Math.max(1, baseWidth));
        }
        return new ControlDecision("hold", "verified rate %.2f within band".formatted(rate),
                rate, base, Math.max(1, baseWidth));
    }

    private ControlDecision baseline(String reason) {
        return new ControlDecision("baseline", reason, null,
                properties.getControl().getTemperatureBase(),
                Math.max(1, properties.getSpeculation().getDefaultParallelism()));
    }
}
