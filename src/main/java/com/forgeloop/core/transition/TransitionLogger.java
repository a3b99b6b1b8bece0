package com.forgeloop.core.transition;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.forgeloop.core.metrics.KernelMetrics;
import com.forgeloop.core.model.DispatchResult;
import com.forgeloop.core.model.Issue;
import com.forgeloop.core.model.Manifest;
import com.forgeloop.core.model.Proof;
import com.forgeloop.core.model.StateSnapshot;
import com.forgeloop.core.model.TransitionRecord;
import com.forgeloop.core.verifier.ProofVerifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Records one transition per resolved dispatch for offline routing analysis.
 * <p>
 * The from-state is captured by {@link #begin} when the workcell is created; the
 * to-state is derived from the final verdict in {@link #record}. Storage failures are
 * logged and counted, never propagated: the transition log must not influence issue state.
 */
@Service
public class TransitionLogger {

    private static final Logger log = LoggerFactory.getLogger(TransitionLogger.class);

    static final String DOMAIN = "code";
    static final String TRANSITION_KIND = "workcell_complete";

    private final TransitionStore store;
    private final ProofVerifier verifier;
    private final ObjectMapper objectMapper;
    private final KernelMetrics metrics;
    private final ConcurrentHashMap<String, StateSnapshot> pending = new ConcurrentHashMap<>();

    public TransitionLogger(TransitionStore store, ProofVerifier verifier,
                            ObjectMapper objectMapper, KernelMetrics metrics) {
        this.store = store;
        this.verifier = verifier;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
    }

    /**
     * Capture the from-state of a dispatch as its workcell comes up.
     */
    public void begin(String workcellId, Issue issue, String toolchain) {
        try {
            pending.put(workcellId, fromState(issue, toolchain));
        } catch (RuntimeException e) {
            log.warn("Could not capture from-state for workcell {}: {}", workcellId, e.getMessage());
        }
    }

    /**
     * Drop the captured from-state of a workcell whose result will not be recorded.
     */
    public void discard(String workcellId) {
        if (workcellId != null) {
            pending.remove(workcellId);
        }
    }

    /**
     * Append the transition for a resolved dispatch. Never throws.
     *
     * @param workcellId workcell that produced the result
     * @param issue      issue as it was when scheduled
     * @param result     the dispatch result
     * @param verified   final verdict of the verifier
     */
    public void record(String workcellId, Issue issue, DispatchResult result, boolean verified) {
        try {
            StateSnapshot from = pending.remove(workcellId);
            if (from == null) {
                from = fromState(issue, result.toolchain());
            }
            StateSnapshot to = toState(issue, result, verified);

            Map<String, Object> action = new LinkedHashMap<>();
            action.put("tool", result.toolchain());
            action.put("command_class", "dispatch");
            action.put("domain", DOMAIN);

            Map<String, Object> context = new LinkedHashMap<>();
            context.put("workcell_id", workcellId);
            context.put("issue_id", issue.id());
            context.put("job_type", Manifest.JOB_TYPE_CODE);
            context.put("toolchain", result.toolchain());
            if (result.speculateTag() != null) {
                context.put("speculate_tag", result.speculateTag());
            }

            Map<String, Object> observations = new LinkedHashMap<>();
            observations.put("verified", verified);
            observations.put("success", result.success());
            observations.put("duration_ms", result.durationMs());
            observations.put("confidence", result.proofIfPresent().map(Proof::confidence).orElse(null));
            if (result.error() != null) {
                observations.put("error", result.error());
            }

            String transitionId = hash(Map.of(
                    "from", from.stateId(),
                    "to", to.stateId(),
                    "workcell", workcellId,
                    "issue", issue.id(),
                    "action", action));

            store.insert(new TransitionRecord(transitionId, TRANSITION_KIND, from, to, action,
                    context, observations, verified, Instant.now()));
            log.debug("Recorded transition {} for workcell {} ({})", transitionId, workcellId,
                    to.features().get("phase"));
        } catch (RuntimeException e) {
            metrics.recordTransitionLogFailure();
            log.warn("Failed to record transition for workcell {}: {}", workcellId, e.getMessage(), e);
        }
    }

    StateSnapshot fromState(Issue issue, String toolchain) {
        Map<String, Object> features = new TreeMap<>();
        features.put("phase", "plan");
        features.put("failing_gate", "none");
        features.put("attempt", issue.attempts());
        features.put("risk", issue.risk().wireName());
        features.put("size", issue.size());
        return snapshot(features, toolchain);
    }

    StateSnapshot toState(Issue issue, DispatchResult result, boolean verified) {
        String phase;
        if (verified) {
            phase = "verified";
        } else if (result.success()) {
            phase = "edit";
        } else {
            phase = "failed";
        }
        Set<String> declared = result.manifest() == null ? Set.of() : result.manifest().declaredGates();
        String failingGate = verified ? "none"
                : verifier.firstFailingGate(result.proof(), declared).orElse("none");

        Map<String, Object> features = new TreeMap<>();
        features.put("phase", phase);
        features.put("failing_gate", failingGate);
        features.put("attempt", issue.attempts() + 1);
        features.put("risk", issue.risk().wireName());
        features.put("size", issue.size());
        return snapshot(features, result.toolchain());
    }

    private StateSnapshot snapshot(Map<String, Object> features, String policyKey) {
        Map<String, Object> content = new TreeMap<>();
        content.put("domain", DOMAIN);
        content.put("job_type", Manifest.JOB_TYPE_CODE);
        content.put("features", features);
        content.put("policy_key", policyKey == null ? "" : policyKey);
        return new StateSnapshot(hash(content), DOMAIN, Manifest.JOB_TYPE_CODE, features, policyKey);
    }

    private String hash(Map<String, Object> content) {
        try {
            byte[] canonical = objectMapper.writeValueAsString(new TreeMap<>(content))
                    .getBytes(StandardCharsets.UTF_8);
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(canonical);
            return HexFormat.of().formatHex(digest, 0, 16);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize transition content", e);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
