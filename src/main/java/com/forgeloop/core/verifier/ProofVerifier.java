package com.forgeloop.core.verifier;

import com.forgeloop.core.model.GateResult;
import com.forgeloop.core.model.Proof;
import com.forgeloop.core.model.VoteOutcome;
import com.forgeloop.core.model.VoteTier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Judges proofs against their declared quality gates and picks a winner among
 * speculative candidates. Read-only: nothing here touches the work graph or workcells.
 */
@Service
public class ProofVerifier {

    private static final Logger log = LoggerFactory.getLogger(ProofVerifier.class);

    /** Highest confidence first, then lowest workcell id. */
    static final Comparator<Proof> PREFERENCE = Comparator
            .comparingDouble(Proof::confidence).reversed()
            .thenComparing(p -> p.workcellId() == null ? "" : p.workcellId());

    /**
     * True when every declared gate is reported and passed. A declared gate missing from
     * the proof fails verification even if the proof claims {@code all_passed}. With no
     * declared gates the proof's own {@code all_passed} flag decides.
     */
    public boolean verify(Proof proof, Set<String> declaredGates) {
        if (proof == null) {
            return false;
        }
        Map<String, GateResult> reported = proof.verification().gates();
        if (declaredGates == null || declaredGates.isEmpty()) {
            return proof.verification().allPassed();
        }
        for (String gate : declaredGates) {
            GateResult result = reported.get(gate);
            if (result == null) {
                log.debug("Proof {} is missing declared gate '{}'", proof.workcellId(), gate);
                return false;
            }
            if (!result.passed()) {
                return false;
            }
        }
        return true;
    }

    /**
     * First declared gate that is missing or failed, for diagnostics.
     */
    public Optional<String> firstFailingGate(Proof proof, Set<String> declaredGates) {
        if (proof == null) {
            return Optional.empty();
        }
        Map<String, GateResult> reported = proof.verification().gates();
        if (declaredGates != null) {
            for (String gate : declaredGates.stream().sorted().toList()) {
                GateResult result = reported.get(gate);
                if (result == null || !result.passed()) {
                    return Optional.of(gate);
                }
            }
        }
        return reported.entrySet().stream()
                .filter(e -> !e.getValue().passed())
                .map(Map.Entry::getKey)
                .sorted()
                .findFirst();
    }

    /**
     * Pick the speculative winner. Successful, verified candidates win outright; failing that, the
     * best candidate claiming {@code all_passed}; failing that, the best successful one.
     * Only a {@link VoteTier#VERIFIED} outcome may be committed.
     */
    public VoteOutcome vote(List<Proof> candidates, Set<String> declaredGates) {
        if (candidates == null || candidates.isEmpty()) {
            return VoteOutcome.none();
        }
        List<Proof> present = new ArrayList<>();
        for (Proof proof : candidates) {
            if (proof != null) {
                present.add(proof);
            }
        }

        Optional<Proof> verified = best(present, p -> p.isSuccessful() && verify(p, declaredGates));
        if (verified.isPresent()) {
            return announce(new VoteOutcome(verified.get(), VoteTier.VERIFIED), present.size());
        }
        Optional<Proof> claimed = best(present, p -> p.verification().allPassed());
        if (claimed.isPresent()) {
            return announce(new VoteOutcome(claimed.get(), VoteTier.ALL_PASSED), present.size());
        }
        Optional<Proof> successful = best(present, Proof::isSuccessful);
        if (successful.isPresent()) {
            return announce(new VoteOutcome(successful.get(), VoteTier.UNVERIFIED), present.size());
        }
        return announce(VoteOutcome.none(), present.size());
    }

    private Optional<Proof> best(List<Proof> proofs, Predicate<Proof> filter) {
        return proofs.stream().filter(filter).min(PREFERENCE);
    }

    private VoteOutcome announce(VoteOutcome outcome, int candidates) {
        log.info("Vote over {} candidate(s): tier={} winner={}", candidates, outcome.tier(),
                outcome.winner().map(Proof::workcellId).orElse("none"));
        return outcome;
    }
}
