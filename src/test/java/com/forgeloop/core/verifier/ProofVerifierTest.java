package com.forgeloop.core.verifier;

import com.forgeloop.core.model.GateResult;
import com.forgeloop.core.model.Proof;
import com.forgeloop.core.model.ProofStatus;
import com.forgeloop.core.model.Verification;
import com.forgeloop.core.model.VoteOutcome;
import com.forgeloop.core.model.VoteTier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ProofVerifierTest {

    private final ProofVerifier verifier = new ProofVerifier();

    private static Proof proof(String workcellId, ProofStatus status, boolean allPassed, double confidence,
                               Map<String, GateResult> gates) {
        return new Proof(Proof.SCHEMA_VERSION, workcellId, "I1", status, null,
                new Verification(gates, allPassed, List.of()), confidence, Map.of());
    }

    private static Map<String, GateResult> gates(String... passing) {
        var gates = new LinkedHashMap<String, GateResult>();
        for (String name : passing) {
            gates.put(name, GateResult.pass());
        }
        return gates;
    }

    @Test
    @DisplayName("All declared gates present and passing -> verified")
    void allGatesPass() {
        Proof proof = proof("wc-1", ProofStatus.SUCCESS, true, 0.7, gates("test", "lint"));
        assertTrue(verifier.verify(proof, Set.of("test", "lint")));
    }

    @Test
    @DisplayName("Missing declared gate fails even when the proof claims all_passed")
    void missingGateFailsClosed() {
        Proof proof = proof("wc-1", ProofStatus.SUCCESS, true, 0.7, gates("test"));

        assertFalse(verifier.verify(proof, Set.of("test", "lint")));
        assertEquals(Optional.of("lint"), verifier.firstFailingGate(proof, Set.of("test", "lint")));
    }

    @Test
    @DisplayName("A failed declared gate fails verification")
    void failedGate() {
        var gates = gates("test");
        gates.put("lint", GateResult.fail("E501"));
        Proof proof = proof("wc-1", ProofStatus.SUCCESS, false, 0.7, gates);

        assertFalse(verifier.verify(proof, Set.of("test", "lint")));
        assertEquals(Optional.of("lint"), verifier.firstFailingGate(proof, Set.of("test", "lint")));
    }

    @Test
    @DisplayName("Without declared gates the all_passed flag decides")
    void noDeclaredGates() {
        assertTrue(verifier.verify(proof("wc-1", ProofStatus.SUCCESS, true, 0.5, Map.of()), Set.of()));
        assertFalse(verifier.verify(proof("wc-1", ProofStatus.SUCCESS, false, 0.5, Map.of()), Set.of()));
        assertFalse(verifier.verify(null, Set.of()));
    }

    @Test
    @DisplayName("Vote picks the all_passed candidate over the failing one")
    void voteScenario() {
        Proof good = proof("wc-a", ProofStatus.SUCCESS, true, 0.9, Map.of());
        Proof bad = proof("wc-b", ProofStatus.SUCCESS, false, 0.95, Map.of());

        VoteOutcome outcome = verifier.vote(List.of(good, bad), Set.of());

        assertSame(good, outcome.proof());
        assertEquals(VoteTier.VERIFIED, outcome.tier());
        assertTrue(outcome.isVerified());
    }

    @Test
    @DisplayName("Ties on confidence are broken by the lowest workcell id")
    void tieBreak() {
        Proof b = proof("wc-b", ProofStatus.SUCCESS, true, 0.8, gates("test"));
        Proof a = proof("wc-a", ProofStatus.SUCCESS, true, 0.8, gates("test"));

        assertSame(a, verifier.vote(List.of(b, a), Set.of("test")).proof());
        assertSame(a, verifier.vote(List.of(a, b), Set.of("test")).proof());
    }

    @Test
    @DisplayName("Falls back to a claimed all_passed candidate, then to a successful one")
    void fallbackTiers() {
        Proof claimed = proof("wc-a", ProofStatus.SUCCESS, true, 0.4, gates("test"));
        Proof successful = proof("wc-b", ProofStatus.PARTIAL, false, 0.9, gates("test"));

        VoteOutcome claimedOutcome = verifier.vote(List.of(claimed, successful), Set.of("test", "lint"));
        assertEquals(VoteTier.ALL_PASSED, claimedOutcome.tier());
        assertSame(claimed, claimedOutcome.proof());
        assertFalse(claimedOutcome.isVerified());

        VoteOutcome unverified = verifier.vote(List.of(successful), Set.of("test", "lint"));
        assertEquals(VoteTier.UNVERIFIED, unverified.tier());
        assertSame(successful, unverified.proof());
    }

    @Test
    @DisplayName("A failed toolchain status is never verified, even with passing gates")
    void failedStatusNotVerified() {
        Proof failed = proof("wc-a", ProofStatus.FAILED, true, 0.9, gates("test"));

        VoteOutcome outcome = verifier.vote(List.of(failed), Set.of("test"));

        assertEquals(VoteTier.ALL_PASSED, outcome.tier());
    }

    @Test
    @DisplayName("No usable candidates -> no winner")
    void noWinner() {
        assertEquals(VoteTier.NONE, verifier.vote(List.of(), Set.of()).tier());
        assertEquals(VoteTier.NONE, verifier.vote(Arrays.asList((Proof) null), Set.of()).tier());
        Proof error = proof("wc-a", ProofStatus.ERROR, false, 0.9, Map.of());
        assertTrue(verifier.vote(List.of(error), Set.of()).winner().isEmpty());
    }
}
