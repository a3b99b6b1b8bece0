package com.forgeloop.core.model;

import java.util.Optional;

/**
 * Outcome of one dispatch. Collaborator failures are carried as values here,
 * never thrown across the dispatcher boundary.
 *
 * @param success      true when the toolchain returned a successful or partial proof
 * @param proof        the proof, absent when the toolchain never produced one
 * @param workcellId   workcell used, null when creation failed
 * @param issueId      issue dispatched
 * @param toolchain    toolchain chosen for this dispatch
 * @param durationMs   wall-clock duration of the dispatch
 * @param error        error text for failed dispatches
 * @param speculateTag speculate tag, null for single dispatch
 * @param workcell     live workcell the caller must release, null when creation failed
 * @param manifest     manifest handed to the toolchain, null when creation failed
 */
public record DispatchResult(
        boolean success,
        Proof proof,
        String workcellId,
        String issueId,
        String toolchain,
        long durationMs,
        String error,
        String speculateTag,
        WorkcellHandle workcell,
        Manifest manifest
) {

    public static DispatchResult completed(Proof proof, WorkcellHandle workcell, Manifest manifest,
                                           String toolchain, long durationMs) {
        proof = proof.withMissingIds(workcell.workcellId(), workcell.issueId());
        return new DispatchResult(proof.isSuccessful(), proof, workcell.workcellId(), workcell.issueId(),
                toolchain, durationMs, proof.isSuccessful() ? null : "toolchain reported " + proof.status().wireName(),
                workcell.speculateTag(), workcell, manifest);
    }

    public static DispatchResult failed(String issueId, String toolchain, String speculateTag,
                                        WorkcellHandle workcell, Manifest manifest,
                                        long durationMs, String error) {
        return new DispatchResult(false, null, workcell == null ? null : workcell.workcellId(), issueId,
                toolchain, durationMs, error, speculateTag, workcell, manifest);
    }

    public Optional<Proof> proofIfPresent() {
        return Optional.ofNullable(proof);
    }

    public boolean hasWorkcell() {
        return workcell != null;
    }
}
