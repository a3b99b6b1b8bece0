package com.forgeloop.core.model;

import java.nio.file.Path;

/**
 * Reference to a live workcell: an isolated checkout on its own branch.
 *
 * @param workcellId   unique workcell name
 * @param issueId      issue the workcell was created for
 * @param path         root of the workcell checkout
 * @param branchName   branch the toolchain commits to
 * @param speculateTag tag distinguishing speculative siblings, null for single dispatch
 */
public record WorkcellHandle(
        String workcellId,
        String issueId,
        Path path,
        String branchName,
        String speculateTag
) {

    public Path logsDir() {
        return path.resolve("logs");
    }

    public Path manifestPath() {
        return path.resolve("manifest.json");
    }

    public Path proofPath() {
        return path.resolve("proof.json");
    }
}
