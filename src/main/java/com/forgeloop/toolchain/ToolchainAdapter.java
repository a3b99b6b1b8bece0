package com.forgeloop.toolchain;

import com.forgeloop.core.model.Manifest;
import com.forgeloop.core.model.Proof;
import com.forgeloop.core.model.WorkcellHandle;

import java.time.Duration;

/**
 * A pluggable code-generation backend. Implementations run one manifest inside
 * one workcell and report the outcome as a {@link Proof}.
 */
public interface ToolchainAdapter {

    /** Registry key, matched against tool hints and routing rules. */
    String name();

    /** Whether this toolchain can be invoked right now. Defaults to {@code true}. */
    default boolean available() {
        return true;
    }

    /**
     * Run the manifest to completion.
     *
     * @param manifest the execution contract, already persisted in the workcell
     * @param workcell the workcell to operate in
     * @param timeout  hard deadline; implementations should stop their work when it passes
     * @return the proof reported by the toolchain
     * @throws ToolchainException when the toolchain crashes, times out or writes no readable proof
     */
    Proof execute(Manifest manifest, WorkcellHandle workcell, Duration timeout);
}
