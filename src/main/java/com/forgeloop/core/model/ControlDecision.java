package com.forgeloop.core.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-cycle exploration directive: sampling temperature and speculative width,
 * derived from the recent verified rate.
 *
 * @param mode                  baseline, explore, exploit or hold
 * @param reason                why the mode was chosen
 * @param actionRate            recent verified rate, null when unknown
 * @param temperature           sampling temperature for toolchains
 * @param speculateParallelism  desired fan-out width for speculative issues
 */
public record ControlDecision(
        String mode,
        String reason,
        Double actionRate,
        double temperature,
        int speculateParallelism
) {

    public Map<String, Object> samplingBlock() {
        var sampling = new LinkedHashMap<String, Object>();
        sampling.put("temperature", temperature);
        return sampling;
    }

    /** Rendering for the manifest {@code control} block. */
    public Map<String, Object> toManifestBlock() {
        var block = new LinkedHashMap<String, Object>();
        block.put("mode", mode);
        block.put("reason", reason);
        block.put("action_rate", actionRate);
        block.put("speculate_parallelism", speculateParallelism);
        block.put("sampling", samplingBlock());
        return block;
    }
}
