package com.forgeloop.workcell;

import com.forgeloop.core.model.Proof;
import com.forgeloop.core.model.WorkcellHandle;

/**
 * Applies a verified result to the main line of development.
 */
public interface PatchApplier {

    /**
     * @return true when the change was applied
     */
    boolean apply(Proof proof, WorkcellHandle workcell);
}
