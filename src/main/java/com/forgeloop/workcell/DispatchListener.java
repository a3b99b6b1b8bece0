package com.forgeloop.workcell;

import com.forgeloop.core.model.Issue;
import com.forgeloop.core.model.WorkcellHandle;

/**
 * Callback from the dispatcher once a workcell exists and before the toolchain runs.
 */
@FunctionalInterface
public interface DispatchListener {

    DispatchListener NONE = (issue, workcell, toolchain) -> { };

    void onWorkcellCreated(Issue issue, WorkcellHandle workcell, String toolchain);
}
