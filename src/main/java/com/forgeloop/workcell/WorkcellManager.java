package com.forgeloop.workcell;

import com.forgeloop.core.model.WorkcellHandle;

/**
 * Lifecycle of isolated workcells.
 */
public interface WorkcellManager {

    /**
     * Create a fresh workcell for an issue.
     *
     * @param issueId      issue the workcell is for
     * @param speculateTag tag distinguishing speculative siblings, or null
     * @throws WorkcellException when the workcell cannot be created
     */
    WorkcellHandle create(String issueId, String speculateTag);

    /**
     * Tear down a workcell without merging anything.
     *
     * @param keepLogs archive the workcell logs before removal
     * @throws WorkcellException when removal fails
     */
    void cleanup(WorkcellHandle workcell, boolean keepLogs);
}
