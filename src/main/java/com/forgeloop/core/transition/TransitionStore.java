package com.forgeloop.core.transition;

import com.forgeloop.core.model.TransitionRecord;

import java.util.OptionalDouble;

/**
 * Append-only store of transition records.
 */
public interface TransitionStore {

    /**
     * Append a record. Re-inserting a record with an existing id is a no-op.
     */
    void insert(TransitionRecord record);

    /**
     * Share of verified transitions among the most recent {@code window} records,
     * or empty when nothing has been recorded yet.
     */
    OptionalDouble verifiedRate(int window);
}
