package com.forgeloop.core.graph;

import com.forgeloop.core.KernelException;

/**
 * The work graph store could not be read or updated. Halts the current cycle.
 */
public class WorkGraphException extends KernelException {

    public WorkGraphException(String message) {
        super(message);
    }

    public WorkGraphException(String message, Throwable cause) {
        super(message, cause);
    }
}
