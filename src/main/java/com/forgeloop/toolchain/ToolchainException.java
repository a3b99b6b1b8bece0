package com.forgeloop.toolchain;

import com.forgeloop.core.KernelException;

/**
 * A toolchain invocation crashed, timed out or produced no readable proof.
 */
public class ToolchainException extends KernelException {

    public ToolchainException(String message) {
        super(message);
    }

    public ToolchainException(String message, Throwable cause) {
        super(message, cause);
    }
}
