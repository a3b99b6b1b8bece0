package com.forgeloop.core;

/**
 * Base class for failures raised by kernel collaborators.
 */
public class KernelException extends RuntimeException {

    public KernelException(String message) {
        super(message);
    }

    public KernelException(String message, Throwable cause) {
        super(message, cause);
    }
}
