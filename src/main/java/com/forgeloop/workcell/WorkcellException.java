package com.forgeloop.workcell;

import com.forgeloop.core.KernelException;

public class WorkcellException extends KernelException {

    public WorkcellException(String message) {
        super(message);
    }

    public WorkcellException(String message, Throwable cause) {
        super(message, cause);
    }
}
