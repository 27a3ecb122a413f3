package com.evarsity.lifecycle.error;

public class InvariantViolationException extends LifecycleException {
    public InvariantViolationException(String message) {
        super(ErrorKind.INVARIANT_VIOLATION, message);
    }
}
