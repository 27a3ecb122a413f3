package com.evarsity.lifecycle.error;

public abstract class LifecycleException extends RuntimeException {
    private final ErrorKind kind;

    protected LifecycleException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
