package com.evarsity.lifecycle.error;

public class InvalidRequestException extends LifecycleException {
    public InvalidRequestException(String message) {
        super(ErrorKind.INVALID_REQUEST, message);
    }
}
