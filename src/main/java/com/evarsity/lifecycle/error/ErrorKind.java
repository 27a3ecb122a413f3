package com.evarsity.lifecycle.error;

public enum ErrorKind {
    NOT_ENROLLED,
    ALREADY_ENROLLED,
    NO_POLICY_DEFINED,
    COURSE_NOT_FOUND,
    INVALID_REQUEST,
    INVARIANT_VIOLATION
}
