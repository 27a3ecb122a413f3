package com.evarsity.lifecycle.error;

public class AlreadyEnrolledException extends LifecycleException {
    public AlreadyEnrolledException(String studentId, String courseId) {
        super(ErrorKind.ALREADY_ENROLLED, "Student " + studentId + " is already enrolled in course " + courseId);
    }
}
