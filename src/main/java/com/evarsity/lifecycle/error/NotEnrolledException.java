package com.evarsity.lifecycle.error;

public class NotEnrolledException extends LifecycleException {
    public NotEnrolledException(String studentId, String courseId) {
        super(ErrorKind.NOT_ENROLLED, "Student " + studentId + " is not currently enrolled in course " + courseId);
    }
}
