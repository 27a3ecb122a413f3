package com.evarsity.lifecycle.error;

public class NoPolicyDefinedException extends LifecycleException {
    public NoPolicyDefinedException(String courseId, int currentSemester) {
        super(ErrorKind.NO_POLICY_DEFINED,
                "No semester prerequisite defined for course " + courseId + " semester " + currentSemester);
    }
}
