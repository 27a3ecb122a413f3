package com.evarsity.lifecycle.error;

public class CourseNotFoundException extends LifecycleException {
    public CourseNotFoundException(String courseId) {
        super(ErrorKind.COURSE_NOT_FOUND, "Course not found: " + courseId);
    }
}
