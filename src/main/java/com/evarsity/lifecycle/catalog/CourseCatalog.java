package com.evarsity.lifecycle.catalog;

import java.math.BigDecimal;
import java.util.Optional;

public interface CourseCatalog {
    Optional<CourseInfo> findCourse(String courseId);

    record CourseInfo(String courseId,
                      String title,
                      BigDecimal price,
                      Integer durationDays, // null when the catalog has none
                      int totalLessons,
                      int totalAssignments) {}
}
