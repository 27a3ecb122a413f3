package com.evarsity.lifecycle.domain;

import java.math.BigDecimal;
import java.time.Instant;

public class DomainModels {
    public record Enrollment(long enrollmentId, String studentId, String courseId, Instant enrolledAt) {}

    public record ProgressRecord(String studentId,
                                 String courseId,
                                 int totalLessons,
                                 int completedLessons,
                                 int totalAssignments,
                                 int submittedAssignments,
                                 double percentage,
                                 Instant lastUpdated) {}

    public record Certificate(Long certificateId,
                              String studentId,
                              String courseId,
                              CertificateType type,
                              Instant issuedAt,
                              String url) {}

    public enum CertificateType { COMPLETION, EXCELLENCE, PROFICIENCY }

    public record DropoutRecord(Long dropoutId,
                                String studentId,
                                String courseId,
                                Instant enrollmentDate,
                                Instant dropoutDate,
                                int totalCourseDuration,
                                int completedDuration,
                                BigDecimal refundPercentage,
                                BigDecimal refundAmount,
                                String reason) {}

    public record SemesterPrerequisite(String courseId,
                                       int currentSemester,
                                       int nextSemester,
                                       int minCreditsRequired,
                                       BigDecimal minGpaRequired) {}
}
