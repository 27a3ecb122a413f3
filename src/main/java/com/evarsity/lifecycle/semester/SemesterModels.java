package com.evarsity.lifecycle.semester;

import java.math.BigDecimal;
import java.util.List;

public class SemesterModels {
    public record SubjectResult(String subject, int credits, double percentage) {}

    public record GradedSubject(String subject, int credits, double percentage, String grade, double gradePoints) {}

    public record AdvancementDecision(String courseId,
                                      int currentSemester,
                                      int nextSemester,
                                      boolean eligible,
                                      int earnedCredits,
                                      BigDecimal gpa,
                                      int minCreditsRequired,
                                      BigDecimal minGpaRequired,
                                      List<GradedSubject> subjects,
                                      List<String> shortfalls) {}
}
