package com.evarsity.lifecycle.semester;

import com.evarsity.lifecycle.domain.DomainModels.SemesterPrerequisite;
import com.evarsity.lifecycle.error.InvalidRequestException;
import com.evarsity.lifecycle.error.NoPolicyDefinedException;
import com.evarsity.lifecycle.semester.GradingScale.GradeBand;
import com.evarsity.lifecycle.semester.SemesterModels.AdvancementDecision;
import com.evarsity.lifecycle.semester.SemesterModels.GradedSubject;
import com.evarsity.lifecycle.semester.SemesterModels.SubjectResult;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

public final class SemesterGate {

    public static boolean canAdvance(SemesterPolicy policy, String courseId, int currentSemester,
                                     int studentCredits, double studentGpa) {
        if (studentCredits < 0) {
            throw new InvalidRequestException("Credits must not be negative: " + studentCredits);
        }
        if (!Double.isFinite(studentGpa) || studentGpa < 0.0) {
            throw new InvalidRequestException("GPA must be a non-negative number: " + studentGpa);
        }
        SemesterPrerequisite rule = require(policy, courseId, currentSemester);
        return meets(rule, studentCredits, BigDecimal.valueOf(studentGpa));
    }

    public static AdvancementDecision assess(SemesterPolicy policy, GradingScale scale, String courseId,
                                             int currentSemester, List<SubjectResult> results) {
        SemesterPrerequisite rule = require(policy, courseId, currentSemester);

        List<GradedSubject> graded = new ArrayList<>();
        int earnedCredits = 0;
        int attemptedCredits = 0;
        double weightedPoints = 0.0;
        for (SubjectResult r : results) {
            if (r.credits() < 0) {
                throw new InvalidRequestException("Negative credits for subject " + r.subject());
            }
            if (!Double.isFinite(r.percentage()) || r.percentage() < 0.0 || r.percentage() > 100.0) {
                throw new InvalidRequestException("Percentage out of range for subject " + r.subject() + ": " + r.percentage());
            }
            GradeBand band = scale.gradeFor(r.percentage());
            graded.add(new GradedSubject(r.subject(), r.credits(), r.percentage(), band.grade(), band.gradePoints()));
            attemptedCredits += r.credits();
            weightedPoints += band.gradePoints() * r.credits();
            if (band.gradePoints() > 0.0) earnedCredits += r.credits();
        }
        BigDecimal gpa = attemptedCredits == 0
                ? BigDecimal.ZERO.setScale(2)
                : BigDecimal.valueOf(weightedPoints / attemptedCredits).setScale(2, RoundingMode.HALF_UP);

        List<String> shortfalls = new ArrayList<>();
        if (earnedCredits < rule.minCreditsRequired()) {
            shortfalls.add("credits " + earnedCredits + " < " + rule.minCreditsRequired());
        }
        if (gpa.compareTo(rule.minGpaRequired()) < 0) {
            shortfalls.add("gpa " + gpa + " < " + rule.minGpaRequired());
        }

        return new AdvancementDecision(courseId, currentSemester, rule.nextSemester(), meets(rule, earnedCredits, gpa),
                earnedCredits, gpa, rule.minCreditsRequired(), rule.minGpaRequired(), graded, shortfalls);
    }

    private static boolean meets(SemesterPrerequisite rule, int credits, BigDecimal gpa) {
        return credits >= rule.minCreditsRequired() && gpa.compareTo(rule.minGpaRequired()) >= 0;
    }

    private static SemesterPrerequisite require(SemesterPolicy policy, String courseId, int currentSemester) {
        return policy.find(courseId, currentSemester)
                .orElseThrow(() -> new NoPolicyDefinedException(courseId, currentSemester));
    }

    private SemesterGate() {}
}
