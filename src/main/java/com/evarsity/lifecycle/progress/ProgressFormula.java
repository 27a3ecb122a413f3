package com.evarsity.lifecycle.progress;

public final class ProgressFormula {

    public static double percentage(int totalLessons, int completedLessons, int totalAssignments, int submittedAssignments) {
        int total = totalLessons + totalAssignments;
        if (total == 0) return 0.0;
        double raw = (completedLessons + submittedAssignments) * 100.0 / total;
        return Math.max(0.0, Math.min(100.0, raw));
    }

    private ProgressFormula() {}
}
