package com.evarsity.lifecycle.semester;

import java.util.Comparator;
import java.util.List;

public final class GradingScale {
    public record GradeBand(String grade, double minPercentage, double maxPercentage, double gradePoints, String remarks) {}

    private final List<GradeBand> bands;

    private GradingScale(List<GradeBand> bands) {
        this.bands = bands;
    }

    public static GradingScale of(List<GradeBand> bands) {
        return new GradingScale(bands.stream()
                .sorted(Comparator.comparingDouble(GradeBand::minPercentage).reversed())
                .toList());
    }

    public GradeBand gradeFor(double percentage) {
        if (Double.isNaN(percentage) || percentage < 0.0 || percentage > 100.0) {
            throw new IllegalArgumentException("Percentage out of range: " + percentage);
        }
        return bands.stream()
                .filter(b -> percentage >= b.minPercentage())
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("Grading scale has no band for " + percentage));
    }

    public List<GradeBand> bands() {
        return bands;
    }
}
