package com.evarsity.lifecycle.progress;

import com.evarsity.lifecycle.domain.DomainModels.ProgressRecord;

public class ProgressModels {
    public enum ActivityKind { LESSON, ASSIGNMENT }

    public record ProgressChanged(String studentId,
                                  String courseId,
                                  double oldPercentage,
                                  double newPercentage,
                                  ProgressRecord record) {}
}
