package com.evarsity.lifecycle.semester;

import com.evarsity.lifecycle.domain.DomainModels.SemesterPrerequisite;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

public final class SemesterPolicy {
    private final Map<Key, SemesterPrerequisite> rows;

    private SemesterPolicy(Map<Key, SemesterPrerequisite> rows) {
        this.rows = rows;
    }

    public static SemesterPolicy of(List<SemesterPrerequisite> prerequisites) {
        return new SemesterPolicy(Map.copyOf(prerequisites.stream()
                .collect(Collectors.toMap(p -> new Key(p.courseId(), p.currentSemester()), Function.identity(), (a, b) -> b))));
    }

    public Optional<SemesterPrerequisite> find(String courseId, int currentSemester) {
        return Optional.ofNullable(rows.get(new Key(courseId, currentSemester)));
    }

    public int size() {
        return rows.size();
    }

    private record Key(String courseId, int currentSemester) {}
}
