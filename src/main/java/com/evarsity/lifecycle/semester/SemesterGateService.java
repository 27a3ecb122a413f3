package com.evarsity.lifecycle.semester;

import com.evarsity.lifecycle.repository.SemesterPolicyJdbcRepository;
import com.evarsity.lifecycle.semester.SemesterModels.AdvancementDecision;
import com.evarsity.lifecycle.semester.SemesterModels.SubjectResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

@Service
public class SemesterGateService {
    private static final Logger log = LoggerFactory.getLogger(SemesterGateService.class);

    private final SemesterPolicyJdbcRepository repository;
    private final AtomicReference<Snapshot> current = new AtomicReference<>();

    public SemesterGateService(SemesterPolicyJdbcRepository repository) {
        this.repository = repository;
    }

    public boolean canAdvance(String courseId, int currentSemester, int studentCredits, double studentGpa) {
        return SemesterGate.canAdvance(snapshot().policy(), courseId, currentSemester, studentCredits, studentGpa);
    }

    public AdvancementDecision assess(String courseId, int currentSemester, List<SubjectResult> results) {
        Snapshot s = snapshot();
        return SemesterGate.assess(s.policy(), s.scale(), courseId, currentSemester, results == null ? List.of() : results);
    }

    public SemesterPolicy policy() {
        return snapshot().policy();
    }

    public GradingScale gradingScale() {
        return snapshot().scale();
    }

    public Snapshot reload() {
        Snapshot loaded = new Snapshot(SemesterPolicy.of(repository.loadPrerequisites()),
                GradingScale.of(repository.loadGradeBands()));
        current.set(loaded);
        log.info("Loaded semester policy: {} prerequisite rows, {} grade bands",
                loaded.policy().size(), loaded.scale().bands().size());
        return loaded;
    }

    private Snapshot snapshot() {
        Snapshot s = current.get();
        return s != null ? s : reload();
    }

    public record Snapshot(SemesterPolicy policy, GradingScale scale) {}
}
