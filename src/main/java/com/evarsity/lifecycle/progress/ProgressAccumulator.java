package com.evarsity.lifecycle.progress;

import com.evarsity.lifecycle.catalog.CourseCatalog;
import com.evarsity.lifecycle.catalog.CourseCatalog.CourseInfo;
import com.evarsity.lifecycle.domain.DomainModels.ProgressRecord;
import com.evarsity.lifecycle.enrollment.EnrollmentLedger;
import com.evarsity.lifecycle.error.CourseNotFoundException;
import com.evarsity.lifecycle.error.InvariantViolationException;
import com.evarsity.lifecycle.error.NotEnrolledException;
import com.evarsity.lifecycle.progress.ProgressModels.ActivityKind;
import com.evarsity.lifecycle.progress.ProgressModels.ProgressChanged;
import com.evarsity.lifecycle.repository.ProgressJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

@Service
public class ProgressAccumulator {
    private static final Logger log = LoggerFactory.getLogger(ProgressAccumulator.class);

    private final EnrollmentLedger ledger;
    private final ProgressJdbcRepository repository;
    private final CourseCatalog catalog;
    private final List<ProgressChangeListener> listeners;
    private final Clock clock;

    public ProgressAccumulator(EnrollmentLedger ledger,
                               ProgressJdbcRepository repository,
                               CourseCatalog catalog,
                               List<ProgressChangeListener> listeners,
                               Clock clock) {
        this.ledger = ledger;
        this.repository = repository;
        this.catalog = catalog;
        this.listeners = listeners;
        this.clock = clock;
    }

    @Transactional
    public ProgressRecord recordLessonCompletion(String studentId, String courseId, String lessonId) {
        return record(studentId, courseId, ActivityKind.LESSON, lessonId);
    }

    @Transactional
    public ProgressRecord recordAssignmentSubmission(String studentId, String courseId, String assignmentId) {
        return record(studentId, courseId, ActivityKind.ASSIGNMENT, assignmentId);
    }

    @Transactional(readOnly = true)
    public ProgressRecord progress(String studentId, String courseId) {
        return repository.find(studentId, courseId).orElseGet(() -> {
            if (ledger.find(studentId, courseId).isEmpty()) {
                throw new NotEnrolledException(studentId, courseId);
            }
            CourseInfo course = course(courseId);
            return new ProgressRecord(studentId, courseId, course.totalLessons(), 0, course.totalAssignments(), 0, 0.0, clock.instant());
        });
    }

    private ProgressRecord record(String studentId, String courseId, ActivityKind kind, String activityId) {
        ledger.requireActiveForUpdate(studentId, courseId);

        Instant now = clock.instant();
        boolean alreadyRecorded = switch (kind) {
            case LESSON -> repository.isLessonCompleted(studentId, courseId, activityId);
            case ASSIGNMENT -> repository.isAssignmentSubmitted(studentId, courseId, activityId);
        };
        if (alreadyRecorded) {
            log.debug("Ignoring repeated {} {} for student={} course={}", kind, activityId, studentId, courseId);
            return repository.find(studentId, courseId).orElseGet(() -> recompute(studentId, courseId, now));
        }

        switch (kind) {
            case LESSON -> repository.insertLessonCompletion(studentId, courseId, activityId, now);
            case ASSIGNMENT -> repository.insertAssignmentSubmission(studentId, courseId, activityId, now);
        }
        return recompute(studentId, courseId, now);
    }

    private ProgressRecord recompute(String studentId, String courseId, Instant now) {
        CourseInfo course = course(courseId);
        int recordedLessons = repository.countCompletedLessons(studentId, courseId);
        int recordedAssignments = repository.countSubmittedAssignments(studentId, courseId);
        if (recordedLessons > course.totalLessons() || recordedAssignments > course.totalAssignments()) {
            log.warn("More activities recorded than the course defines for student={} course={}: lessons {}/{} assignments {}/{}",
                    studentId, courseId, recordedLessons, course.totalLessons(), recordedAssignments, course.totalAssignments());
        }
        // surplus ids of one kind never count towards the other
        int completedLessons = Math.min(recordedLessons, course.totalLessons());
        int submittedAssignments = Math.min(recordedAssignments, course.totalAssignments());

        double percentage = ProgressFormula.percentage(course.totalLessons(), completedLessons,
                course.totalAssignments(), submittedAssignments);
        verify(studentId, courseId, course, completedLessons, submittedAssignments, percentage);

        double oldPercentage = repository.find(studentId, courseId).map(ProgressRecord::percentage).orElse(0.0);
        ProgressRecord updated = new ProgressRecord(studentId, courseId, course.totalLessons(), completedLessons,
                course.totalAssignments(), submittedAssignments, percentage, now);
        repository.upsert(updated);

        ProgressChanged event = new ProgressChanged(studentId, courseId, oldPercentage, percentage, updated);
        listeners.forEach(l -> l.onProgressChanged(event));
        return updated;
    }

    private void verify(String studentId, String courseId, CourseInfo course,
                        int completedLessons, int submittedAssignments, double percentage) {
        boolean countsValid = completedLessons >= 0 && completedLessons <= course.totalLessons()
                && submittedAssignments >= 0 && submittedAssignments <= course.totalAssignments();
        if (!countsValid || Double.isNaN(percentage) || percentage < 0.0 || percentage > 100.0) {
            log.error("Invalid progress for student={} course={}: totals={}/{} done={}/{} percentage={}", studentId, courseId,
                    course.totalLessons(), course.totalAssignments(), completedLessons, submittedAssignments, percentage);
            throw new InvariantViolationException("Progress out of range for student=" + studentId + " course=" + courseId);
        }
    }

    private CourseInfo course(String courseId) {
        return catalog.findCourse(courseId).orElseThrow(() -> new CourseNotFoundException(courseId));
    }
}
