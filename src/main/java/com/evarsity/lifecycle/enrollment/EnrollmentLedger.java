package com.evarsity.lifecycle.enrollment;

import com.evarsity.lifecycle.catalog.CourseCatalog;
import com.evarsity.lifecycle.domain.DomainModels.Enrollment;
import com.evarsity.lifecycle.error.AlreadyEnrolledException;
import com.evarsity.lifecycle.error.CourseNotFoundException;
import com.evarsity.lifecycle.error.InvariantViolationException;
import com.evarsity.lifecycle.error.NotEnrolledException;
import com.evarsity.lifecycle.repository.EnrollmentJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Service
public class EnrollmentLedger {
    private static final Logger log = LoggerFactory.getLogger(EnrollmentLedger.class);

    private final EnrollmentJdbcRepository repository;
    private final CourseCatalog catalog;
    private final Clock clock;

    public EnrollmentLedger(EnrollmentJdbcRepository repository, CourseCatalog catalog, Clock clock) {
        this.repository = repository;
        this.catalog = catalog;
        this.clock = clock;
    }

    @Transactional
    public Enrollment enroll(String studentId, String courseId) {
        catalog.findCourse(courseId).orElseThrow(() -> new CourseNotFoundException(courseId));
        if (repository.find(studentId, courseId).isPresent()) {
            throw new AlreadyEnrolledException(studentId, courseId);
        }

        Instant now = clock.instant();
        long id;
        try {
            id = repository.insert(studentId, courseId, now);
        } catch (DuplicateKeyException e) {
            // lost the race against a concurrent enroll for the same pair
            throw new AlreadyEnrolledException(studentId, courseId);
        }
        log.info("Enrolled student={} course={} enrollmentId={}", studentId, courseId, id);
        return new Enrollment(id, studentId, courseId, now);
    }

    @Transactional(readOnly = true)
    public Enrollment lookup(String studentId, String courseId) {
        return repository.find(studentId, courseId)
                .orElseThrow(() -> new NotEnrolledException(studentId, courseId));
    }

    @Transactional(readOnly = true)
    public Optional<Enrollment> find(String studentId, String courseId) {
        return repository.find(studentId, courseId);
    }

    @Transactional(readOnly = true)
    public List<Enrollment> listForStudent(String studentId) {
        return repository.findByStudent(studentId);
    }

    /**
     * Locks the active enrollment of the pair for the rest of the caller's transaction.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Enrollment requireActiveForUpdate(String studentId, String courseId) {
        return repository.findForUpdate(studentId, courseId)
                .orElseThrow(() -> new NotEnrolledException(studentId, courseId));
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void remove(Enrollment enrollment) {
        int deleted = repository.deleteById(enrollment.enrollmentId());
        if (deleted != 1) {
            throw new InvariantViolationException("Expected to remove exactly one enrollment for student="
                    + enrollment.studentId() + " course=" + enrollment.courseId() + " but removed " + deleted);
        }
    }
}
