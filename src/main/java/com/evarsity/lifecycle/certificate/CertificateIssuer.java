package com.evarsity.lifecycle.certificate;

import com.evarsity.lifecycle.catalog.CourseCatalog;
import com.evarsity.lifecycle.config.LifecycleProperties;
import com.evarsity.lifecycle.domain.DomainModels.Certificate;
import com.evarsity.lifecycle.domain.DomainModels.CertificateType;
import com.evarsity.lifecycle.error.CourseNotFoundException;
import com.evarsity.lifecycle.error.InvalidRequestException;
import com.evarsity.lifecycle.error.InvariantViolationException;
import com.evarsity.lifecycle.progress.ProgressChangeListener;
import com.evarsity.lifecycle.progress.ProgressModels.ProgressChanged;
import com.evarsity.lifecycle.repository.CertificateJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

@Service
public class CertificateIssuer implements ProgressChangeListener {
    private static final Logger log = LoggerFactory.getLogger(CertificateIssuer.class);

    private final CertificateJdbcRepository repository;
    private final CertificateReferenceGenerator references;
    private final CourseCatalog catalog;
    private final ApplicationEventPublisher events;
    private final LifecycleProperties properties;
    private final Clock clock;

    public CertificateIssuer(CertificateJdbcRepository repository,
                             CertificateReferenceGenerator references,
                             CourseCatalog catalog,
                             ApplicationEventPublisher events,
                             LifecycleProperties properties,
                             Clock clock) {
        this.repository = repository;
        this.references = references;
        this.catalog = catalog;
        this.events = events;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public void onProgressChanged(ProgressChanged event) {
        if (!crossesThreshold(event.oldPercentage(), event.newPercentage())) return;
        issueOnce(event.studentId(), event.courseId(), CertificateType.COMPLETION);
    }

    public boolean crossesThreshold(double oldPercentage, double newPercentage) {
        double threshold = properties.completionThreshold();
        return oldPercentage < threshold && newPercentage >= threshold;
    }

    // Completion is only ever issued by onProgressChanged
    @Transactional
    public Certificate issue(String studentId, String courseId, CertificateType type) {
        if (type == null || type == CertificateType.COMPLETION) {
            throw new InvalidRequestException("Certificate type " + type + " cannot be issued on request");
        }
        catalog.findCourse(courseId).orElseThrow(() -> new CourseNotFoundException(courseId));
        return issueOnce(studentId, courseId, type);
    }

    @Transactional(readOnly = true)
    public List<Certificate> certificates(String studentId, String courseId) {
        return repository.findByPair(studentId, courseId);
    }

    private Certificate issueOnce(String studentId, String courseId, CertificateType type) {
        if (repository.exists(studentId, courseId, type)) {
            log.debug("{} certificate already issued for student={} course={}", type, studentId, courseId);
            return existing(studentId, courseId, type);
        }

        Instant issuedAt = clock.instant();
        String url = references.referenceFor(studentId, courseId, type, issuedAt);
        Certificate certificate = new Certificate(null, studentId, courseId, type, issuedAt, url);
        long id;
        try {
            id = repository.insert(certificate);
        } catch (DuplicateKeyException e) {
            log.debug("Concurrent {} certificate insert for student={} course={}", type, studentId, courseId);
            return existing(studentId, courseId, type);
        }

        Certificate issued = new Certificate(id, studentId, courseId, type, issuedAt, url);
        log.info("Issued {} certificate id={} student={} course={} url={}", type, id, studentId, courseId, url);
        events.publishEvent(new CertificateIssued(issued));
        return issued;
    }

    private Certificate existing(String studentId, String courseId, CertificateType type) {
        return repository.findByPair(studentId, courseId).stream()
                .filter(c -> c.type() == type)
                .findFirst()
                .orElseThrow(() -> new InvariantViolationException("Certificate reported as existing but not found for student="
                        + studentId + " course=" + courseId + " type=" + type));
    }
}
