package com.evarsity.lifecycle.dropout;

import com.evarsity.lifecycle.catalog.CourseCatalog;
import com.evarsity.lifecycle.catalog.CourseCatalog.CourseInfo;
import com.evarsity.lifecycle.config.LifecycleProperties;
import com.evarsity.lifecycle.domain.DomainModels.DropoutRecord;
import com.evarsity.lifecycle.domain.DomainModels.Enrollment;
import com.evarsity.lifecycle.dropout.RefundPolicy.RefundQuote;
import com.evarsity.lifecycle.enrollment.EnrollmentLedger;
import com.evarsity.lifecycle.error.CourseNotFoundException;
import com.evarsity.lifecycle.error.InvariantViolationException;
import com.evarsity.lifecycle.repository.DropoutJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

@Service
public class DropoutRefundProcessor {
    private static final Logger log = LoggerFactory.getLogger(DropoutRefundProcessor.class);

    private final EnrollmentLedger ledger;
    private final DropoutJdbcRepository repository;
    private final CourseCatalog catalog;
    private final ApplicationEventPublisher events;
    private final LifecycleProperties properties;
    private final Clock clock;

    public DropoutRefundProcessor(EnrollmentLedger ledger,
                                  DropoutJdbcRepository repository,
                                  CourseCatalog catalog,
                                  ApplicationEventPublisher events,
                                  LifecycleProperties properties,
                                  Clock clock) {
        this.ledger = ledger;
        this.repository = repository;
        this.catalog = catalog;
        this.events = events;
        this.properties = properties;
        this.clock = clock;
    }

    @Transactional
    public DropoutRecord withdraw(String studentId, String courseId, String reason) {
        Enrollment enrollment = ledger.requireActiveForUpdate(studentId, courseId);
        CourseInfo course = catalog.findCourse(courseId).orElseThrow(() -> new CourseNotFoundException(courseId));

        Instant dropoutAt = clock.instant();
        int totalDays = course.durationDays() == null || course.durationDays() <= 0
                ? properties.defaultCourseDurationDays()
                : course.durationDays();
        BigDecimal price = course.price() == null ? BigDecimal.ZERO : course.price();

        RefundQuote quote = RefundPolicy.quote(
                LocalDate.ofInstant(enrollment.enrolledAt(), properties.zoneId()),
                LocalDate.ofInstant(dropoutAt, properties.zoneId()),
                totalDays, price);
        verify(quote, price);

        DropoutRecord pending = new DropoutRecord(null, studentId, courseId, enrollment.enrolledAt(), dropoutAt,
                quote.totalDays(), quote.completedDays(), quote.refundPercentage(), quote.refundAmount(), reason);
        long id = repository.insert(pending);
        ledger.remove(enrollment);

        DropoutRecord stored = new DropoutRecord(id, studentId, courseId, enrollment.enrolledAt(), dropoutAt,
                quote.totalDays(), quote.completedDays(), quote.refundPercentage(), quote.refundAmount(), reason);
        log.info("Processed withdrawal student={} course={} day={}/{} refund={}% amount={}",
                studentId, courseId, quote.completedDays(), quote.totalDays(), quote.refundPercentage(), quote.refundAmount());
        events.publishEvent(new DropoutRecorded(stored));
        return stored;
    }

    @Transactional(readOnly = true)
    public List<DropoutRecord> dropouts(String studentId) {
        return repository.findByStudent(studentId);
    }

    private void verify(RefundQuote quote, BigDecimal price) {
        boolean percentageValid = quote.refundPercentage().signum() >= 0
                && quote.refundPercentage().compareTo(BigDecimal.valueOf(100)) <= 0;
        boolean amountValid = quote.refundAmount().signum() >= 0 && quote.refundAmount().compareTo(price) <= 0;
        boolean daysValid = quote.completedDays() >= 0 && quote.completedDays() <= quote.totalDays();
        if (!percentageValid || !amountValid || !daysValid) {
            log.error("Invalid refund quote {} for price {}", quote, price);
            throw new InvariantViolationException("Refund computed outside valid range");
        }
    }
}
