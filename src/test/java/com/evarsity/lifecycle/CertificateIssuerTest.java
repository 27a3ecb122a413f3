package com.evarsity.lifecycle;

import com.evarsity.lifecycle.certificate.CertificateIssued;
import com.evarsity.lifecycle.certificate.CertificateIssuer;
import com.evarsity.lifecycle.domain.DomainModels.CertificateType;
import com.evarsity.lifecycle.enrollment.EnrollmentLedger;
import com.evarsity.lifecycle.error.ErrorKind;
import com.evarsity.lifecycle.error.InvalidRequestException;
import com.evarsity.lifecycle.progress.ProgressAccumulator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.event.ApplicationEvents;
import org.springframework.test.context.event.RecordApplicationEvents;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@Import(TestClockConfig.class)
@RecordApplicationEvents
class CertificateIssuerTest {
    @Autowired
    private EnrollmentLedger ledger;
    @Autowired
    private ProgressAccumulator accumulator;
    @Autowired
    private CertificateIssuer issuer;
    @Autowired
    private JdbcTemplate jdbcTemplate;
    @Autowired
    private ApplicationEvents events;

    @BeforeEach
    void setUp() {
        TestCourses.register(jdbcTemplate, "cert-c1", "1000.00", 180, 10, 0);
    }

    @Test
    void issuesCompletionCertificateOnceWhenThresholdIsCrossed() {
        ledger.enroll("cert-st1", "cert-c1");
        for (int i = 1; i <= 8; i++) {
            accumulator.recordLessonCompletion("cert-st1", "cert-c1", "l" + i);
        }
        assertTrue(issuer.certificates("cert-st1", "cert-c1").isEmpty());

        var crossing = accumulator.recordLessonCompletion("cert-st1", "cert-c1", "l9");
        assertEquals(90.0, crossing.percentage(), 1e-9);
        assertEquals(1, issuer.certificates("cert-st1", "cert-c1").size());

        accumulator.recordLessonCompletion("cert-st1", "cert-c1", "l10");
        accumulator.recordLessonCompletion("cert-st1", "cert-c1", "l10");

        var certificates = issuer.certificates("cert-st1", "cert-c1");
        assertEquals(1, certificates.size());
        assertEquals(CertificateType.COMPLETION, certificates.get(0).type());
        assertTrue(certificates.get(0).url().startsWith("/certs/cert-st1_cert-c1_"));
        assertTrue(certificates.get(0).url().endsWith(".pdf"));

        long published = events.stream(CertificateIssued.class)
                .filter(e -> e.certificate().studentId().equals("cert-st1"))
                .count();
        assertEquals(1, published);
    }

    @Test
    void concurrentCrossingUpdatesProduceSingleCertificate() throws Exception {
        ledger.enroll("cert-st2", "cert-c1");
        for (int i = 1; i <= 8; i++) {
            accumulator.recordLessonCompletion("cert-st2", "cert-c1", "l" + i);
        }

        ExecutorService pool = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (String lesson : List.of("l9", "l10")) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return accumulator.recordLessonCompletion("cert-st2", "cert-c1", lesson);
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(100.0, accumulator.progress("cert-st2", "cert-c1").percentage(), 1e-9);
        assertEquals(1, issuer.certificates("cert-st2", "cert-c1").size());
    }

    @Test
    void externallyDecidedCertificatesAreIdempotentPerType() {
        var first = issuer.issue("cert-st3", "cert-c1", CertificateType.EXCELLENCE);
        var again = issuer.issue("cert-st3", "cert-c1", CertificateType.EXCELLENCE);
        var proficiency = issuer.issue("cert-st3", "cert-c1", CertificateType.PROFICIENCY);

        assertEquals(first.certificateId(), again.certificateId());
        assertEquals(first.url(), again.url());
        assertNotEquals(first.url(), proficiency.url());
        assertEquals(2, issuer.certificates("cert-st3", "cert-c1").size());
    }

    @Test
    void completionCannotBeIssuedOnRequest() {
        var ex = assertThrows(InvalidRequestException.class,
                () -> issuer.issue("cert-nobody", "cert-c1", CertificateType.COMPLETION));
        assertEquals(ErrorKind.INVALID_REQUEST, ex.getKind());
        assertTrue(issuer.certificates("cert-nobody", "cert-c1").isEmpty());

        ledger.enroll("cert-st4", "cert-c1");
        assertThrows(InvalidRequestException.class,
                () -> issuer.issue("cert-st4", "cert-c1", CertificateType.COMPLETION));
        assertTrue(issuer.certificates("cert-st4", "cert-c1").isEmpty());
    }

    @Test
    void strayLessonIdsDoNotEarnCompletion() {
        TestCourses.register(jdbcTemplate, "cert-mixed", "800.00", 120, 4, 6);
        ledger.enroll("cert-st5", "cert-mixed");

        for (int i = 1; i <= 9; i++) {
            accumulator.recordLessonCompletion("cert-st5", "cert-mixed", "x" + i);
        }
        assertEquals(40.0, accumulator.progress("cert-st5", "cert-mixed").percentage(), 1e-9);
        assertTrue(issuer.certificates("cert-st5", "cert-mixed").isEmpty());
    }

    @Test
    void crossingRequiresMovingFromBelowToAtOrAboveThreshold() {
        assertTrue(issuer.crossesThreshold(80.0, 90.0));
        assertTrue(issuer.crossesThreshold(0.0, 100.0));
        assertFalse(issuer.crossesThreshold(90.0, 100.0));
        assertFalse(issuer.crossesThreshold(95.0, 95.0));
        assertFalse(issuer.crossesThreshold(50.0, 89.99));
    }
}
