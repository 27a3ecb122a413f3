package com.evarsity.lifecycle.notification;

import com.evarsity.lifecycle.certificate.CertificateIssued;
import com.evarsity.lifecycle.dropout.DropoutRecorded;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionalEventListener;

@Component
public class LifecycleEventRelay {
    private static final Logger log = LoggerFactory.getLogger(LifecycleEventRelay.class);

    @TransactionalEventListener
    public void onCertificateIssued(CertificateIssued event) {
        var c = event.certificate();
        log.info("notify student={} certificate={} course={} url={}", c.studentId(), c.type(), c.courseId(), c.url());
    }

    @TransactionalEventListener
    public void onDropoutRecorded(DropoutRecorded event) {
        var d = event.record();
        log.info("refund liability student={} course={} amount={} ({}%)",
                d.studentId(), d.courseId(), d.refundAmount(), d.refundPercentage());
    }
}
