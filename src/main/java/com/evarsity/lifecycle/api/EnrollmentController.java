package com.evarsity.lifecycle.api;

import com.evarsity.lifecycle.domain.DomainModels;
import com.evarsity.lifecycle.enrollment.EnrollmentLedger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/enrollments")
public class EnrollmentController {
    private final EnrollmentLedger ledger;

    public EnrollmentController(EnrollmentLedger ledger) {
        this.ledger = ledger;
    }

    @PostMapping
    public ResponseEntity<DomainModels.Enrollment> enroll(@RequestBody EnrollRequest request) {
        return ResponseEntity.ok(ledger.enroll(request.studentId(), request.courseId()));
    }

    @GetMapping
    public ResponseEntity<DomainModels.Enrollment> lookup(@RequestParam String studentId, @RequestParam String courseId) {
        return ResponseEntity.ok(ledger.lookup(studentId, courseId));
    }

    @GetMapping("/student/{studentId}")
    public ResponseEntity<List<DomainModels.Enrollment>> forStudent(@PathVariable String studentId) {
        return ResponseEntity.ok(ledger.listForStudent(studentId));
    }

    public record EnrollRequest(String studentId, String courseId) {}
}
