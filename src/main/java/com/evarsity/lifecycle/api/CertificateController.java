package com.evarsity.lifecycle.api;

import com.evarsity.lifecycle.certificate.CertificateIssuer;
import com.evarsity.lifecycle.domain.DomainModels;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/certificates")
public class CertificateController {
    private final CertificateIssuer issuer;

    public CertificateController(CertificateIssuer issuer) {
        this.issuer = issuer;
    }

    @GetMapping
    public ResponseEntity<List<DomainModels.Certificate>> certificates(@RequestParam String studentId,
                                                                       @RequestParam String courseId) {
        return ResponseEntity.ok(issuer.certificates(studentId, courseId));
    }

    @PostMapping
    public ResponseEntity<DomainModels.Certificate> issue(@RequestBody IssueRequest request) {
        return ResponseEntity.ok(issuer.issue(request.studentId(), request.courseId(), request.type()));
    }

    public record IssueRequest(String studentId, String courseId, DomainModels.CertificateType type) {}
}
