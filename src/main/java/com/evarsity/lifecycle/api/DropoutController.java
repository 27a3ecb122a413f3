package com.evarsity.lifecycle.api;

import com.evarsity.lifecycle.domain.DomainModels;
import com.evarsity.lifecycle.dropout.DropoutRefundProcessor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/dropouts")
public class DropoutController {
    private final DropoutRefundProcessor processor;

    public DropoutController(DropoutRefundProcessor processor) {
        this.processor = processor;
    }

    @PostMapping
    public ResponseEntity<DomainModels.DropoutRecord> withdraw(@RequestBody WithdrawRequest request) {
        return ResponseEntity.ok(processor.withdraw(request.studentId(), request.courseId(), request.reason()));
    }

    @GetMapping
    public ResponseEntity<List<DomainModels.DropoutRecord>> dropouts(@RequestParam String studentId) {
        return ResponseEntity.ok(processor.dropouts(studentId));
    }

    public record WithdrawRequest(String studentId, String courseId, String reason) {}
}
