package com.evarsity.lifecycle.api;

import com.evarsity.lifecycle.semester.SemesterGateService;
import com.evarsity.lifecycle.semester.SemesterModels;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/semester-gate")
public class SemesterGateController {
    private final SemesterGateService gateService;

    public SemesterGateController(SemesterGateService gateService) {
        this.gateService = gateService;
    }

    @GetMapping("/can-advance")
    public ResponseEntity<Boolean> canAdvance(@RequestParam String courseId,
                                              @RequestParam int currentSemester,
                                              @RequestParam int credits,
                                              @RequestParam double gpa) {
        return ResponseEntity.ok(gateService.canAdvance(courseId, currentSemester, credits, gpa));
    }

    @PostMapping("/assess")
    public ResponseEntity<SemesterModels.AdvancementDecision> assess(@RequestBody AssessRequest request) {
        return ResponseEntity.ok(gateService.assess(request.courseId(), request.currentSemester(), request.results()));
    }

    @PostMapping("/reload")
    public ResponseEntity<Void> reload() {
        gateService.reload();
        return ResponseEntity.accepted().build();
    }

    public record AssessRequest(String courseId, int currentSemester, List<SemesterModels.SubjectResult> results) {}
}
