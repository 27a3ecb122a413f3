package com.evarsity.lifecycle.api;

import com.evarsity.lifecycle.domain.DomainModels;
import com.evarsity.lifecycle.progress.ProgressAccumulator;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/progress")
public class ProgressController {
    private final ProgressAccumulator accumulator;

    public ProgressController(ProgressAccumulator accumulator) {
        this.accumulator = accumulator;
    }

    @PostMapping("/lessons")
    public ResponseEntity<DomainModels.ProgressRecord> lessonCompleted(@RequestBody LessonEvent event) {
        return ResponseEntity.ok(accumulator.recordLessonCompletion(event.studentId(), event.courseId(), event.lessonId()));
    }

    @PostMapping("/assignments")
    public ResponseEntity<DomainModels.ProgressRecord> assignmentSubmitted(@RequestBody AssignmentEvent event) {
        return ResponseEntity.ok(accumulator.recordAssignmentSubmission(event.studentId(), event.courseId(), event.assignmentId()));
    }

    @GetMapping
    public ResponseEntity<DomainModels.ProgressRecord> progress(@RequestParam String studentId, @RequestParam String courseId) {
        return ResponseEntity.ok(accumulator.progress(studentId, courseId));
    }

    public record LessonEvent(String studentId, String courseId, String lessonId) {}

    public record AssignmentEvent(String studentId, String courseId, String assignmentId) {}
}
