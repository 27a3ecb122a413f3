package com.evarsity.lifecycle.repository;

import com.evarsity.lifecycle.domain.DomainModels.ProgressRecord;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

@Repository
public class ProgressJdbcRepository {
    private final JdbcTemplate jdbcTemplate;

    public ProgressJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public boolean isLessonCompleted(String studentId, String courseId, String lessonId) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM lesson_completions WHERE student_id = ? AND course_id = ? AND lesson_id = ?",
                Integer.class, studentId, courseId, lessonId);
        return count != null && count > 0;
    }

    public void insertLessonCompletion(String studentId, String courseId, String lessonId, Instant at) {
        jdbcTemplate.update(
                "INSERT INTO lesson_completions(student_id, course_id, lesson_id, completed_at) VALUES (?,?,?,?)",
                studentId, courseId, lessonId, at.toString());
    }

    public boolean isAssignmentSubmitted(String studentId, String courseId, String assignmentId) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM assignment_submissions WHERE student_id = ? AND course_id = ? AND assignment_id = ?",
                Integer.class, studentId, courseId, assignmentId);
        return count != null && count > 0;
    }

    public void insertAssignmentSubmission(String studentId, String courseId, String assignmentId, Instant at) {
        jdbcTemplate.update(
                "INSERT INTO assignment_submissions(student_id, course_id, assignment_id, submitted_at) VALUES (?,?,?,?)",
                studentId, courseId, assignmentId, at.toString());
    }

    public int countCompletedLessons(String studentId, String courseId) {
        Integer value = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM lesson_completions WHERE student_id = ? AND course_id = ?",
                Integer.class, studentId, courseId);
        return value == null ? 0 : value;
    }

    public int countSubmittedAssignments(String studentId, String courseId) {
        Integer value = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM assignment_submissions WHERE student_id = ? AND course_id = ?",
                Integer.class, studentId, courseId);
        return value == null ? 0 : value;
    }

    public Optional<ProgressRecord> find(String studentId, String courseId) {
        return jdbcTemplate.query(
                "SELECT student_id, course_id, total_lessons, completed_lessons, total_assignments, submitted_assignments, percentage, last_updated " +
                        "FROM course_progress WHERE student_id = ? AND course_id = ?",
                (rs, n) -> new ProgressRecord(rs.getString(1), rs.getString(2), rs.getInt(3), rs.getInt(4),
                        rs.getInt(5), rs.getInt(6), rs.getDouble(7), Instant.parse(rs.getString(8))),
                studentId, courseId).stream().findFirst();
    }

    public void upsert(ProgressRecord p) {
        jdbcTemplate.update(
                "MERGE INTO course_progress(student_id, course_id, total_lessons, completed_lessons, total_assignments, submitted_assignments, percentage, last_updated) " +
                        "KEY(student_id, course_id) VALUES (?,?,?,?,?,?,?,?)",
                p.studentId(), p.courseId(), p.totalLessons(), p.completedLessons(), p.totalAssignments(),
                p.submittedAssignments(), p.percentage(), p.lastUpdated().toString());
    }
}
