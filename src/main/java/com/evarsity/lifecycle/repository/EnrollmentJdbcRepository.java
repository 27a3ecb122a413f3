package com.evarsity.lifecycle.repository;

import com.evarsity.lifecycle.domain.DomainModels.Enrollment;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.Statement;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public class EnrollmentJdbcRepository {
    private static final String COLUMNS = "enrollment_id, student_id, course_id, enrolled_at";
    private static final RowMapper<Enrollment> MAPPER = (rs, n) -> new Enrollment(
            rs.getLong(1), rs.getString(2), rs.getString(3), Instant.parse(rs.getString(4)));

    private final JdbcTemplate jdbcTemplate;

    public EnrollmentJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public long insert(String studentId, String courseId, Instant enrolledAt) {
        KeyHolder keys = new GeneratedKeyHolder();
        jdbcTemplate.update(con -> {
            PreparedStatement ps = con.prepareStatement(
                    "INSERT INTO enrollments(student_id, course_id, enrolled_at) VALUES (?,?,?)",
                    Statement.RETURN_GENERATED_KEYS);
            ps.setString(1, studentId);
            ps.setString(2, courseId);
            ps.setString(3, enrolledAt.toString());
            return ps;
        }, keys);
        return keys.getKey().longValue();
    }

    public Optional<Enrollment> find(String studentId, String courseId) {
        return jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM enrollments WHERE student_id = ? AND course_id = ?",
                MAPPER, studentId, courseId).stream().findFirst();
    }

    public Optional<Enrollment> findForUpdate(String studentId, String courseId) {
        return jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM enrollments WHERE student_id = ? AND course_id = ? FOR UPDATE",
                MAPPER, studentId, courseId).stream().findFirst();
    }

    public List<Enrollment> findByStudent(String studentId) {
        return jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM enrollments WHERE student_id = ? ORDER BY enrolled_at",
                MAPPER, studentId);
    }

    public int deleteById(long enrollmentId) {
        return jdbcTemplate.update("DELETE FROM enrollments WHERE enrollment_id = ?", enrollmentId);
    }
}
