package com.evarsity.lifecycle.repository;

import com.evarsity.lifecycle.domain.DomainModels.DropoutRecord;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.Statement;
import java.time.Instant;
import java.util.List;

@Repository
public class DropoutJdbcRepository {
    private final JdbcTemplate jdbcTemplate;

    public DropoutJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public long insert(DropoutRecord d) {
        KeyHolder keys = new GeneratedKeyHolder();
        jdbcTemplate.update(con -> {
            PreparedStatement ps = con.prepareStatement(
                    "INSERT INTO course_dropouts(student_id, course_id, enrollment_date, dropout_date, total_course_duration, " +
                            "completed_duration, refund_percentage, refund_amount, reason) VALUES (?,?,?,?,?,?,?,?,?)",
                    Statement.RETURN_GENERATED_KEYS);
            ps.setString(1, d.studentId());
            ps.setString(2, d.courseId());
            ps.setString(3, d.enrollmentDate().toString());
            ps.setString(4, d.dropoutDate().toString());
            ps.setInt(5, d.totalCourseDuration());
            ps.setInt(6, d.completedDuration());
            ps.setBigDecimal(7, d.refundPercentage());
            ps.setBigDecimal(8, d.refundAmount());
            ps.setString(9, d.reason());
            return ps;
        }, keys);
        return keys.getKey().longValue();
    }

    public List<DropoutRecord> findByStudent(String studentId) {
        return jdbcTemplate.query(
                "SELECT dropout_id, student_id, course_id, enrollment_date, dropout_date, total_course_duration, completed_duration, " +
                        "refund_percentage, refund_amount, reason FROM course_dropouts WHERE student_id = ? ORDER BY dropout_id",
                (rs, n) -> new DropoutRecord(rs.getLong(1), rs.getString(2), rs.getString(3),
                        Instant.parse(rs.getString(4)), Instant.parse(rs.getString(5)), rs.getInt(6), rs.getInt(7),
                        rs.getBigDecimal(8), rs.getBigDecimal(9), rs.getString(10)),
                studentId);
    }
}
