package com.evarsity.lifecycle.repository;

import com.evarsity.lifecycle.domain.DomainModels.Certificate;
import com.evarsity.lifecycle.domain.DomainModels.CertificateType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.Statement;
import java.time.Instant;
import java.util.List;

@Repository
public class CertificateJdbcRepository {
    private final JdbcTemplate jdbcTemplate;

    public CertificateJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public boolean exists(String studentId, String courseId, CertificateType type) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM certificates WHERE student_id = ? AND course_id = ? AND certificate_type = ?",
                Integer.class, studentId, courseId, type.name());
        return count != null && count > 0;
    }

    public long insert(Certificate c) {
        KeyHolder keys = new GeneratedKeyHolder();
        jdbcTemplate.update(con -> {
            PreparedStatement ps = con.prepareStatement(
                    "INSERT INTO certificates(student_id, course_id, certificate_type, issued_at, certificate_url) VALUES (?,?,?,?,?)",
                    Statement.RETURN_GENERATED_KEYS);
            ps.setString(1, c.studentId());
            ps.setString(2, c.courseId());
            ps.setString(3, c.type().name());
            ps.setString(4, c.issuedAt().toString());
            ps.setString(5, c.url());
            return ps;
        }, keys);
        return keys.getKey().longValue();
    }

    public List<Certificate> findByPair(String studentId, String courseId) {
        return jdbcTemplate.query(
                "SELECT certificate_id, student_id, course_id, certificate_type, issued_at, certificate_url FROM certificates " +
                        "WHERE student_id = ? AND course_id = ? ORDER BY certificate_id",
                (rs, n) -> new Certificate(rs.getLong(1), rs.getString(2), rs.getString(3),
                        CertificateType.valueOf(rs.getString(4)), Instant.parse(rs.getString(5)), rs.getString(6)),
                studentId, courseId);
    }
}
