package com.evarsity.lifecycle.repository;

import com.evarsity.lifecycle.domain.DomainModels.SemesterPrerequisite;
import com.evarsity.lifecycle.semester.GradingScale.GradeBand;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public class SemesterPolicyJdbcRepository {
    private final JdbcTemplate jdbcTemplate;

    public SemesterPolicyJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public List<SemesterPrerequisite> loadPrerequisites() {
        return jdbcTemplate.query(
                "SELECT course_id, current_semester, next_semester, min_credits_required, min_gpa_required FROM semester_prerequisites",
                (rs, n) -> new SemesterPrerequisite(rs.getString(1), rs.getInt(2), rs.getInt(3), rs.getInt(4), rs.getBigDecimal(5)));
    }

    public List<GradeBand> loadGradeBands() {
        return jdbcTemplate.query(
                "SELECT grade, min_percentage, max_percentage, grade_points, remarks FROM grading_scale ORDER BY min_percentage DESC",
                (rs, n) -> new GradeBand(rs.getString(1), rs.getDouble(2), rs.getDouble(3), rs.getDouble(4), rs.getString(5)));
    }
}
