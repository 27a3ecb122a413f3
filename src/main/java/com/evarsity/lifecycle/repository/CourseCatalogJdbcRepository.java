package com.evarsity.lifecycle.repository;

import com.evarsity.lifecycle.catalog.CourseCatalog;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public class CourseCatalogJdbcRepository implements CourseCatalog {
    private final JdbcTemplate jdbcTemplate;

    public CourseCatalogJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<CourseInfo> findCourse(String courseId) {
        List<CourseInfo> rows = jdbcTemplate.query(
                "SELECT course_id, title, price, duration_days, total_lessons, total_assignments FROM courses WHERE course_id = ?",
                (rs, n) -> new CourseInfo(rs.getString(1), rs.getString(2), rs.getBigDecimal(3),
                        rs.getObject(4, Integer.class), rs.getInt(5), rs.getInt(6)),
                courseId);
        return rows.stream().findFirst();
    }
}
