package com.evarsity.lifecycle;

import com.evarsity.lifecycle.enrollment.EnrollmentLedger;
import com.evarsity.lifecycle.error.AlreadyEnrolledException;
import com.evarsity.lifecycle.error.CourseNotFoundException;
import com.evarsity.lifecycle.error.NotEnrolledException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.JdbcTemplate;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@Import(TestClockConfig.class)
class EnrollmentLedgerTest {
    @Autowired
    private EnrollmentLedger ledger;
    @Autowired
    private JdbcTemplate jdbcTemplate;
    @Autowired
    private MutableClock clock;

    @BeforeEach
    void setUp() {
        TestCourses.register(jdbcTemplate, "ledger-c1", "500.00", 180, 5, 0);
        TestCourses.register(jdbcTemplate, "ledger-c2", "300.00", 90, 3, 1);
    }

    @Test
    void enrollsAndLooksUpActiveEnrollment() {
        clock.set(TestClockConfig.START);
        var enrollment = ledger.enroll("ledger-st1", "ledger-c1");

        assertEquals("ledger-st1", enrollment.studentId());
        assertEquals("ledger-c1", enrollment.courseId());
        assertEquals(TestClockConfig.START, enrollment.enrolledAt());

        var found = ledger.lookup("ledger-st1", "ledger-c1");
        assertEquals(enrollment.enrollmentId(), found.enrollmentId());
        assertEquals(enrollment.enrolledAt(), found.enrolledAt());
    }

    @Test
    void rejectsSecondEnrollmentForSamePair() {
        ledger.enroll("ledger-st2", "ledger-c1");

        var ex = assertThrows(AlreadyEnrolledException.class, () -> ledger.enroll("ledger-st2", "ledger-c1"));
        assertTrue(ex.getMessage().contains("already enrolled"));
        assertEquals(1, ledger.listForStudent("ledger-st2").size());
    }

    @Test
    void sameStudentMayEnrollInSeveralCourses() {
        ledger.enroll("ledger-st3", "ledger-c1");
        ledger.enroll("ledger-st3", "ledger-c2");

        var courses = ledger.listForStudent("ledger-st3").stream().map(e -> e.courseId()).toList();
        assertEquals(2, courses.size());
        assertTrue(courses.containsAll(java.util.List.of("ledger-c1", "ledger-c2")));
    }

    @Test
    void lookupOfMissingPairFailsWithNotEnrolled() {
        assertThrows(NotEnrolledException.class, () -> ledger.lookup("ledger-nobody", "ledger-c1"));
        assertTrue(ledger.find("ledger-nobody", "ledger-c1").isEmpty());
    }

    @Test
    void enrollingInUnknownCourseFails() {
        assertThrows(CourseNotFoundException.class, () -> ledger.enroll("ledger-st4", "no-such-course"));
        assertTrue(ledger.listForStudent("ledger-st4").isEmpty());
    }

    @Test
    void deletingCourseRemovesItsEnrollments() {
        TestCourses.register(jdbcTemplate, "ledger-gone", "100.00", 30, 2, 0);
        ledger.enroll("ledger-st9", "ledger-gone");

        jdbcTemplate.update("DELETE FROM courses WHERE course_id = ?", "ledger-gone");

        assertTrue(ledger.find("ledger-st9", "ledger-gone").isEmpty());
        assertThrows(CourseNotFoundException.class, () -> ledger.enroll("ledger-st9", "ledger-gone"));
    }
}
