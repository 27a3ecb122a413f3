package com.evarsity.lifecycle;

import com.evarsity.lifecycle.progress.ProgressFormula;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ProgressFormulaTest {

    @Test
    void zeroWhenCourseHasNoActivities() {
        assertEquals(0.0, ProgressFormula.percentage(0, 0, 0, 0));
        assertEquals(0.0, ProgressFormula.percentage(0, 3, 0, 2));
    }

    @Test
    void countsLessonsAndAssignmentsTogether() {
        assertEquals(90.0, ProgressFormula.percentage(10, 9, 0, 0), 1e-9);
        assertEquals(50.0, ProgressFormula.percentage(6, 3, 2, 1), 1e-9);
        assertEquals(100.0 / 3, ProgressFormula.percentage(2, 1, 1, 0), 1e-9);
    }

    @Test
    void staysWithinBounds() {
        for (int total = 0; total <= 6; total++) {
            for (int done = 0; done <= 8; done++) {
                double p = ProgressFormula.percentage(total, done, 1, 0);
                assertTrue(p >= 0.0 && p <= 100.0, "percentage " + p);
            }
        }
        assertEquals(100.0, ProgressFormula.percentage(2, 5, 0, 0));
    }
}
