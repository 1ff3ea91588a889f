package com.coopledger.cycle;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.YearMonth;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for phase deadlines and lateness.
 */
class CyclePhaseTest {

    @Test
    void testDeclarationDeadlineFallsInEffectiveMonth() {
        CyclePhase phase = phase(PhaseType.DECLARATION, 20);

        assertEquals(LocalDate.of(2025, 3, 20), phase.deadlineFor(YearMonth.of(2025, 3)));
        assertFalse(phase.isLate(YearMonth.of(2025, 3), LocalDate.of(2025, 3, 20)));
        assertTrue(phase.isLate(YearMonth.of(2025, 3), LocalDate.of(2025, 3, 21)));
    }

    @Test
    void testDepositsDeadlineFallsInFollowingMonth() {
        CyclePhase phase = phase(PhaseType.DEPOSITS, 5);

        assertEquals(LocalDate.of(2025, 4, 5), phase.deadlineFor(YearMonth.of(2025, 3)));
        assertFalse(phase.isLate(YearMonth.of(2025, 3), LocalDate.of(2025, 3, 28)));
        assertTrue(phase.isLate(YearMonth.of(2025, 3), LocalDate.of(2025, 4, 6)));
    }

    @Test
    void testDepositsDeadlineWrapsIntoNextYear() {
        CyclePhase phase = phase(PhaseType.DEPOSITS, 5);

        assertEquals(LocalDate.of(2026, 1, 5), phase.deadlineFor(YearMonth.of(2025, 12)));
    }

    @Test
    void testEndDayIsClampedToMonthLength() {
        CyclePhase phase = phase(PhaseType.DECLARATION, 31);

        assertEquals(LocalDate.of(2025, 2, 28), phase.deadlineFor(YearMonth.of(2025, 2)));
        assertEquals(LocalDate.of(2024, 2, 29), phase.deadlineFor(YearMonth.of(2024, 2)));
    }

    @Test
    void testPhaseWithoutEndDayIsNeverLate() {
        CyclePhase phase = phase(PhaseType.LOAN_APPLICATION, null);

        assertNull(phase.deadlineFor(YearMonth.of(2025, 3)));
        assertFalse(phase.isLate(YearMonth.of(2025, 3), LocalDate.of(2025, 12, 31)));
    }

    @Test
    void testPenaltiesNeedTypeEndDayAndAutoApply() {
        CyclePhase phase = phase(PhaseType.DECLARATION, 20);
        assertFalse(phase.appliesPenalties());

        phase.setPenaltyTypeId("late-declaration");
        assertFalse(phase.appliesPenalties());

        phase.setAutoApplyPenalty(true);
        assertTrue(phase.appliesPenalties());

        phase.setEndDay(null);
        assertFalse(phase.appliesPenalties());
    }

    private static CyclePhase phase(PhaseType type, Integer endDay) {
        CyclePhase phase = new CyclePhase("cycle-1", type);
        phase.setStartDay(1);
        phase.setEndDay(endDay);
        return phase;
    }
}
