package com.coopledger.cycle;

import com.coopledger.common.Amounts;
import com.coopledger.common.exception.InvalidStateException;
import com.coopledger.common.exception.ValidationException;
import com.coopledger.support.MutableClock;
import com.coopledger.support.TestClockConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for the cycle lifecycle and phase configuration.
 */
@SpringBootTest
@ActiveProfiles("test")
@Transactional
@Import(TestClockConfig.class)
class CycleServiceTest {

    private static final String TREASURER = "treasurer-1";

    @Autowired
    private CycleService cycleService;

    @Autowired
    private CycleRepository cycleRepository;

    @Autowired
    private MutableClock clock;

    @BeforeEach
    void setUp() {
        clock.setDate(LocalDate.of(2025, 3, 10));
    }

    @Test
    void testNewCycleStartsAsDraft() {
        Cycle cycle = createCycle(2025);

        assertEquals(CycleStatus.DRAFT, cycle.getStatus());
        assertEquals(0, Amounts.of("100.00").compareTo(cycle.getSocialFundRequired()));
    }

    @Test
    void testDuplicateYearIsRejected() {
        createCycle(2025);

        assertThrows(ValidationException.class, () -> createCycle(2025));
    }

    @Test
    void testEndBeforeStartIsRejected() {
        assertThrows(ValidationException.class, () -> cycleService.createCycle(2025,
            LocalDate.of(2025, 12, 31), LocalDate.of(2025, 1, 1), null, null, TREASURER));
    }

    @Test
    void testActivatingCycleDemotesTheActiveOne() {
        // Given cycle A is active
        Cycle first = createCycle(2025);
        cycleService.activateCycle(first.getId(), TREASURER);

        // When cycle B is activated
        Cycle second = createCycle(2026);
        cycleService.activateCycle(second.getId(), TREASURER);

        // Then A is back in draft and only B is active
        assertEquals(CycleStatus.DRAFT, cycleService.getCycle(first.getId()).getStatus());
        assertEquals(CycleStatus.ACTIVE, cycleService.getCycle(second.getId()).getStatus());
        assertEquals(second.getId(), cycleService.getActiveCycle().getId());
        List<Cycle> active = cycleRepository.findByStatus(CycleStatus.ACTIVE);
        assertEquals(1, active.size());
    }

    @Test
    void testActivatingActiveCycleKeepsItActive() {
        Cycle cycle = createCycle(2025);
        cycleService.activateCycle(cycle.getId(), TREASURER);

        cycleService.activateCycle(cycle.getId(), TREASURER);

        assertTrue(cycleService.getCycle(cycle.getId()).isActive());
    }

    @Test
    void testClosingCycleClosesItsPhases() {
        Cycle cycle = createCycle(2025);
        cycleService.configurePhase(cycle.getId(), PhaseType.DECLARATION, 1, 20, null, false);
        cycleService.configurePhase(cycle.getId(), PhaseType.DEPOSITS, 1, 5, null, false);
        cycleService.openPhase(cycle.getId(), PhaseType.DECLARATION);
        cycleService.openPhase(cycle.getId(), PhaseType.DEPOSITS);

        cycleService.closeCycle(cycle.getId(), TREASURER);

        assertTrue(cycleService.getCycle(cycle.getId()).isClosed());
        assertFalse(cycleService.isPhaseOpen(cycle.getId(), PhaseType.DECLARATION));
        assertFalse(cycleService.isPhaseOpen(cycle.getId(), PhaseType.DEPOSITS));
    }

    @Test
    void testClosingClosedCycleDoesNothing() {
        Cycle cycle = createCycle(2025);
        cycleService.closeCycle(cycle.getId(), TREASURER);

        Cycle again = cycleService.closeCycle(cycle.getId(), TREASURER);

        assertEquals(CycleStatus.CLOSED, again.getStatus());
    }

    @Test
    void testReopenClosedCycleOfCurrentYear() {
        Cycle cycle = createCycle(2025);
        cycleService.closeCycle(cycle.getId(), TREASURER);

        Cycle reopened = cycleService.reopenCycle(cycle.getId(), TREASURER);

        assertEquals(CycleStatus.DRAFT, reopened.getStatus());
    }

    @Test
    void testPastCycleCannotBeReopened() {
        Cycle cycle = createCycle(2024);
        cycleService.closeCycle(cycle.getId(), TREASURER);

        assertThrows(InvalidStateException.class, () -> cycleService.reopenCycle(cycle.getId(), TREASURER));
    }

    @Test
    void testOnlyClosedCycleCanBeReopened() {
        Cycle cycle = createCycle(2025);

        assertThrows(InvalidStateException.class, () -> cycleService.reopenCycle(cycle.getId(), TREASURER));
    }

    @Test
    void testClosedCycleCannotBeActivated() {
        Cycle cycle = createCycle(2025);
        cycleService.closeCycle(cycle.getId(), TREASURER);

        assertThrows(InvalidStateException.class, () -> cycleService.activateCycle(cycle.getId(), TREASURER));
    }

    @Test
    void testConfiguringPhaseTwiceUpdatesIt() {
        Cycle cycle = createCycle(2025);
        cycleService.configurePhase(cycle.getId(), PhaseType.LOAN_APPLICATION, 1, 10, null, false);

        CyclePhase phase = cycleService.configurePhase(cycle.getId(), PhaseType.LOAN_APPLICATION, 5, 15, null, false);

        assertEquals(1, cycleService.getPhases(cycle.getId()).size());
        assertEquals(5, phase.getStartDay());
        assertEquals(15, cycleService.getPhase(cycle.getId(), PhaseType.LOAN_APPLICATION).getEndDay());
    }

    @Test
    void testInvalidPhaseDayIsRejected() {
        Cycle cycle = createCycle(2025);

        assertThrows(ValidationException.class,
            () -> cycleService.configurePhase(cycle.getId(), PhaseType.DEPOSITS, 1, 32, null, false));
    }

    @Test
    void testPhaseOfClosedCycleCannotBeOpened() {
        Cycle cycle = createCycle(2025);
        cycleService.configurePhase(cycle.getId(), PhaseType.DECLARATION, 1, 20, null, false);
        cycleService.closeCycle(cycle.getId(), TREASURER);

        assertThrows(InvalidStateException.class,
            () -> cycleService.openPhase(cycle.getId(), PhaseType.DECLARATION));
    }

    private Cycle createCycle(int year) {
        return cycleService.createCycle(year, LocalDate.of(year, 1, 1), LocalDate.of(year, 12, 31),
            Amounts.of("100.00"), Amounts.of("50.00"), TREASURER);
    }
}
