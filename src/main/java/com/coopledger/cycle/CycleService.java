package com.coopledger.cycle;

import com.coopledger.common.exception.InvalidStateException;
import com.coopledger.common.exception.NotFoundException;
import com.coopledger.common.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Service for the cycle lifecycle and its phase calendar.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CycleService {

    private final CycleRepository cycleRepository;
    private final CyclePhaseRepository phaseRepository;
    private final Clock clock;

    @Transactional
    public Cycle createCycle(int year, LocalDate startDate, LocalDate endDate,
                             BigDecimal socialFundRequired, BigDecimal adminFundRequired, String actorId) {
        if (endDate.isBefore(startDate)) {
            throw new ValidationException("Cycle end date " + endDate + " is before its start date " + startDate);
        }
        if (cycleRepository.existsByYear(year)) {
            throw new ValidationException("A cycle already exists for " + year);
        }
        Cycle cycle = cycleRepository.save(
            new Cycle(year, startDate, endDate, socialFundRequired, adminFundRequired, actorId));
        log.info("Created cycle {} for {} by {}", cycle.getId(), year, actorId);
        return cycle;
    }

    @Transactional(readOnly = true)
    public Cycle getCycle(String cycleId) {
        return cycleRepository.findById(cycleId)
            .orElseThrow(() -> new NotFoundException("Cycle", cycleId));
    }

    @Transactional(readOnly = true)
    public Optional<Cycle> findActiveCycle() {
        return cycleRepository.findFirstByStatusOrderByYearDesc(CycleStatus.ACTIVE);
    }

    @Transactional(readOnly = true)
    public Cycle getActiveCycle() {
        return findActiveCycle()
            .orElseThrow(() -> new NotFoundException("Cycle", "active"));
    }

    /**
     * Activate a cycle, demoting whichever cycle was active before, in the same transaction.
     */
    @Transactional
    public Cycle activateCycle(String cycleId, String actorId) {
        Cycle cycle = getCycle(cycleId);
        for (Cycle other : cycleRepository.findByStatus(CycleStatus.ACTIVE)) {
            if (!other.getId().equals(cycleId)) {
                other.demote();
                cycleRepository.save(other);
                log.info("Demoted cycle {} to DRAFT", other.getId());
            }
        }
        cycle.activate();
        cycleRepository.save(cycle);
        log.info("Activated cycle {} ({}) by {}", cycleId, cycle.getYear(), actorId);
        return cycle;
    }

    /**
     * Close a cycle and all of its phases. Closing an already closed cycle does nothing.
     */
    @Transactional
    public Cycle closeCycle(String cycleId, String actorId) {
        Cycle cycle = getCycle(cycleId);
        if (cycle.isClosed()) {
            log.info("Cycle {} is already closed", cycleId);
            return cycle;
        }
        cycle.close();
        cycleRepository.save(cycle);
        for (CyclePhase phase : phaseRepository.findByCycleId(cycleId)) {
            phase.setOpen(false);
            phaseRepository.save(phase);
        }
        log.info("Closed cycle {} ({}) by {}", cycleId, cycle.getYear(), actorId);
        return cycle;
    }

    @Transactional
    public Cycle reopenCycle(String cycleId, String actorId) {
        Cycle cycle = getCycle(cycleId);
        cycle.reopen(LocalDate.now(clock).getYear());
        cycleRepository.save(cycle);
        log.info("Reopened cycle {} ({}) by {}", cycleId, cycle.getYear(), actorId);
        return cycle;
    }

    /**
     * Create or update the phase of the given type.
     */
    @Transactional
    public CyclePhase configurePhase(String cycleId, PhaseType phaseType, Integer startDay, Integer endDay,
                                     String penaltyTypeId, boolean autoApplyPenalty) {
        Cycle cycle = getCycle(cycleId);
        if (cycle.isClosed()) {
            throw new InvalidStateException("Cycle", cycleId, cycle.getStatus().name(), "configure phase");
        }
        validateDay(startDay, "Start day");
        validateDay(endDay, "End day");

        CyclePhase phase = phaseRepository.findByCycleIdAndPhaseType(cycleId, phaseType)
            .orElseGet(() -> new CyclePhase(cycleId, phaseType));
        phase.setStartDay(startDay);
        phase.setEndDay(endDay);
        phase.setPenaltyTypeId(penaltyTypeId);
        phase.setAutoApplyPenalty(autoApplyPenalty);
        phaseRepository.save(phase);

        log.info("Configured {} phase for cycle {}: days {}-{}, penaltyType={}, autoApply={}",
            phaseType, cycleId, startDay, endDay, penaltyTypeId, autoApplyPenalty);
        return phase;
    }

    @Transactional
    public CyclePhase openPhase(String cycleId, PhaseType phaseType) {
        Cycle cycle = getCycle(cycleId);
        if (cycle.isClosed()) {
            throw new InvalidStateException("Cycle", cycleId, cycle.getStatus().name(), "open phase");
        }
        CyclePhase phase = getPhase(cycleId, phaseType);
        phase.setOpen(true);
        log.info("Opened {} phase for cycle {}", phaseType, cycleId);
        return phaseRepository.save(phase);
    }

    @Transactional
    public CyclePhase closePhase(String cycleId, PhaseType phaseType) {
        CyclePhase phase = getPhase(cycleId, phaseType);
        phase.setOpen(false);
        log.info("Closed {} phase for cycle {}", phaseType, cycleId);
        return phaseRepository.save(phase);
    }

    @Transactional(readOnly = true)
    public boolean isPhaseOpen(String cycleId, PhaseType phaseType) {
        return findPhase(cycleId, phaseType).map(CyclePhase::isOpen).orElse(false);
    }

    @Transactional(readOnly = true)
    public Optional<CyclePhase> findPhase(String cycleId, PhaseType phaseType) {
        return phaseRepository.findByCycleIdAndPhaseType(cycleId, phaseType);
    }

    @Transactional(readOnly = true)
    public CyclePhase getPhase(String cycleId, PhaseType phaseType) {
        return findPhase(cycleId, phaseType)
            .orElseThrow(() -> new NotFoundException("Cycle phase", cycleId + "/" + phaseType));
    }

    @Transactional(readOnly = true)
    public List<CyclePhase> getPhases(String cycleId) {
        return phaseRepository.findByCycleId(cycleId);
    }

    private static void validateDay(Integer day, String field) {
        if (day != null && (day < 1 || day > 31)) {
            throw new ValidationException(field + " must be between 1 and 31: " + day);
        }
    }
}
