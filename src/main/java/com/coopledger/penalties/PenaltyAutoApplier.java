package com.coopledger.penalties;

import com.coopledger.common.Months;
import com.coopledger.common.SystemActor;
import com.coopledger.cycle.CyclePhase;
import com.coopledger.cycle.CycleService;
import com.coopledger.cycle.PhaseType;
import com.coopledger.members.Member;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Locale;
import java.util.Optional;

/**
 * Charges the phase's penalty when a member submits after the phase deadline.
 *
 * At most one record exists per (member, penalty type, effective month), however
 * often the same submission is re-evaluated.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PenaltyAutoApplier {

    private final CycleService cycleService;
    private final PenaltyService penaltyService;
    private final PenaltyRecordRepository recordRepository;
    private final SystemActor systemActor;
    private final Clock clock;

    @Transactional
    public Optional<PenaltyRecord> applyForDeclaration(Member member, String cycleId, LocalDate effectiveMonth) {
        return apply(member, cycleId, PhaseType.DECLARATION, YearMonth.from(effectiveMonth));
    }

    /**
     * Loan applications are judged against the month they are submitted in.
     */
    @Transactional
    public Optional<PenaltyRecord> applyForLoanApplication(Member member, String cycleId) {
        return apply(member, cycleId, PhaseType.LOAN_APPLICATION, YearMonth.now(clock));
    }

    @Transactional
    public Optional<PenaltyRecord> applyForDepositProof(Member member, String cycleId, LocalDate effectiveMonth) {
        return apply(member, cycleId, PhaseType.DEPOSITS, YearMonth.from(effectiveMonth));
    }

    private Optional<PenaltyRecord> apply(Member member, String cycleId, PhaseType phaseType, YearMonth month) {
        Optional<CyclePhase> configured = cycleService.findPhase(cycleId, phaseType);
        if (configured.isEmpty() || !configured.get().appliesPenalties()) {
            return Optional.empty();
        }
        CyclePhase phase = configured.get();

        LocalDate today = LocalDate.now(clock);
        if (!phase.isLate(month, today)) {
            return Optional.empty();
        }

        PenaltyType type = penaltyService.getPenaltyType(phase.getPenaltyTypeId());
        if (!type.isEnabled()) {
            log.debug("Penalty type {} is disabled, not charging member {}", type.getName(), member.getId());
            return Optional.empty();
        }

        LocalDate effectiveMonth = Months.firstDay(month);
        if (penaltyService.existsForMonth(member.getId(), type.getId(), effectiveMonth)) {
            log.info("Penalty {} already recorded for member {} in {}",
                type.getName(), member.getId(), Months.label(effectiveMonth));
            return Optional.empty();
        }

        String notes = String.format("Late %s for %s (deadline %s)",
            phaseType.name().toLowerCase(Locale.ROOT).replace('_', ' '), Months.label(effectiveMonth),
            phase.deadlineFor(month));
        PenaltyRecord record = recordRepository.save(new PenaltyRecord(member.getId(), type, cycleId,
            today, effectiveMonth, notes, systemActor.getId()));
        penaltyService.charge(record, member, systemActor.getId());

        log.info("Auto-applied penalty {}: member={}, phase={}, month={}, fee={}",
            record.getId(), member.getId(), phaseType, Months.label(effectiveMonth), record.getFeeAmount());
        return Optional.of(record);
    }
}
