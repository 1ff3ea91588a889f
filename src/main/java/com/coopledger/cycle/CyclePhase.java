package com.coopledger.cycle;

import com.coopledger.common.Months;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.UUID;

/**
 * A monthly recurring window of a cycle, configured by day of month.
 */
@Entity
@Table(name = "cycle_phases", uniqueConstraints =
    @UniqueConstraint(name = "uk_cycle_phase", columnNames = {"cycle_id", "phase_type"}))
@Data
@NoArgsConstructor
public class CyclePhase {

    @Id
    private String id;

    @Column(name = "cycle_id", nullable = false)
    private String cycleId;

    @Enumerated(EnumType.STRING)
    @Column(name = "phase_type", nullable = false)
    private PhaseType phaseType;

    @Column(name = "start_day")
    private Integer startDay;

    @Column(name = "end_day")
    private Integer endDay;

    @Column(name = "is_open", nullable = false)
    private boolean open;

    @Column(name = "penalty_type_id")
    private String penaltyTypeId;

    @Column(name = "auto_apply_penalty", nullable = false)
    private boolean autoApplyPenalty;

    public CyclePhase(String cycleId, PhaseType phaseType) {
        this.id = UUID.randomUUID().toString();
        this.cycleId = cycleId;
        this.phaseType = phaseType;
        this.open = false;
    }

    /**
     * Last day a submission for the effective month is on time, or null when no end day is set.
     * End days past the length of a month fall back to its last day.
     */
    public LocalDate deadlineFor(YearMonth effectiveMonth) {
        if (endDay == null) {
            return null;
        }
        YearMonth deadlineMonth = phaseType.spansIntoNextMonth()
            ? effectiveMonth.plusMonths(1)
            : effectiveMonth;
        return Months.dayOf(deadlineMonth, endDay);
    }

    public boolean isLate(YearMonth effectiveMonth, LocalDate today) {
        LocalDate deadline = deadlineFor(effectiveMonth);
        return deadline != null && today.isAfter(deadline);
    }

    /**
     * True when lateness against this phase should produce a penalty.
     */
    public boolean appliesPenalties() {
        return autoApplyPenalty && endDay != null && penaltyTypeId != null;
    }
}
