package com.coopledger.scheduler;

import com.coopledger.common.SystemActor;
import com.coopledger.cycle.Cycle;
import com.coopledger.cycle.CycleService;
import com.coopledger.funds.ExcessContributionService;
import com.coopledger.ledger.JournalEntry;
import com.coopledger.loans.LoanService;
import com.coopledger.members.Member;
import com.coopledger.members.MemberService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Background sweeps that are safe to re-run:
 * - close loans that have been repaid in full
 * - move excess social and admin fund contributions into savings for the active cycle
 *
 * A failing job is logged and does not stop the other one.
 */
@Component
@ConditionalOnProperty(name = "cooperative.scheduler.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class CooperativeSweepScheduler {

    private final LoanService loanService;
    private final ExcessContributionService excessContributionService;
    private final CycleService cycleService;
    private final MemberService memberService;
    private final SystemActor systemActor;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${cooperative.scheduler.interval-ms:1800000}",
        initialDelayString = "${cooperative.scheduler.initial-delay-ms:60000}")
    public void scheduledSweep() {
        SweepReport report = runSweep();
        log.info("Sweep finished on {}: loansClosed={}, membersSwept={}, excessEntries={}, failures={}",
            report.getRunDate(), report.getLoansClosed(), report.getMembersSwept(),
            report.getExcessEntriesPosted(), report.getMemberSweepFailures() + (report.isLoanSweepFailed() ? 1 : 0));
    }

    public SweepReport runSweep() {
        SweepReport report = new SweepReport();
        report.setRunDate(LocalDate.now(clock));

        try {
            int closed = loanService.closeRepaidLoans();
            report.setLoansClosed(closed);
            if (closed > 0) {
                log.info("Sweep: closed {} fully repaid loans", closed);
            }
        } catch (Exception e) {
            log.error("Sweep: loan auto-close failed", e);
            report.setLoanSweepFailed(true);
        }

        try {
            sweepExcessContributions(report);
        } catch (Exception e) {
            log.error("Sweep: excess contribution sweep failed", e);
            report.setMemberSweepFailures(report.getMemberSweepFailures() + 1);
        }

        report.setMessage(report.isSuccessful() ? "Sweep completed" : "Sweep completed with failures");
        return report;
    }

    private void sweepExcessContributions(SweepReport report) {
        Optional<Cycle> activeCycle = cycleService.findActiveCycle();
        if (activeCycle.isEmpty()) {
            log.debug("Sweep: no active cycle, skipping excess contributions");
            return;
        }
        Cycle cycle = activeCycle.get();
        report.setCycleId(cycle.getId());

        for (Member member : memberService.activeMembers()) {
            try {
                List<JournalEntry> posted = excessContributionService.sweepMemberIndependently(
                    member.getId(), cycle.getId(), systemActor.getId());
                report.setMembersSwept(report.getMembersSwept() + 1);
                report.setExcessEntriesPosted(report.getExcessEntriesPosted() + posted.size());
            } catch (Exception e) {
                log.error("Sweep: excess contribution sweep failed for member {}", member.getId(), e);
                report.setMemberSweepFailures(report.getMemberSweepFailures() + 1);
            }
        }
    }
}
