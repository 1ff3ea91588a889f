package com.coopledger.deposits;

import com.coopledger.common.SystemActor;
import com.coopledger.funds.ExcessContributionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Sweeps excess fund contributions once a deposit approval has committed.
 * A failed sweep is logged and left for the scheduled sweep to retry.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ExcessContributionListener {

    private final ExcessContributionService excessContributionService;
    private final SystemActor systemActor;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onDepositApproved(DepositApprovedEvent event) {
        try {
            excessContributionService.sweepMemberIndependently(
                event.getMemberId(), event.getCycleId(), systemActor.getId());
        } catch (RuntimeException e) {
            log.warn("Excess contribution sweep failed for member {} after approval of proof {}: {}",
                event.getMemberId(), event.getDepositProofId(), e.getMessage(), e);
        }
    }
}
