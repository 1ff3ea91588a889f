package com.coopledger.deposits;

import lombok.Value;

/**
 * Published when a deposit approval has been posted.
 */
@Value
public class DepositApprovedEvent {
    String memberId;
    String cycleId;
    String depositProofId;
    String journalEntryId;
}
