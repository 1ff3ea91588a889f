package com.coopledger.scheduler;

import lombok.Data;

import java.time.LocalDate;

/**
 * Outcome of one run of the background sweeps.
 */
@Data
public class SweepReport {
    private LocalDate runDate;
    private String cycleId;
    private int loansClosed;
    private boolean loanSweepFailed;
    private int membersSwept;
    private int excessEntriesPosted;
    private int memberSweepFailures;
    private String message;

    public boolean isSuccessful() {
        return !loanSweepFailed && memberSweepFailures == 0;
    }
}
