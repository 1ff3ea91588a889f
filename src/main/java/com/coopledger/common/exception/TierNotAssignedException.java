package com.coopledger.common.exception;

/**
 * Thrown when a member has no credit rating tier in the requested cycle.
 */
public class TierNotAssignedException extends ConfigurationException {

    private final String memberId;
    private final String cycleId;

    public TierNotAssignedException(String memberId, String cycleId) {
        super(String.format("Member %s has no credit rating tier assigned in cycle %s",
            memberId, cycleId));
        this.memberId = memberId;
        this.cycleId = cycleId;
    }

    public String getMemberId() {
        return memberId;
    }

    public String getCycleId() {
        return cycleId;
    }
}
