package com.coopledger.penalties;

import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * A member's unpaid penalties and what they add up to.
 */
@Value
public class ApplicablePenalties {
    List<PenaltyRecord> records;
    BigDecimal total;
}
