package com.coopledger.credit;

import com.coopledger.common.exception.ConfigurationException;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Interest rates available to a tier in a cycle, by loan term in months.
 */
@Value
public class InterestRateSchedule {

    Map<Integer, BigDecimal> ratesByTerm;

    /**
     * Rate for terms without an explicit entry, or null.
     */
    BigDecimal allTermsRate;

    public static InterestRateSchedule from(List<CreditRatingInterestRange> ranges) {
        Map<Integer, BigDecimal> byTerm = new TreeMap<>();
        BigDecimal wildcard = null;
        for (CreditRatingInterestRange range : ranges) {
            if (range.getTermMonths() == null) {
                wildcard = range.getInterestRate();
            } else {
                byTerm.put(range.getTermMonths(), range.getInterestRate());
            }
        }
        return new InterestRateSchedule(Collections.unmodifiableMap(byTerm), wildcard);
    }

    public Optional<BigDecimal> rateFor(int termMonths) {
        BigDecimal explicit = ratesByTerm.get(termMonths);
        return Optional.ofNullable(explicit != null ? explicit : allTermsRate);
    }

    /**
     * @throws ConfigurationException when neither the term nor the wildcard has a rate
     */
    public BigDecimal requireRateFor(int termMonths) {
        return rateFor(termMonths).orElseThrow(() ->
            new ConfigurationException("No interest rate configured for a " + termMonths + "-month term"));
    }

    public boolean isEmpty() {
        return ratesByTerm.isEmpty() && allTermsRate == null;
    }
}
