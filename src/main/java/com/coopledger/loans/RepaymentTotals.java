package com.coopledger.loans;

import com.coopledger.common.Amounts;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class RepaymentTotals {

    BigDecimal principal;
    BigDecimal interest;

    public RepaymentTotals(BigDecimal principal, BigDecimal interest) {
        this.principal = Amounts.normalize(principal);
        this.interest = Amounts.normalize(interest);
    }
}
