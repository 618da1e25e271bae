package com.lendingpool.model;

import java.math.BigDecimal;

/**
 * Outcome of a repayment. {@code collateralReleased} is non-zero only when the loan closed.
 */
public record RepaymentResult(
    Long loanId,
    BigDecimal amountApplied,
    BigDecimal interestPaid,
    BigDecimal principalPaid,
    BigDecimal remainingDebt,
    BigDecimal collateralReleased,
    LoanStatus status
) {
}
