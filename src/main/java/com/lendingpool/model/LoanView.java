package com.lendingpool.model;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Read model of a {@link Loan}. For an ACTIVE loan, accruedInterest already includes
 * interest up to the moment the view was taken (nothing is persisted by reading).
 */
public record LoanView(
    Long id,
    String borrower,
    String collateralAsset,
    String borrowAsset,
    BigDecimal collateralAmount,
    BigDecimal principal,
    BigDecimal accruedInterest,
    BigDecimal totalDebt,
    int interestRateBps,
    int liquidationThresholdBps,
    LoanStatus status,
    Instant startTime,
    Instant lastAccrualTime,
    Instant closedAt
) {
    public static LoanView of(Loan loan, BigDecimal accruedInterest, Instant asOf) {
        return new LoanView(
                loan.getId(),
                loan.getBorrower(),
                loan.getCollateralAsset(),
                loan.getBorrowAsset(),
                loan.getCollateralAmount(),
                loan.getPrincipal(),
                accruedInterest,
                loan.getPrincipal().add(accruedInterest),
                loan.getInterestRateBps(),
                loan.getLiquidationThresholdBps(),
                loan.getStatus(),
                loan.getStartTime(),
                asOf,
                loan.getClosedAt());
    }
}
