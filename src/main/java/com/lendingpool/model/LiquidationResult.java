package com.lendingpool.model;

import java.math.BigDecimal;

/**
 * What a liquidation moved. The liquidator pays {@code repaidAmount} of the borrow asset and
 * receives {@code totalSeized} of the collateral asset; {@code collateralReturned} goes back
 * to the borrower when the loan closes.
 */
public record LiquidationResult(
    Long loanId,
    String liquidator,
    BigDecimal repaidAmount,
    BigDecimal interestRepaid,
    BigDecimal principalRepaid,
    BigDecimal collateralSeized,
    BigDecimal bonus,
    BigDecimal totalSeized,
    BigDecimal collateralReturned,
    BigDecimal remainingDebt,
    BigDecimal remainingCollateral,
    LoanStatus status
) {
}
