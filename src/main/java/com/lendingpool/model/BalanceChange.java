package com.lendingpool.model;

import java.math.BigDecimal;

/**
 * Result of a deposit or withdrawal.
 */
public record BalanceChange(
    String account,
    String asset,
    BigDecimal amount,
    BigDecimal newBalance,
    BigDecimal poolTotalDeposits,
    BigDecimal poolAvailableLiquidity
) {
}
