package com.lendingpool.exception;

/**
 * Stable error codes. One code per invariant, so callers can tell exactly which check failed.
 */
public enum LendingError {
    ZERO_AMOUNT,
    ASSET_NOT_SUPPORTED,
    ASSET_ALREADY_SUPPORTED,
    POOL_INACTIVE,
    DEPOSITS_DISABLED,
    BORROWING_DISABLED,
    PROTOCOL_PAUSED,
    INSUFFICIENT_COLLATERAL,
    INSUFFICIENT_LIQUIDITY,     // withdrawal or borrow above deposits - borrows
    INSUFFICIENT_BALANCE,
    INSUFFICIENT_RESERVES,
    LOAN_NOT_FOUND,
    LOAN_NOT_ACTIVE,            // double repay / double liquidate
    LOAN_BELOW_MINIMUM,
    REPAYMENT_EXCEEDS_DEBT,     // reserved: repay and liquidate cap to total debt
    NOT_LIQUIDATABLE,
    STALE_PRICE_DATA,
    LOW_CONFIDENCE_PRICE,
    PRICE_UNAVAILABLE,
    UTILIZATION_LIMIT_EXCEEDED,
    UNAUTHORIZED,
    INVALID_PARAMETER,
    DUPLICATE_REQUEST;

    /** Lower-case form used in API error bodies. */
    public String reason() {
        return name().toLowerCase();
    }
}
