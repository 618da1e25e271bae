package com.lendingpool.access;

/**
 * Privileged mutations an operator can be granted.
 */
public enum AdminAction {
    LIST_ASSET,
    REMOVE_ASSET,
    SET_RISK_PARAMETERS,     // collateral factor, liquidation bonus
    SET_INTEREST_CURVE,
    PAUSE_POOL,
    WITHDRAW_RESERVES,
    PAUSE_PROTOCOL,
    SET_FEE_RECIPIENT,
    POST_PRICE
}
