package com.lendingpool.event;

public enum ActivityType {
    DEPOSIT,
    WITHDRAW,
    BORROW,
    REPAY,
    LIQUIDATION,
    RESERVES_WITHDRAWN
}
