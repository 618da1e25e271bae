package com.lendingpool.model;

import com.lendingpool.exception.LendingError;

/**
 * Answer to "would this loan be accepted right now?". When not allowed, {@code reason}
 * is the error createLoan would fail with.
 */
public record BorrowEligibility(boolean allowed, LendingError reason, String message) {

    public static BorrowEligibility permitted() {
        return new BorrowEligibility(true, null, null);
    }

    public static BorrowEligibility rejected(LendingError reason, String message) {
        return new BorrowEligibility(false, reason, message);
    }
}
