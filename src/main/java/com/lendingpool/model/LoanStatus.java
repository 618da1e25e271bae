package com.lendingpool.model;

/**
 * Loan lifecycle. ACTIVE moves to REPAID or LIQUIDATED exactly once.
 */
public enum LoanStatus {
    ACTIVE,
    REPAID,
    LIQUIDATED,
    DEFAULTED;   // Reserved, no operation transitions into it

    public boolean isTerminal() {
        return this != ACTIVE;
    }
}
