package com.lendingpool.model;

/**
 * The assets and status of a loan, read as plain columns.
 *
 * Writers use this to learn which pools to lock. It never puts a {@link Loan} entity
 * into the persistence context, so the later locking read returns the committed row.
 */
public record LoanAssets(Long loanId, String collateralAsset, String borrowAsset, LoanStatus status) {
}
