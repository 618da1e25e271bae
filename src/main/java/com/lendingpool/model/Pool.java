package com.lendingpool.model;

import com.lendingpool.util.FixedPoint;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Aggregate accounting state of one supported asset.
 *
 * Owned by PoolLedger. Every other component reads pools through
 * {@link PoolView} snapshots taken at the start of an operation.
 *
 * Pools are never deleted. Removing an asset only clears {@code active}.
 *
 * INVARIANT: totalBorrows <= totalDeposits at every mutation checkpoint.
 * Accrual adds the same interest to both totals. totalReserves is the protocol's
 * share of that interest and is counted inside totalDeposits, never out of principal.
 */
@Entity
@Table(name = "pools")
@Data
@NoArgsConstructor
public class Pool {

    @Id
    private String asset;

    @Column(nullable = false, precision = 38, scale = 18)
    private BigDecimal totalDeposits = FixedPoint.ZERO;

    @Column(nullable = false, precision = 38, scale = 18)
    private BigDecimal totalBorrows = FixedPoint.ZERO;

    @Column(nullable = false, precision = 38, scale = 18)
    private BigDecimal totalReserves = FixedPoint.ZERO;

    @Column(nullable = false)
    private Instant lastUpdateTime;

    private boolean active;

    private boolean borrowingEnabled;

    private boolean depositsEnabled;

    @Column(nullable = false)
    private int collateralFactorBps;

    @Column(nullable = false)
    private int liquidationBonusBps;

    @Column(nullable = false)
    private Instant listedAt;

    public Pool(String asset, int collateralFactorBps, int liquidationBonusBps, Instant now) {
        this.asset = asset;
        this.collateralFactorBps = collateralFactorBps;
        this.liquidationBonusBps = liquidationBonusBps;
        this.lastUpdateTime = now;
        this.listedAt = now;
        this.active = true;
        this.borrowingEnabled = true;
        this.depositsEnabled = true;
    }

    /** Deposits not currently lent out; never negative. */
    public BigDecimal availableLiquidity() {
        return FixedPoint.subtractFloor(totalDeposits, totalBorrows);
    }

    public PoolView snapshot() {
        return new PoolView(asset, totalDeposits, totalBorrows, totalReserves, lastUpdateTime,
                active, borrowingEnabled, depositsEnabled, collateralFactorBps, liquidationBonusBps);
    }
}
