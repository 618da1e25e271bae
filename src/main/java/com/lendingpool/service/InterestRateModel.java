package com.lendingpool.service;

import com.lendingpool.model.InterestRateCurve;
import com.lendingpool.model.PoolView;
import com.lendingpool.util.FixedPoint;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * KINKED INTEREST RATE CURVE
 * ==========================
 *
 * Pure function of a pool's utilization (borrows / deposits) and the curve parameters.
 *
 * <pre>
 * u <= optimal:  rate = base + slope1 * u / optimal
 * u >  optimal:  rate = base + slope1 + slope2 * (u - optimal) / (1 - optimal)
 * </pre>
 *
 * Below the kink rates rise gently. Above it the steep second slope makes borrowing
 * expensive quickly, which pushes utilization back down and keeps liquidity available
 * for depositor withdrawals.
 *
 * All rates are annualized basis points, truncated to whole bps.
 */
@Component
public class InterestRateModel {

    private static final BigDecimal BPS = BigDecimal.valueOf(FixedPoint.BPS);

    /**
     * Utilization as a fraction in [0, 1]. Zero when there are no deposits.
     * Capped at 1 because accrual alone can push borrows past deposits.
     */
    public BigDecimal utilization(BigDecimal totalDeposits, BigDecimal totalBorrows) {
        if (totalDeposits.signum() <= 0 || totalBorrows.signum() <= 0) {
            return FixedPoint.ZERO;
        }
        BigDecimal u = totalBorrows.divide(totalDeposits, FixedPoint.SCALE, RoundingMode.DOWN);
        return u.compareTo(BigDecimal.ONE) > 0 ? FixedPoint.of(BigDecimal.ONE) : u;
    }

    public int utilizationBps(BigDecimal totalDeposits, BigDecimal totalBorrows) {
        return utilization(totalDeposits, totalBorrows).multiply(BPS).intValue();
    }

    public int borrowRateBps(InterestRateCurve curve, BigDecimal totalDeposits, BigDecimal totalBorrows) {
        BigDecimal u = utilization(totalDeposits, totalBorrows);
        if (u.signum() == 0) {
            return curve.getBaseRateBps();
        }
        BigDecimal uBps = u.multiply(BPS);
        BigDecimal optimal = BigDecimal.valueOf(curve.getOptimalUtilizationBps());

        BigDecimal rate;
        if (uBps.compareTo(optimal) <= 0) {
            rate = BigDecimal.valueOf(curve.getSlope1Bps()).multiply(uBps)
                    .divide(optimal, FixedPoint.SCALE, RoundingMode.DOWN);
        } else {
            BigDecimal excess = uBps.subtract(optimal);
            BigDecimal headroom = BPS.subtract(optimal);
            rate = BigDecimal.valueOf(curve.getSlope1Bps()).add(
                    BigDecimal.valueOf(curve.getSlope2Bps()).multiply(excess)
                            .divide(headroom, FixedPoint.SCALE, RoundingMode.DOWN));
        }
        return curve.getBaseRateBps() + rate.setScale(0, RoundingMode.DOWN).intValueExact();
    }

    public int borrowRateBps(InterestRateCurve curve, PoolView pool) {
        return borrowRateBps(curve, pool.totalDeposits(), pool.totalBorrows());
    }

    /**
     * supplyRate = borrowRate * utilization * (1 - reserveFactor)
     */
    public int supplyRateBps(InterestRateCurve curve, BigDecimal totalDeposits, BigDecimal totalBorrows) {
        int borrowRate = borrowRateBps(curve, totalDeposits, totalBorrows);
        BigDecimal u = utilization(totalDeposits, totalBorrows);
        BigDecimal depositorShare = BPS.subtract(BigDecimal.valueOf(curve.getReserveFactorBps()));
        return BigDecimal.valueOf(borrowRate)
                .multiply(u)
                .multiply(depositorShare)
                .divide(BPS, 0, RoundingMode.DOWN)
                .intValue();
    }

    public int supplyRateBps(InterestRateCurve curve, PoolView pool) {
        return supplyRateBps(curve, pool.totalDeposits(), pool.totalBorrows());
    }

    /**
     * Simple interest on {@code amount} for {@code elapsedSeconds} at an annual rate:
     * amount * rateBps * elapsed / (SECONDS_PER_YEAR * 10000), truncated.
     */
    public static BigDecimal simpleInterest(BigDecimal amount, int rateBps, long elapsedSeconds) {
        if (elapsedSeconds <= 0 || rateBps <= 0 || amount.signum() <= 0) {
            return FixedPoint.ZERO;
        }
        return FixedPoint.mulDiv(
                amount.multiply(BigDecimal.valueOf(rateBps)),
                BigDecimal.valueOf(elapsedSeconds),
                BigDecimal.valueOf(FixedPoint.SECONDS_PER_YEAR * FixedPoint.BPS));
    }
}
