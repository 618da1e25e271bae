package com.lendingpool.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * 18-decimal fixed-point helpers.
 *
 * Every product is formed before the single division and the result is truncated
 * toward zero, so rounding always favours the protocol.
 */
public final class FixedPoint {
    private FixedPoint() {}

    public static final int SCALE = 18;
    public static final long BPS = 10_000L;
    public static final long SECONDS_PER_YEAR = 31_536_000L;

    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE);

    private static final BigDecimal BPS_DECIMAL = BigDecimal.valueOf(BPS);

    /** Brings a caller-supplied amount onto the 18-decimal grid, dropping extra digits. */
    public static BigDecimal of(BigDecimal amount) {
        if (amount == null) return ZERO;
        return amount.setScale(SCALE, RoundingMode.DOWN);
    }

    public static BigDecimal of(long amount) {
        return BigDecimal.valueOf(amount).setScale(SCALE);
    }

    /** {@code a * b / c}, truncated. */
    public static BigDecimal mulDiv(BigDecimal a, BigDecimal b, BigDecimal c) {
        if (c.signum() == 0) throw new ArithmeticException("division by zero");
        return a.multiply(b).divide(c, SCALE, RoundingMode.DOWN);
    }

    /** {@code amount * bps / 10000}, truncated. */
    public static BigDecimal applyBps(BigDecimal amount, long bps) {
        return mulDiv(amount, BigDecimal.valueOf(bps), BPS_DECIMAL);
    }

    public static boolean isPositive(BigDecimal amount) {
        return amount != null && amount.signum() > 0;
    }

    public static BigDecimal min(BigDecimal a, BigDecimal b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    /** {@code max(0, a - b)}. */
    public static BigDecimal subtractFloor(BigDecimal a, BigDecimal b) {
        BigDecimal r = a.subtract(b);
        return r.signum() < 0 ? ZERO : of(r);
    }
}
