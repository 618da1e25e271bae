package com.lendingpool.service;

import com.lendingpool.event.ActivityNotifier;
import com.lendingpool.event.ActivityType;
import com.lendingpool.event.LendingActivity;
import com.lendingpool.event.LiquidationExecuted;
import com.lendingpool.event.NotificationResult;
import com.lendingpool.exception.LendingError;
import com.lendingpool.exception.LendingException;
import com.lendingpool.model.HealthCheck;
import com.lendingpool.model.LiquidationResult;
import com.lendingpool.model.Loan;
import com.lendingpool.model.LoanAssets;
import com.lendingpool.model.LoanStatus;
import com.lendingpool.model.Pool;
import com.lendingpool.oracle.PriceSnapshot;
import com.lendingpool.util.FixedPoint;
import com.lendingpool.util.Timestamps;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * LIQUIDATION ENGINE
 * ==================
 *
 * healthFactor = collateralValueUSD * liquidationThresholdBps / (debtValueUSD * 10000)
 *
 * A loan is liquidatable iff healthFactor < 1, checked as
 * debtValueUSD * 10000 > collateralValueUSD * liquidationThresholdBps so no division
 * is involved in the decision.
 *
 * TIME-OF-CHECK / TIME-OF-USE:
 * ============================
 * Eligibility is decided only after the pools and the loan are locked and accrued.
 * A health factor read earlier (API, cache, another liquidator) is never trusted:
 * of two concurrent liquidators, the second one re-evaluates against the state the
 * first one left behind.
 *
 * SEIZURE:
 * ========
 *   seize = repay * borrowPrice / collateralPrice
 *   bonus = seize * bonusBps / 10000
 *   total = seize + bonus, capped to the loan's collateral
 *
 * When capped, seize and bonus are rescaled to keep their ratio:
 *   seize = total * 10000 / (10000 + bonusBps), bonus = total - seize
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LiquidationEngine {

    private static final BigDecimal BPS = BigDecimal.valueOf(FixedPoint.BPS);

    // debt too small to carry any USD value at 18 decimals
    static final BigDecimal NO_DEBT_HEALTH_FACTOR = FixedPoint.of(Long.MAX_VALUE);

    private final LoanRegistry loanRegistry;
    private final PoolLedger poolLedger;
    private final ValuationService valuationService;
    private final ActivityNotifier activityNotifier;
    private final Clock clock;

    /**
     * Health of an active loan including interest pending since its last accrual.
     * Nothing is persisted.
     */
    @Transactional(readOnly = true)
    public HealthCheck getLoanHealthFactor(Long loanId) {
        Loan loan = loanRegistry.findLoan(loanId);
        LoanRegistry.requireActive(loan);
        PriceSnapshot prices = valuationService.snapshot(loan.getCollateralAsset(), loan.getBorrowAsset());

        Instant now = Timestamps.now(clock);
        BigDecimal debt = loan.totalDebt().add(loanRegistry.pendingInterest(loan, now));
        return evaluate(loan, debt, prices, now);
    }

    /**
     * Repays up to the loan's total debt on the borrower's behalf and seizes collateral
     * plus bonus. Repaying the whole debt closes the loan as LIQUIDATED.
     */
    @Transactional
    public LiquidationResult liquidate(String liquidator, Long loanId, BigDecimal repayAmount) {
        BigDecimal requested = PoolLedger.requirePositive(repayAmount);

        LoanAssets assets = loanRegistry.findActiveLoanAssets(loanId);
        String collateralAsset = assets.collateralAsset();
        String borrowAsset = assets.borrowAsset();

        // oracle failures abort here, before anything is locked or written
        PriceSnapshot prices = valuationService.snapshot(collateralAsset, borrowAsset);

        Map<String, Pool> pools = poolLedger.lockPools(collateralAsset, borrowAsset);
        Loan loan = loanRegistry.lockLoan(loanId);
        LoanRegistry.requireActive(loan);

        pools.values().forEach(poolLedger::accrue);
        loanRegistry.accrueLoan(loan);

        BigDecimal totalDebt = loan.totalDebt();
        HealthCheck health = evaluate(loan, totalDebt, prices, Timestamps.now(clock));
        if (!health.liquidatable()) {
            throw LendingException.of(LendingError.NOT_LIQUIDATABLE,
                    "Loan %d has health factor %s", loanId, health.healthFactor());
        }

        BigDecimal repay = FixedPoint.min(requested, totalDebt);
        int bonusBps = pools.get(collateralAsset).getLiquidationBonusBps();
        Seizure seizure = seizure(prices.convert(borrowAsset, repay, collateralAsset),
                bonusBps, loan.getCollateralAmount());

        LoanRegistry.PaymentSplit split = loanRegistry.applyPayment(loan, repay);
        poolLedger.recordPrincipalRepaid(pools.get(borrowAsset), split.principal());
        loan.setCollateralAmount(loan.getCollateralAmount().subtract(seizure.total()));

        BigDecimal returned = FixedPoint.ZERO;
        boolean closed = repay.compareTo(totalDebt) == 0;
        if (closed) {
            returned = loan.getCollateralAmount();
            loan.setCollateralAmount(FixedPoint.ZERO);
            loanRegistry.close(loan, LoanStatus.LIQUIDATED);
        }

        log.info("Loan {} liquidated by {}: repaid {} {}, seized {} {} (bonus {}), returned {}, status {}",
                loanId, liquidator, repay, borrowAsset, seizure.total(), collateralAsset,
                seizure.bonus(), returned, loan.getStatus());

        Instant now = Timestamps.now(clock);
        NotificationResult notified = activityNotifier.notify(new LiquidationExecuted(
                UUID.randomUUID().toString(), loanId, liquidator, loan.getBorrower(),
                borrowAsset, repay, collateralAsset, seizure.total(), seizure.bonus(), closed, now));
        if (!notified.recorded()) {
            log.warn("Liquidation of loan {} not recorded: {}", loanId, notified.error());
        }
        NotificationResult activity = activityNotifier.notify(new LendingActivity(
                UUID.randomUUID().toString(), ActivityType.LIQUIDATION, liquidator, borrowAsset, repay, loanId, now));
        if (!activity.recorded()) {
            log.warn("LIQUIDATION activity for loan {} not recorded: {}", loanId, activity.error());
        }

        return new LiquidationResult(loanId, liquidator, repay, split.interest(), split.principal(),
                seizure.seize(), seizure.bonus(), seizure.total(), returned,
                loan.totalDebt(), loan.getCollateralAmount(), loan.getStatus());
    }

    // ========================================
    // PURE HELPERS
    // ========================================

    record Seizure(BigDecimal seize, BigDecimal bonus) {
        BigDecimal total() {
            return seize.add(bonus);
        }
    }

    /**
     * Seize plus bonus for {@code seize} collateral units owed, never more than
     * {@code available}.
     */
    static Seizure seizure(BigDecimal seize, int bonusBps, BigDecimal available) {
        BigDecimal bonus = FixedPoint.applyBps(seize, bonusBps);
        if (seize.add(bonus).compareTo(available) <= 0) {
            return new Seizure(seize, bonus);
        }
        BigDecimal cappedSeize = FixedPoint.mulDiv(available, BPS, BPS.add(BigDecimal.valueOf(bonusBps)));
        return new Seizure(cappedSeize, available.subtract(cappedSeize));
    }

    static boolean isLiquidatable(BigDecimal collateralValue, BigDecimal debtValue, int thresholdBps) {
        return debtValue.multiply(BPS)
                .compareTo(collateralValue.multiply(BigDecimal.valueOf(thresholdBps))) > 0;
    }

    static BigDecimal healthFactor(BigDecimal collateralValue, BigDecimal debtValue, int thresholdBps) {
        if (debtValue.signum() == 0) {
            return NO_DEBT_HEALTH_FACTOR;
        }
        return collateralValue.multiply(BigDecimal.valueOf(thresholdBps))
                .divide(debtValue.multiply(BPS), FixedPoint.SCALE, RoundingMode.DOWN);
    }

    private HealthCheck evaluate(Loan loan, BigDecimal debt, PriceSnapshot prices, Instant asOf) {
        BigDecimal collateralValue = prices.valueOf(loan.getCollateralAsset(), loan.getCollateralAmount());
        BigDecimal debtValue = prices.valueOf(loan.getBorrowAsset(), debt);
        int threshold = loan.getLiquidationThresholdBps();
        return new HealthCheck(loan.getId(), collateralValue, debtValue,
                healthFactor(collateralValue, debtValue, threshold),
                isLiquidatable(collateralValue, debtValue, threshold),
                asOf);
    }
}
