package com.lendingpool.service;

import com.lendingpool.config.LendingProperties;
import com.lendingpool.config.RedisConfig;
import com.lendingpool.event.ActivityNotifier;
import com.lendingpool.event.ActivityType;
import com.lendingpool.event.LendingActivity;
import com.lendingpool.event.NotificationResult;
import com.lendingpool.exception.LendingError;
import com.lendingpool.exception.LendingException;
import com.lendingpool.model.BorrowEligibility;
import com.lendingpool.model.Loan;
import com.lendingpool.model.LoanAssets;
import com.lendingpool.model.LoanStatus;
import com.lendingpool.model.LoanView;
import com.lendingpool.model.Pool;
import com.lendingpool.model.PoolView;
import com.lendingpool.model.RepaymentResult;
import com.lendingpool.oracle.PriceSnapshot;
import com.lendingpool.repository.LoanRepository;
import com.lendingpool.util.AssetIds;
import com.lendingpool.util.FixedPoint;
import com.lendingpool.util.Timestamps;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * LOAN REGISTRY
 * =============
 *
 * Owns every loan row and its lifecycle:
 *
 *   ACTIVE --repay in full--> REPAID
 *   ACTIVE --liquidated in full--> LIQUIDATED
 *
 * Terminal states are final. DEFAULTED exists in the enum but nothing moves a loan there.
 *
 * PRINCIPAL / INTEREST SPLIT:
 * ===========================
 * Every payment (repayment or liquidation) settles accruedInterest first and only then
 * principal. The pool's totalBorrows is reduced by the principal part alone, because
 * pool-level accrual has already added interest to totalBorrows. Reducing it by the
 * full payment would remove the same interest twice.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LoanRegistry {

    private final LoanRepository loanRepository;
    private final PoolLedger poolLedger;
    private final InterestRateModel rateModel;
    private final InterestRateCurveService curveService;
    private final ValuationService valuationService;
    private final ProtocolStateService protocolState;
    private final ActivityNotifier activityNotifier;
    private final LendingProperties props;
    private final Clock clock;

    /**
     * How a payment was split between interest and principal.
     */
    public record PaymentSplit(BigDecimal interest, BigDecimal principal) {
        public BigDecimal total() {
            return interest.add(principal);
        }
    }

    // ========================================
    // ORIGINATION
    // ========================================

    /**
     * Opens a loan. Prices are validated before any row is locked or changed, so an
     * oracle failure leaves no trace.
     *
     * Custody of the collateral and payout of the borrowed amount happen outside the
     * engine; the returned view tells the caller what to move.
     */
    @Transactional
    public LoanView createLoan(String borrower, String collateralAsset, String borrowAsset,
                               BigDecimal collateralAmount, BigDecimal borrowAmount) {
        BigDecimal collateral = PoolLedger.requirePositive(collateralAmount);
        BigDecimal borrow = PoolLedger.requirePositive(borrowAmount);
        String collateralId = AssetIds.normalize(collateralAsset);
        String borrowId = AssetIds.normalize(borrowAsset);
        protocolState.requireNotPaused();

        PriceSnapshot prices = valuationService.snapshot(collateralId, borrowId);

        Map<String, Pool> pools = poolLedger.lockPools(collateralId, borrowId);
        Pool collateralPool = pools.get(collateralId);
        Pool borrowPool = pools.get(borrowId);
        for (Pool pool : pools.values()) {
            PoolLedger.requireActive(pool);
            poolLedger.accrue(pool);
        }

        checkBorrow(collateralPool.snapshot(), borrowPool.snapshot(), collateral, borrow, prices);

        int rateBps = rateModel.borrowRateBps(curveService.curveFor(borrowId), borrowPool.snapshot());
        Instant now = Timestamps.now(clock);

        Loan loan = new Loan();
        loan.setBorrower(borrower);
        loan.setCollateralAsset(collateralId);
        loan.setBorrowAsset(borrowId);
        loan.setCollateralAmount(collateral);
        loan.setPrincipal(borrow);
        loan.setInterestRateBps(rateBps);
        loan.setLiquidationThresholdBps(props.getRisk().getLiquidationThresholdBps());
        loan.setStartTime(now);
        loan.setLastAccrualTime(now);
        loan = loanRepository.save(loan);

        poolLedger.recordBorrow(borrowPool, borrow);

        log.info("Loan {} opened: {} borrowed {} {} against {} {} at {} bps",
                loan.getId(), borrower, borrow, borrowId, collateral, collateralId, rateBps);
        record(ActivityType.BORROW, borrower, borrowId, borrow, loan.getId());
        return LoanView.of(loan, loan.getAccruedInterest(), now);
    }

    /**
     * Runs the same checks as {@link #createLoan} without locking or changing anything.
     * Pool totals are taken as of their last accrual.
     */
    @Transactional(readOnly = true)
    public BorrowEligibility canBorrow(String collateralAsset, String borrowAsset,
                                       BigDecimal collateralAmount, BigDecimal borrowAmount) {
        try {
            BigDecimal collateral = PoolLedger.requirePositive(collateralAmount);
            BigDecimal borrow = PoolLedger.requirePositive(borrowAmount);
            String collateralId = AssetIds.normalize(collateralAsset);
            String borrowId = AssetIds.normalize(borrowAsset);
            protocolState.requireNotPaused();

            PriceSnapshot prices = valuationService.snapshot(collateralId, borrowId);
            Pool collateralPool = poolLedger.findPool(collateralId);
            Pool borrowPool = poolLedger.findPool(borrowId);
            PoolLedger.requireActive(collateralPool);
            PoolLedger.requireActive(borrowPool);

            checkBorrow(collateralPool.snapshot(), borrowPool.snapshot(), collateral, borrow, prices);
            return BorrowEligibility.permitted();
        } catch (LendingException e) {
            log.debug("canBorrow rejected: {} {}", e.getError(), e.getMessage());
            return BorrowEligibility.rejected(e.getError(), e.getMessage());
        }
    }

    void checkBorrow(PoolView collateralPool, PoolView borrowPool,
                     BigDecimal collateralAmount, BigDecimal borrowAmount, PriceSnapshot prices) {
        LendingProperties.Risk risk = props.getRisk();

        if (!borrowPool.borrowingEnabled()) {
            throw LendingException.of(LendingError.BORROWING_DISABLED,
                    "Borrowing is disabled for %s", borrowPool.asset());
        }
        if (borrowAmount.compareTo(risk.getMinLoanAmount()) < 0) {
            throw LendingException.of(LendingError.LOAN_BELOW_MINIMUM,
                    "Loan of %s is below the minimum of %s", borrowAmount, risk.getMinLoanAmount());
        }

        BigDecimal collateralValue = prices.valueOf(collateralPool.asset(), collateralAmount);
        BigDecimal borrowingPower = FixedPoint.applyBps(collateralValue, collateralPool.collateralFactorBps());
        BigDecimal borrowValue = prices.valueOf(borrowPool.asset(), borrowAmount);
        if (borrowingPower.compareTo(borrowValue) < 0) {
            throw LendingException.of(LendingError.INSUFFICIENT_COLLATERAL,
                    "Borrowing power %s USD is below requested %s USD", borrowingPower, borrowValue);
        }

        BigDecimal available = FixedPoint.subtractFloor(borrowPool.totalDeposits(), borrowPool.totalBorrows());
        if (borrowAmount.compareTo(available) > 0) {
            throw LendingException.of(LendingError.INSUFFICIENT_LIQUIDITY,
                    "Only %s %s is available to borrow", available, borrowPool.asset());
        }

        // post-borrow utilization must stay within maxUtilizationBps
        BigDecimal borrowsAfter = borrowPool.totalBorrows().add(borrowAmount);
        BigDecimal limit = FixedPoint.applyBps(borrowPool.totalDeposits(), risk.getMaxUtilizationBps());
        if (borrowsAfter.compareTo(limit) > 0) {
            throw LendingException.of(LendingError.UTILIZATION_LIMIT_EXCEEDED,
                    "Borrow would push %s utilization above %d bps", borrowPool.asset(), risk.getMaxUtilizationBps());
        }
    }

    // ========================================
    // REPAYMENT
    // ========================================

    /**
     * Repays up to the loan's total debt. An amount at or above the debt closes the loan
     * and releases all collateral.
     */
    @Transactional
    public RepaymentResult repayLoan(String caller, Long loanId, BigDecimal amount) {
        BigDecimal value = PoolLedger.requirePositive(amount);

        LoanAssets assets = findActiveLoanAssets(loanId);

        Pool borrowPool = poolLedger.lockPool(assets.borrowAsset());
        Loan loan = lockLoan(loanId);
        requireActive(loan);
        if (!loan.getBorrower().equals(caller)) {
            throw LendingException.of(LendingError.UNAUTHORIZED,
                    "Only the borrower can repay loan %d", loanId);
        }

        poolLedger.accrue(borrowPool);
        accrueLoan(loan);

        BigDecimal totalDebt = loan.totalDebt();
        BigDecimal applied = FixedPoint.min(value, totalDebt);
        PaymentSplit split = applyPayment(loan, applied);
        poolLedger.recordPrincipalRepaid(borrowPool, split.principal());

        BigDecimal released = FixedPoint.ZERO;
        if (applied.compareTo(totalDebt) == 0) {
            released = loan.getCollateralAmount();
            loan.setCollateralAmount(FixedPoint.ZERO);
            close(loan, LoanStatus.REPAID);
        }
        loanRepository.save(loan);

        log.info("Loan {} repaid {} (interest {}, principal {}), status {}",
                loanId, applied, split.interest(), split.principal(), loan.getStatus());
        record(ActivityType.REPAY, caller, loan.getBorrowAsset(), applied, loanId);
        return new RepaymentResult(loanId, applied, split.interest(), split.principal(),
                loan.totalDebt(), released, loan.getStatus());
    }

    // ========================================
    // LOAN STATE HELPERS (shared with LiquidationEngine)
    // ========================================

    public Loan findLoan(Long loanId) {
        return loanRepository.findById(loanId)
                .orElseThrow(() -> LendingException.of(LendingError.LOAN_NOT_FOUND, "Loan %d not found", loanId));
    }

    /**
     * Which pools a write on this loan has to lock. Assets never change after origination,
     * so reading them without a lock is safe; the status is rechecked once the loan is locked.
     */
    public LoanAssets findActiveLoanAssets(Long loanId) {
        LoanAssets assets = loanRepository.findAssetsById(loanId)
                .orElseThrow(() -> LendingException.of(LendingError.LOAN_NOT_FOUND, "Loan %d not found", loanId));
        if (assets.status() != LoanStatus.ACTIVE) {
            throw LendingException.of(LendingError.LOAN_NOT_ACTIVE, "Loan %d is %s", loanId, assets.status());
        }
        return assets;
    }

    /**
     * Must be called after every pool the operation touches is locked, and without the
     * loan having been loaded earlier in the transaction.
     */
    public Loan lockLoan(Long loanId) {
        return loanRepository.findForUpdate(loanId)
                .orElseThrow(() -> LendingException.of(LendingError.LOAN_NOT_FOUND, "Loan %d not found", loanId));
    }

    /**
     * Adds interest since lastAccrualTime at the loan's fixed rate.
     *
     * @return interest added
     */
    public BigDecimal accrueLoan(Loan loan) {
        Instant now = Timestamps.now(clock);
        BigDecimal interest = pendingInterest(loan, now);
        if (now.isAfter(loan.getLastAccrualTime())) {
            loan.setAccruedInterest(loan.getAccruedInterest().add(interest));
            loan.setLastAccrualTime(now);
        }
        return interest;
    }

    BigDecimal pendingInterest(Loan loan, Instant now) {
        long elapsed = Duration.between(loan.getLastAccrualTime(), now).getSeconds();
        return InterestRateModel.simpleInterest(loan.getPrincipal(), loan.getInterestRateBps(), elapsed);
    }

    /**
     * Interest first, then principal. {@code amount} must not exceed the total debt.
     */
    public PaymentSplit applyPayment(Loan loan, BigDecimal amount) {
        if (amount.compareTo(loan.totalDebt()) > 0) {
            throw new IllegalStateException("Payment " + amount + " exceeds debt of loan " + loan.getId());
        }
        BigDecimal interestPart = FixedPoint.min(amount, loan.getAccruedInterest());
        BigDecimal principalPart = amount.subtract(interestPart);

        loan.setAccruedInterest(loan.getAccruedInterest().subtract(interestPart));
        loan.setPrincipal(loan.getPrincipal().subtract(principalPart));
        return new PaymentSplit(interestPart, principalPart);
    }

    public void close(Loan loan, LoanStatus terminal) {
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException(terminal + " is not a terminal status");
        }
        loan.setStatus(terminal);
        loan.setClosedAt(Timestamps.now(clock));
    }

    static void requireActive(Loan loan) {
        if (!loan.isActive()) {
            throw LendingException.of(LendingError.LOAN_NOT_ACTIVE,
                    "Loan %d is %s", loan.getId(), loan.getStatus());
        }
    }

    // ========================================
    // QUERIES
    // ========================================

    /**
     * Closed loans never change again, so their views are cached.
     */
    @Cacheable(value = RedisConfig.CLOSED_LOANS_CACHE, key = "#loanId",
               unless = "#result.status() == T(com.lendingpool.model.LoanStatus).ACTIVE")
    @Transactional(readOnly = true)
    public LoanView getLoan(Long loanId) {
        return toView(findLoan(loanId));
    }

    @Transactional(readOnly = true)
    public List<LoanView> getUserLoans(String borrower) {
        return loanRepository.findByBorrowerOrderByIdAsc(borrower).stream()
                .map(this::toView)
                .toList();
    }

    @Transactional(readOnly = true)
    public long nextLoanId() {
        return loanRepository.findMaxId() + 1;
    }

    /** ACTIVE loans include interest pending since their last accrual. */
    public LoanView toView(Loan loan) {
        if (!loan.isActive()) {
            return LoanView.of(loan, loan.getAccruedInterest(), loan.getLastAccrualTime());
        }
        Instant now = Timestamps.now(clock);
        return LoanView.of(loan, loan.getAccruedInterest().add(pendingInterest(loan, now)), now);
    }

    private void record(ActivityType type, String account, String asset, BigDecimal amount, Long loanId) {
        NotificationResult result = activityNotifier.notify(new LendingActivity(
                UUID.randomUUID().toString(), type, account, asset, amount, loanId, Timestamps.now(clock)));
        if (!result.recorded()) {
            log.warn("{} activity for loan {} not recorded: {}", type, loanId, result.error());
        }
    }
}
