package com.lendingpool.service;

import com.lendingpool.event.ActivityNotifier;
import com.lendingpool.event.ActivityType;
import com.lendingpool.event.LendingActivity;
import com.lendingpool.event.NotificationResult;
import com.lendingpool.exception.LendingError;
import com.lendingpool.exception.LendingException;
import com.lendingpool.model.AccountBalance;
import com.lendingpool.model.BalanceChange;
import com.lendingpool.model.InterestRateCurve;
import com.lendingpool.model.Pool;
import com.lendingpool.model.PoolMarket;
import com.lendingpool.model.PoolView;
import com.lendingpool.model.UserBalance;
import com.lendingpool.repository.PoolRepository;
import com.lendingpool.repository.UserBalanceRepository;
import com.lendingpool.util.AssetIds;
import com.lendingpool.util.FixedPoint;
import com.lendingpool.util.Timestamps;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * POOL LEDGER
 * ===========
 *
 * Owns every pool row and every depositor balance. Nothing else writes
 * totalDeposits, totalBorrows or totalReserves.
 *
 * LOCKING:
 * ========
 * Pool rows are taken with SELECT ... FOR UPDATE, always in ascending asset order
 * ({@link #lockPools(String...)}). Loan rows are locked only after all pools an
 * operation needs. Every writer follows the same order, so two operations can never
 * wait on each other in a cycle.
 *
 * ACCRUAL:
 * ========
 * Before any read that feeds a decision, the pool is brought up to date:
 *
 *   interest = totalBorrows * borrowRate * elapsed / (SECONDS_PER_YEAR * 10000)
 *   totalBorrows  += interest
 *   totalDeposits += interest
 *   totalReserves += interest * reserveFactor / 10000
 *
 * Interest owed by borrowers is owed to the pool, so it grows both sides and
 * totalBorrows <= totalDeposits survives accrual. totalReserves is the protocol's
 * carve-out of totalDeposits; the rest is depositor yield, published as the supply rate.
 * Running it twice at the same instant adds nothing the second time.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PoolLedger {

    private final PoolRepository poolRepository;
    private final UserBalanceRepository userBalanceRepository;
    private final InterestRateModel rateModel;
    private final InterestRateCurveService curveService;
    private final ProtocolStateService protocolState;
    private final ActivityNotifier activityNotifier;
    private final Clock clock;

    // ========================================
    // LOCKING + ACCRUAL
    // ========================================

    /**
     * Locks one pool row. Throws ASSET_NOT_SUPPORTED if the asset was never listed.
     */
    public Pool lockPool(String asset) {
        return poolRepository.findForUpdate(asset)
                .orElseThrow(() -> LendingException.of(LendingError.ASSET_NOT_SUPPORTED,
                        "Asset %s is not supported", asset));
    }

    /**
     * Locks the given pools in ascending asset order. Duplicates are locked once.
     *
     * @return the locked pools keyed by asset
     */
    public Map<String, Pool> lockPools(String... assets) {
        Map<String, Pool> locked = new LinkedHashMap<>();
        Arrays.stream(assets).distinct().sorted()
                .forEach(asset -> locked.put(asset, lockPool(asset)));
        return locked;
    }

    /**
     * Brings a locked pool up to now.
     *
     * @return interest added to totalBorrows
     */
    public BigDecimal accrue(Pool pool) {
        Instant now = Timestamps.now(clock);
        long elapsed = Duration.between(pool.getLastUpdateTime(), now).getSeconds();
        if (elapsed <= 0) {
            return FixedPoint.ZERO;
        }

        BigDecimal interest = FixedPoint.ZERO;
        if (pool.getTotalBorrows().signum() > 0) {
            InterestRateCurve curve = curveService.curveFor(pool.getAsset());
            int rateBps = rateModel.borrowRateBps(curve, pool.getTotalDeposits(), pool.getTotalBorrows());
            interest = InterestRateModel.simpleInterest(pool.getTotalBorrows(), rateBps, elapsed);

            pool.setTotalBorrows(pool.getTotalBorrows().add(interest));
            pool.setTotalDeposits(pool.getTotalDeposits().add(interest));
            pool.setTotalReserves(pool.getTotalReserves()
                    .add(FixedPoint.applyBps(interest, curve.getReserveFactorBps())));

            log.debug("Accrued {} on {} pool over {}s at {} bps", interest, pool.getAsset(), elapsed, rateBps);
        }
        pool.setLastUpdateTime(now);
        return interest;
    }

    @Transactional
    public PoolView accrue(String asset) {
        Pool pool = lockPool(AssetIds.normalize(asset));
        accrue(pool);
        return poolRepository.save(pool).snapshot();
    }

    // ========================================
    // DEPOSITS
    // ========================================

    @Transactional
    public BalanceChange deposit(String account, String asset, BigDecimal amount) {
        BigDecimal value = requirePositive(amount);
        String assetId = AssetIds.normalize(asset);
        protocolState.requireNotPaused();

        Pool pool = lockPool(assetId);
        requireActive(pool);
        if (!pool.isDepositsEnabled()) {
            throw LendingException.of(LendingError.DEPOSITS_DISABLED, "Deposits are disabled for %s", assetId);
        }
        accrue(pool);

        UserBalance balance = userBalanceRepository.findForUpdate(account, assetId)
                .orElseGet(() -> new UserBalance(account, assetId));
        balance.setDepositedAmount(balance.getDepositedAmount().add(value));
        pool.setTotalDeposits(pool.getTotalDeposits().add(value));

        userBalanceRepository.save(balance);
        poolRepository.save(pool);

        log.info("Deposit: {} supplied {} {} (pool deposits {})", account, value, assetId, pool.getTotalDeposits());
        record(ActivityType.DEPOSIT, account, assetId, value, null);
        return new BalanceChange(account, assetId, value, balance.getDepositedAmount(),
                pool.getTotalDeposits(), pool.availableLiquidity());
    }

    /**
     * Withdraws against the caller's balance. Bounded by both the balance and the
     * liquidity not currently lent out.
     */
    @Transactional
    public BalanceChange withdraw(String account, String asset, BigDecimal amount) {
        BigDecimal value = requirePositive(amount);
        String assetId = AssetIds.normalize(asset);
        protocolState.requireNotPaused();

        // Withdrawals stay open on paused or removed pools so depositors can exit
        Pool pool = lockPool(assetId);
        accrue(pool);

        UserBalance balance = userBalanceRepository.findForUpdate(account, assetId)
                .orElseThrow(() -> LendingException.of(LendingError.INSUFFICIENT_BALANCE,
                        "%s has no %s deposit", account, assetId));
        if (balance.getDepositedAmount().compareTo(value) < 0) {
            throw LendingException.of(LendingError.INSUFFICIENT_BALANCE,
                    "Balance %s is below requested %s", balance.getDepositedAmount(), value);
        }
        BigDecimal available = pool.availableLiquidity();
        if (available.compareTo(value) < 0) {
            throw LendingException.of(LendingError.INSUFFICIENT_LIQUIDITY,
                    "Only %s %s is available for withdrawal", available, assetId);
        }

        balance.setDepositedAmount(balance.getDepositedAmount().subtract(value));
        pool.setTotalDeposits(pool.getTotalDeposits().subtract(value));

        userBalanceRepository.save(balance);
        poolRepository.save(pool);

        log.info("Withdraw: {} took {} {} (pool deposits {})", account, value, assetId, pool.getTotalDeposits());
        record(ActivityType.WITHDRAW, account, assetId, value, null);
        return new BalanceChange(account, assetId, value, balance.getDepositedAmount(),
                pool.getTotalDeposits(), pool.availableLiquidity());
    }

    // ========================================
    // BORROW ACCOUNTING (called by LoanRegistry / LiquidationEngine)
    // ========================================

    /** Caller holds the pool lock and has already checked liquidity and utilization. */
    public void recordBorrow(Pool pool, BigDecimal amount) {
        pool.setTotalBorrows(pool.getTotalBorrows().add(amount));
        poolRepository.save(pool);
    }

    /**
     * Reduces totalBorrows by the principal part of a repayment.
     * The interest part was already folded into totalBorrows by accrual on the pool side.
     */
    public void recordPrincipalRepaid(Pool pool, BigDecimal principal) {
        BigDecimal remaining = pool.getTotalBorrows().subtract(principal);
        if (remaining.signum() < 0) {
            throw new IllegalStateException("totalBorrows of " + pool.getAsset()
                    + " would go negative: " + pool.getTotalBorrows() + " - " + principal);
        }
        pool.setTotalBorrows(remaining);
        poolRepository.save(pool);
    }

    /**
     * Takes reserves out of the pool. Reserves are part of totalDeposits, so both shrink,
     * and the amount must be in the pool rather than lent out.
     * Caller holds the pool lock and has accrued it.
     */
    public void drawReserves(Pool pool, BigDecimal amount) {
        if (pool.getTotalReserves().compareTo(amount) < 0) {
            throw LendingException.of(LendingError.INSUFFICIENT_RESERVES,
                    "Reserves of %s are %s, requested %s", pool.getAsset(), pool.getTotalReserves(), amount);
        }
        BigDecimal available = pool.availableLiquidity();
        if (available.compareTo(amount) < 0) {
            throw LendingException.of(LendingError.INSUFFICIENT_LIQUIDITY,
                    "Only %s %s is in the pool, requested %s of reserves", available, pool.getAsset(), amount);
        }
        pool.setTotalReserves(pool.getTotalReserves().subtract(amount));
        pool.setTotalDeposits(pool.getTotalDeposits().subtract(amount));
        poolRepository.save(pool);
    }

    // ========================================
    // QUERIES
    // ========================================

    @Transactional(readOnly = true)
    public PoolView getPoolInfo(String asset) {
        return findPool(AssetIds.normalize(asset)).snapshot();
    }

    @Transactional(readOnly = true)
    public PoolMarket getMarket(String asset) {
        return toMarket(findPool(AssetIds.normalize(asset)).snapshot());
    }

    @Transactional(readOnly = true)
    public List<PoolMarket> listMarkets() {
        return poolRepository.findAllByOrderByAssetAsc().stream()
                .map(Pool::snapshot)
                .map(this::toMarket)
                .toList();
    }

    @Transactional(readOnly = true)
    public AccountBalance getUserBalance(String account, String asset) {
        String assetId = AssetIds.normalize(asset);
        return userBalanceRepository.findByAccountAndAsset(account, assetId)
                .map(AccountBalance::of)
                .orElseGet(() -> new AccountBalance(account, assetId, FixedPoint.ZERO));
    }

    @Transactional(readOnly = true)
    public List<AccountBalance> getUserBalances(String account) {
        return userBalanceRepository.findByAccountOrderByAssetAsc(account).stream()
                .map(AccountBalance::of)
                .toList();
    }

    public PoolMarket toMarket(PoolView pool) {
        InterestRateCurve curve = curveService.curveFor(pool.asset());
        return new PoolMarket(pool,
                rateModel.utilizationBps(pool.totalDeposits(), pool.totalBorrows()),
                rateModel.borrowRateBps(curve, pool),
                rateModel.supplyRateBps(curve, pool));
    }

    Pool findPool(String asset) {
        return poolRepository.findById(asset)
                .orElseThrow(() -> LendingException.of(LendingError.ASSET_NOT_SUPPORTED,
                        "Asset %s is not supported", asset));
    }

    static void requireActive(Pool pool) {
        if (!pool.isActive()) {
            throw LendingException.of(LendingError.POOL_INACTIVE, "Pool %s is not active", pool.getAsset());
        }
    }

    static BigDecimal requirePositive(BigDecimal amount) {
        BigDecimal value = FixedPoint.of(amount);
        if (value.signum() <= 0) {
            throw new LendingException(LendingError.ZERO_AMOUNT, "Amount must be greater than zero");
        }
        return value;
    }

    private void record(ActivityType type, String account, String asset, BigDecimal amount, Long loanId) {
        NotificationResult result = activityNotifier.notify(new LendingActivity(
                UUID.randomUUID().toString(), type, account, asset, amount, loanId, Timestamps.now(clock)));
        if (!result.recorded()) {
            log.warn("{} activity for {} not recorded: {}", type, account, result.error());
        }
    }
}
