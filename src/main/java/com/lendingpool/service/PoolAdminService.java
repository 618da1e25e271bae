package com.lendingpool.service;

import com.lendingpool.access.AccessGate;
import com.lendingpool.access.AdminAction;
import com.lendingpool.config.LendingProperties;
import com.lendingpool.event.ActivityNotifier;
import com.lendingpool.event.ActivityType;
import com.lendingpool.event.LendingActivity;
import com.lendingpool.event.NotificationResult;
import com.lendingpool.exception.LendingError;
import com.lendingpool.exception.LendingException;
import com.lendingpool.model.InterestRateCurve;
import com.lendingpool.model.Pool;
import com.lendingpool.model.PoolView;
import com.lendingpool.model.ProtocolState;
import com.lendingpool.oracle.PriceData;
import com.lendingpool.oracle.StaticPriceFeed;
import com.lendingpool.repository.PoolRepository;
import com.lendingpool.util.AssetIds;
import com.lendingpool.util.FixedPoint;
import com.lendingpool.util.Timestamps;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.UUID;

/**
 * Operator surface. Every method asks the {@link AccessGate} first and fails with
 * UNAUTHORIZED before reading or changing anything.
 */
@Service
@Slf4j
public class PoolAdminService {

    private final AccessGate accessGate;
    private final PoolRepository poolRepository;
    private final PoolLedger poolLedger;
    private final InterestRateCurveService curveService;
    private final ProtocolStateService protocolState;
    private final ActivityNotifier activityNotifier;
    private final LendingProperties props;
    private final Clock clock;
    private final ObjectProvider<StaticPriceFeed> staticPriceFeed;

    public PoolAdminService(AccessGate accessGate,
                            PoolRepository poolRepository,
                            PoolLedger poolLedger,
                            InterestRateCurveService curveService,
                            ProtocolStateService protocolState,
                            ActivityNotifier activityNotifier,
                            LendingProperties props,
                            Clock clock,
                            ObjectProvider<StaticPriceFeed> staticPriceFeed) {
        this.accessGate = accessGate;
        this.poolRepository = poolRepository;
        this.poolLedger = poolLedger;
        this.curveService = curveService;
        this.protocolState = protocolState;
        this.activityNotifier = activityNotifier;
        this.props = props;
        this.clock = clock;
        this.staticPriceFeed = staticPriceFeed;
    }

    // ========================================
    // ASSET LISTING
    // ========================================

    /**
     * Lists a new asset, or re-activates a removed one with fresh risk parameters.
     */
    @Transactional
    public PoolView listAsset(String caller, String asset, int collateralFactorBps, int liquidationBonusBps) {
        requireAuthorized(caller, AdminAction.LIST_ASSET);
        String assetId = normalize(asset);
        validateRiskParameters(collateralFactorBps, liquidationBonusBps);

        Pool pool = poolRepository.findForUpdate(assetId).orElse(null);
        if (pool == null) {
            pool = new Pool(assetId, collateralFactorBps, liquidationBonusBps, Timestamps.now(clock));
            log.info("Listed {} (collateral factor {} bps, bonus {} bps) by {}",
                    assetId, collateralFactorBps, liquidationBonusBps, caller);
        } else if (pool.isActive()) {
            throw LendingException.of(LendingError.ASSET_ALREADY_SUPPORTED, "Asset %s is already listed", assetId);
        } else {
            poolLedger.accrue(pool);
            pool.setActive(true);
            pool.setDepositsEnabled(true);
            pool.setBorrowingEnabled(true);
            pool.setCollateralFactorBps(collateralFactorBps);
            pool.setLiquidationBonusBps(liquidationBonusBps);
            log.info("Re-listed {} by {}", assetId, caller);
        }
        return poolRepository.save(pool).snapshot();
    }

    /**
     * Deactivates a pool. Balances and loans stay; withdrawals, repayments and
     * liquidations keep working.
     */
    @Transactional
    public PoolView removeAsset(String caller, String asset) {
        requireAuthorized(caller, AdminAction.REMOVE_ASSET);
        Pool pool = poolLedger.lockPool(normalize(asset));
        poolLedger.accrue(pool);
        pool.setActive(false);
        pool.setDepositsEnabled(false);
        pool.setBorrowingEnabled(false);
        log.warn("Removed {} by {}", pool.getAsset(), caller);
        return poolRepository.save(pool).snapshot();
    }

    @Transactional
    public PoolView setRiskParameters(String caller, String asset, int collateralFactorBps, int liquidationBonusBps) {
        requireAuthorized(caller, AdminAction.SET_RISK_PARAMETERS);
        validateRiskParameters(collateralFactorBps, liquidationBonusBps);
        Pool pool = poolLedger.lockPool(normalize(asset));
        log.info("Risk parameters of {} changed by {}: collateral factor {} -> {}, bonus {} -> {}",
                pool.getAsset(), caller, pool.getCollateralFactorBps(), collateralFactorBps,
                pool.getLiquidationBonusBps(), liquidationBonusBps);
        pool.setCollateralFactorBps(collateralFactorBps);
        pool.setLiquidationBonusBps(liquidationBonusBps);
        return poolRepository.save(pool).snapshot();
    }

    // ========================================
    // INTEREST CURVES
    // ========================================

    /**
     * Sets the curve for one asset, or the protocol default when {@code asset} is null.
     * The affected pool is accrued at its old rate first.
     */
    @Transactional
    public InterestRateCurve setInterestCurve(String caller, String asset, int baseRateBps, int slope1Bps,
                                              int slope2Bps, int optimalUtilizationBps, int reserveFactorBps) {
        requireAuthorized(caller, AdminAction.SET_INTEREST_CURVE);
        if (baseRateBps < 0 || slope1Bps < 0 || slope2Bps < 0) {
            throw new LendingException(LendingError.INVALID_PARAMETER, "Rates and slopes must not be negative");
        }
        if (optimalUtilizationBps <= 0 || optimalUtilizationBps >= FixedPoint.BPS) {
            throw LendingException.of(LendingError.INVALID_PARAMETER,
                    "Optimal utilization must be within 1..9999 bps, got %d", optimalUtilizationBps);
        }
        if (reserveFactorBps < 0 || reserveFactorBps > FixedPoint.BPS) {
            throw LendingException.of(LendingError.INVALID_PARAMETER,
                    "Reserve factor must be within 0..10000 bps, got %d", reserveFactorBps);
        }

        String scope;
        if (asset == null || asset.isBlank()) {
            scope = InterestRateCurve.DEFAULT_SCOPE;
            // pools on the default curve must settle interest at the old rate before it changes
            poolLedger.lockPools(poolRepository.findAllAssets().toArray(String[]::new)).values().forEach(locked -> {
                poolLedger.accrue(locked);
                poolRepository.save(locked);
            });
        } else {
            scope = normalize(asset);
            Pool pool = poolLedger.lockPool(scope);
            poolLedger.accrue(pool);
            poolRepository.save(pool);
        }
        log.info("Interest curve for {} changed by {}", scope, caller);
        return curveService.save(new InterestRateCurve(scope, baseRateBps, slope1Bps, slope2Bps,
                optimalUtilizationBps, reserveFactorBps));
    }

    // ========================================
    // PAUSING
    // ========================================

    @Transactional
    public PoolView pausePool(String caller, String asset) {
        return setPoolEnabled(caller, asset, false);
    }

    @Transactional
    public PoolView unpausePool(String caller, String asset) {
        return setPoolEnabled(caller, asset, true);
    }

    private PoolView setPoolEnabled(String caller, String asset, boolean enabled) {
        requireAuthorized(caller, AdminAction.PAUSE_POOL);
        Pool pool = poolLedger.lockPool(normalize(asset));
        if (enabled) {
            PoolLedger.requireActive(pool);
        }
        pool.setDepositsEnabled(enabled);
        pool.setBorrowingEnabled(enabled);
        log.warn("Pool {} {} by {}", pool.getAsset(), enabled ? "unpaused" : "paused", caller);
        return poolRepository.save(pool).snapshot();
    }

    @Transactional
    public ProtocolState pauseProtocol(String caller) {
        requireAuthorized(caller, AdminAction.PAUSE_PROTOCOL);
        return protocolState.setPaused(true);
    }

    @Transactional
    public ProtocolState unpauseProtocol(String caller) {
        requireAuthorized(caller, AdminAction.PAUSE_PROTOCOL);
        return protocolState.setPaused(false);
    }

    // ========================================
    // RESERVES + FEES
    // ========================================

    /**
     * Draws accumulated reserves. {@code recipient} defaults to the protocol fee recipient.
     */
    @Transactional
    public PoolView withdrawReserves(String caller, String asset, BigDecimal amount, String recipient) {
        requireAuthorized(caller, AdminAction.WITHDRAW_RESERVES);
        BigDecimal value = PoolLedger.requirePositive(amount);
        String to = (recipient == null || recipient.isBlank())
                ? protocolState.current().getFeeRecipient()
                : recipient;

        Pool pool = poolLedger.lockPool(normalize(asset));
        poolLedger.accrue(pool);
        poolLedger.drawReserves(pool, value);

        log.info("Reserves withdrawn: {} {} to {} by {}", value, pool.getAsset(), to, caller);
        NotificationResult result = activityNotifier.notify(new LendingActivity(
                UUID.randomUUID().toString(), ActivityType.RESERVES_WITHDRAWN, to, pool.getAsset(),
                value, null, Timestamps.now(clock)));
        if (!result.recorded()) {
            log.warn("Reserve withdrawal of {} not recorded: {}", pool.getAsset(), result.error());
        }
        return pool.snapshot();
    }

    @Transactional
    public ProtocolState setFeeRecipient(String caller, String feeRecipient) {
        requireAuthorized(caller, AdminAction.SET_FEE_RECIPIENT);
        if (feeRecipient == null || feeRecipient.isBlank()) {
            throw new LendingException(LendingError.INVALID_PARAMETER, "Fee recipient must not be blank");
        }
        return protocolState.setFeeRecipient(feeRecipient.trim());
    }

    // ========================================
    // PRICES
    // ========================================

    /**
     * Posts a price to the operator-fed feed. Rejected when prices come from elsewhere.
     */
    public PriceData postPrice(String caller, String asset, BigDecimal price, int confidenceBps) {
        requireAuthorized(caller, AdminAction.POST_PRICE);
        StaticPriceFeed feed = staticPriceFeed.getIfAvailable();
        if (feed == null) {
            throw new LendingException(LendingError.INVALID_PARAMETER, "Active price feed does not accept posted prices");
        }
        try {
            return feed.post(normalize(asset), price, confidenceBps);
        } catch (IllegalArgumentException e) {
            throw new LendingException(LendingError.INVALID_PARAMETER, e.getMessage(), e);
        }
    }

    // ========================================
    // HELPERS
    // ========================================

    private void requireAuthorized(String caller, AdminAction action) {
        if (!accessGate.authorize(caller, action)) {
            throw LendingException.of(LendingError.UNAUTHORIZED, "%s is not allowed to %s", caller, action);
        }
    }

    private void validateRiskParameters(int collateralFactorBps, int liquidationBonusBps) {
        LendingProperties.Risk risk = props.getRisk();
        if (collateralFactorBps <= 0 || collateralFactorBps > risk.getMaxCollateralFactorBps()) {
            throw LendingException.of(LendingError.INVALID_PARAMETER,
                    "Collateral factor must be within 1..%d bps, got %d",
                    risk.getMaxCollateralFactorBps(), collateralFactorBps);
        }
        if (liquidationBonusBps < 0 || liquidationBonusBps > risk.getMaxLiquidationBonusBps()) {
            throw LendingException.of(LendingError.INVALID_PARAMETER,
                    "Liquidation bonus must be within 0..%d bps, got %d",
                    risk.getMaxLiquidationBonusBps(), liquidationBonusBps);
        }
    }

    private static String normalize(String asset) {
        try {
            return AssetIds.normalize(asset);
        } catch (IllegalArgumentException e) {
            throw new LendingException(LendingError.INVALID_PARAMETER, e.getMessage(), e);
        }
    }
}
