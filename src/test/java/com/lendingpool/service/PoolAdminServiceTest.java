package com.lendingpool.service;

import com.lendingpool.access.AdminAction;
import com.lendingpool.access.ConfiguredAccessGate;
import com.lendingpool.event.ActivityType;
import com.lendingpool.event.LendingActivity;
import com.lendingpool.exception.LendingError;
import com.lendingpool.exception.LendingException;
import com.lendingpool.model.InterestRateCurve;
import com.lendingpool.model.PoolView;
import com.lendingpool.oracle.PriceData;
import com.lendingpool.oracle.StaticPriceFeed;
import com.lendingpool.util.FixedPoint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.beans.factory.ObjectProvider;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.EnumSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PoolAdminServiceTest {

    @Mock
    private ObjectProvider<StaticPriceFeed> staticFeedProvider;

    private LendingFixture fx;
    private PoolAdminService admin;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        fx = new LendingFixture();
        fx.props.getAccess().getGrants().put("ops", EnumSet.allOf(AdminAction.class));
        fx.props.getAccess().getGrants().put("pricer", EnumSet.of(AdminAction.POST_PRICE));
        when(staticFeedProvider.getIfAvailable()).thenReturn(fx.priceFeed);

        admin = new PoolAdminService(new ConfiguredAccessGate(fx.props), fx.poolRepository, fx.poolLedger,
                fx.curveService, fx.protocolState, fx.notifier, fx.props, fx.clock, staticFeedProvider);
    }

    @Test
    @DisplayName("Listing an asset opens an active pool with the given risk parameters")
    void listAsset() {
        PoolView pool = admin.listAsset("ops", "weth", 7500, 800);

        assertThat(pool.asset()).isEqualTo("WETH");
        assertThat(pool.active()).isTrue();
        assertThat(pool.depositsEnabled()).isTrue();
        assertThat(pool.borrowingEnabled()).isTrue();
        assertThat(pool.collateralFactorBps()).isEqualTo(7500);
        assertThat(pool.liquidationBonusBps()).isEqualTo(800);
        assertThat(fx.pools).containsKey("WETH");
    }

    @Test
    @DisplayName("Callers without a grant are refused before anything changes")
    void unauthorizedCaller() {
        assertError(() -> admin.listAsset("pricer", "WETH", 7500, 800), LendingError.UNAUTHORIZED);
        assertError(() -> admin.pauseProtocol("nobody"), LendingError.UNAUTHORIZED);

        assertThat(fx.pools).isEmpty();
        assertThat(fx.protocol[0]).isNull();
    }

    @Test
    @DisplayName("Listing twice is rejected; a removed asset can be listed again")
    void relisting() {
        admin.listAsset("ops", "WETH", 7500, 800);
        assertError(() -> admin.listAsset("ops", "WETH", 7500, 800), LendingError.ASSET_ALREADY_SUPPORTED);

        PoolView removed = admin.removeAsset("ops", "WETH");
        assertThat(removed.active()).isFalse();
        assertThat(removed.depositsEnabled()).isFalse();

        PoolView relisted = admin.listAsset("ops", "WETH", 6000, 1000);
        assertThat(relisted.active()).isTrue();
        assertThat(relisted.collateralFactorBps()).isEqualTo(6000);
    }

    @Test
    @DisplayName("Risk parameters are bounded by the protocol maxima")
    void riskParameterBounds() {
        admin.listAsset("ops", "WETH", 7500, 800);

        assertError(() -> admin.setRiskParameters("ops", "WETH", 9001, 500), LendingError.INVALID_PARAMETER);
        assertError(() -> admin.setRiskParameters("ops", "WETH", 0, 500), LendingError.INVALID_PARAMETER);
        assertError(() -> admin.setRiskParameters("ops", "WETH", 8000, 2001), LendingError.INVALID_PARAMETER);

        PoolView updated = admin.setRiskParameters("ops", "WETH", 9000, 2000);
        assertThat(updated.collateralFactorBps()).isEqualTo(9000);
        assertThat(updated.liquidationBonusBps()).isEqualTo(2000);
    }

    @Test
    @DisplayName("Pausing a pool blocks deposits and borrows until unpaused")
    void pauseAndUnpausePool() {
        admin.listAsset("ops", "USDC", 8000, 500);

        admin.pausePool("ops", "USDC");
        assertError(() -> fx.poolLedger.deposit("alice", "USDC", BigDecimal.TEN), LendingError.DEPOSITS_DISABLED);

        admin.unpausePool("ops", "USDC");
        assertThat(fx.poolLedger.deposit("alice", "USDC", BigDecimal.TEN).newBalance()).isEqualByComparingTo("10");
    }

    @Test
    @DisplayName("Pausing the protocol blocks deposits")
    void pauseProtocol() {
        admin.listAsset("ops", "USDC", 8000, 500);

        assertThat(admin.pauseProtocol("ops").isPaused()).isTrue();
        assertError(() -> fx.poolLedger.deposit("alice", "USDC", BigDecimal.TEN), LendingError.PROTOCOL_PAUSED);

        admin.unpauseProtocol("ops");
        assertThat(fx.protocolState.current().isPaused()).isFalse();
    }

    @Test
    @DisplayName("Curve parameters are validated and stored per scope")
    void interestCurves() {
        admin.listAsset("ops", "USDC", 8000, 500);

        assertError(() -> admin.setInterestCurve("ops", null, 200, 400, 7500, 10_000, 1000), LendingError.INVALID_PARAMETER);
        assertError(() -> admin.setInterestCurve("ops", null, -1, 400, 7500, 8000, 1000), LendingError.INVALID_PARAMETER);
        assertError(() -> admin.setInterestCurve("ops", "USDC", 200, 400, 7500, 8000, 10_001), LendingError.INVALID_PARAMETER);

        admin.setInterestCurve("ops", null, 100, 300, 6000, 9000, 500);
        admin.setInterestCurve("ops", "usdc", 50, 300, 6000, 9000, 500);

        assertThat(fx.curveService.defaultCurve().getBaseRateBps()).isEqualTo(100);
        InterestRateCurve usdc = fx.curveService.curveFor("USDC");
        assertThat(usdc.getScope()).isEqualTo("USDC");
        assertThat(usdc.getBaseRateBps()).isEqualTo(50);
        assertThat(fx.curveService.curveFor("DAI").getScope()).isEqualTo(InterestRateCurve.DEFAULT_SCOPE);
    }

    @Test
    @DisplayName("A curve change settles interest at the old rate first")
    void curveChangeAccruesFirst() {
        admin.listAsset("ops", "USDC", 8000, 500);
        fx.pool("USDC").setTotalDeposits(FixedPoint.of(1000));
        fx.pool("USDC").setTotalBorrows(FixedPoint.of(400));
        fx.clock.advance(Duration.ofSeconds(FixedPoint.SECONDS_PER_YEAR));

        admin.setInterestCurve("ops", "USDC", 5000, 0, 0, 8000, 0);

        assertThat(fx.pool("USDC").getTotalBorrows()).isEqualByComparingTo("416");
        assertThat(fx.pool("USDC").getLastUpdateTime()).isEqualTo(fx.clock.instant());
    }

    @Test
    @DisplayName("Reserve withdrawals are bounded by reserves and default to the fee recipient")
    void withdrawReserves() {
        admin.listAsset("ops", "USDC", 8000, 500);
        fx.pool("USDC").setTotalDeposits(FixedPoint.of(10));
        fx.pool("USDC").setTotalReserves(FixedPoint.of(10));

        assertError(() -> admin.withdrawReserves("ops", "USDC", new BigDecimal("11"), null), LendingError.INSUFFICIENT_RESERVES);

        admin.setFeeRecipient("ops", "dao-treasury");
        PoolView pool = admin.withdrawReserves("ops", "USDC", new BigDecimal("4"), null);

        assertThat(pool.totalReserves()).isEqualByComparingTo("6");
        assertThat(pool.totalDeposits()).isEqualByComparingTo("6");
        ArgumentCaptor<LendingActivity> captor = ArgumentCaptor.forClass(LendingActivity.class);
        verify(fx.notifier).notify(captor.capture());
        assertThat(captor.getValue().type()).isEqualTo(ActivityType.RESERVES_WITHDRAWN);
        assertThat(captor.getValue().account()).isEqualTo("dao-treasury");
    }

    @Test
    @DisplayName("Posted prices land in the operator-fed feed")
    void postPrice() {
        PriceData posted = admin.postPrice("pricer", "weth", new BigDecimal("3150.25"), 9900);

        assertThat(posted.price()).isEqualByComparingTo("3150.25");
        assertThat(fx.priceFeed.getPrice("WETH").confidenceBps()).isEqualTo(9900);
        assertError(() -> admin.postPrice("pricer", "WETH", BigDecimal.ZERO, 9900), LendingError.INVALID_PARAMETER);
    }

    @Test
    @DisplayName("Posting prices is rejected when the feed is not operator-fed")
    void postPriceWithoutStaticFeed() {
        when(staticFeedProvider.getIfAvailable()).thenReturn(null);

        assertError(() -> admin.postPrice("pricer", "WETH", BigDecimal.ONE, 9900), LendingError.INVALID_PARAMETER);
    }

    private static void assertError(Runnable call, LendingError expected) {
        assertThatThrownBy(call::run)
                .isInstanceOf(LendingException.class)
                .extracting(e -> ((LendingException) e).getError())
                .isEqualTo(expected);
    }
}
