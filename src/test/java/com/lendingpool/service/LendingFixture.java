package com.lendingpool.service;

import com.lendingpool.config.LendingProperties;
import com.lendingpool.event.ActivityNotifier;
import com.lendingpool.event.LendingActivity;
import com.lendingpool.event.LiquidationExecuted;
import com.lendingpool.event.NotificationResult;
import com.lendingpool.model.InterestRateCurve;
import com.lendingpool.model.Loan;
import com.lendingpool.model.LoanAssets;
import com.lendingpool.model.Pool;
import com.lendingpool.model.ProtocolState;
import com.lendingpool.model.UserBalance;
import com.lendingpool.oracle.StaticPriceFeed;
import com.lendingpool.repository.InterestRateCurveRepository;
import com.lendingpool.repository.LoanRepository;
import com.lendingpool.repository.PoolRepository;
import com.lendingpool.repository.ProtocolStateRepository;
import com.lendingpool.repository.UserBalanceRepository;
import com.lendingpool.support.MutableClock;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Wires the real engine services over map-backed repository mocks, a static price
 * feed and a clock the test controls.
 */
class LendingFixture {

    static final Instant START = Instant.parse("2024-01-01T00:00:00Z");

    final MutableClock clock = new MutableClock(START);
    final LendingProperties props = new LendingProperties();

    final Map<String, Pool> pools = new HashMap<>();
    final Map<Long, Loan> loans = new HashMap<>();
    final Map<String, UserBalance> balances = new HashMap<>();
    final Map<String, InterestRateCurve> curves = new HashMap<>();
    final ProtocolState[] protocol = new ProtocolState[1];
    private final AtomicLong loanIds = new AtomicLong();

    final PoolRepository poolRepository = mock(PoolRepository.class);
    final LoanRepository loanRepository = mock(LoanRepository.class);
    final UserBalanceRepository userBalanceRepository = mock(UserBalanceRepository.class);
    final InterestRateCurveRepository curveRepository = mock(InterestRateCurveRepository.class);
    final ProtocolStateRepository protocolStateRepository = mock(ProtocolStateRepository.class);
    final ActivityNotifier notifier = mock(ActivityNotifier.class);

    final StaticPriceFeed priceFeed = new StaticPriceFeed(clock);
    final InterestRateModel rateModel = new InterestRateModel();
    final InterestRateCurveService curveService;
    final ProtocolStateService protocolState;
    final ValuationService valuationService;
    final PoolLedger poolLedger;
    final LoanRegistry loanRegistry;
    final LiquidationEngine liquidationEngine;

    LendingFixture() {
        stubPools();
        stubLoans();
        stubBalances();
        stubCurvesAndProtocol();
        when(notifier.notify(any(LendingActivity.class))).thenReturn(NotificationResult.ok());
        when(notifier.notify(any(LiquidationExecuted.class))).thenReturn(NotificationResult.ok());

        curveService = new InterestRateCurveService(curveRepository, props);
        protocolState = new ProtocolStateService(protocolStateRepository, props);
        valuationService = new ValuationService(priceFeed, props, clock);
        poolLedger = new PoolLedger(poolRepository, userBalanceRepository, rateModel, curveService,
                protocolState, notifier, clock);
        loanRegistry = new LoanRegistry(loanRepository, poolLedger, rateModel, curveService,
                valuationService, protocolState, notifier, props, clock);
        liquidationEngine = new LiquidationEngine(loanRegistry, poolLedger, valuationService, notifier, clock);
    }

    Pool listPool(String asset, int collateralFactorBps, int liquidationBonusBps) {
        Pool pool = new Pool(asset, collateralFactorBps, liquidationBonusBps, clock.instant());
        pools.put(asset, pool);
        return pool;
    }

    void price(String asset, String usd) {
        priceFeed.post(asset, new BigDecimal(usd), 10_000);
    }

    Pool pool(String asset) {
        return pools.get(asset);
    }

    Loan loan(Long id) {
        return loans.get(id);
    }

    private void stubPools() {
        when(poolRepository.findForUpdate(anyString()))
                .thenAnswer(inv -> Optional.ofNullable(pools.get(inv.<String>getArgument(0))));
        when(poolRepository.findById(anyString()))
                .thenAnswer(inv -> Optional.ofNullable(pools.get(inv.<String>getArgument(0))));
        when(poolRepository.save(any(Pool.class))).thenAnswer(inv -> {
            Pool pool = inv.getArgument(0);
            pools.put(pool.getAsset(), pool);
            return pool;
        });
        when(poolRepository.findAllAssets()).thenAnswer(inv -> pools.keySet().stream().sorted().toList());
        when(poolRepository.findAllByOrderByAssetAsc()).thenAnswer(inv -> pools.values().stream()
                .sorted(Comparator.comparing(Pool::getAsset))
                .toList());
    }

    private void stubLoans() {
        when(loanRepository.save(any(Loan.class))).thenAnswer(inv -> {
            Loan loan = inv.getArgument(0);
            if (loan.getId() == null) {
                loan.setId(loanIds.incrementAndGet());
            }
            loans.put(loan.getId(), loan);
            return loan;
        });
        when(loanRepository.findById(anyLong()))
                .thenAnswer(inv -> Optional.ofNullable(loans.get(inv.<Long>getArgument(0))));
        when(loanRepository.findAssetsById(anyLong())).thenAnswer(inv -> Optional.ofNullable(loans.get(inv.<Long>getArgument(0)))
                .map(l -> new LoanAssets(l.getId(), l.getCollateralAsset(), l.getBorrowAsset(), l.getStatus())));
        when(loanRepository.findForUpdate(anyLong()))
                .thenAnswer(inv -> Optional.ofNullable(loans.get(inv.<Long>getArgument(0))));
        when(loanRepository.findByBorrowerOrderByIdAsc(anyString())).thenAnswer(inv -> loans.values().stream()
                .filter(l -> l.getBorrower().equals(inv.getArgument(0)))
                .sorted(Comparator.comparing(Loan::getId))
                .toList());
        when(loanRepository.findMaxId()).thenAnswer(inv -> loanIds.get());
    }

    private void stubBalances() {
        when(userBalanceRepository.findForUpdate(anyString(), anyString()))
                .thenAnswer(inv -> Optional.ofNullable(balances.get(key(inv.getArgument(0), inv.getArgument(1)))));
        when(userBalanceRepository.findByAccountAndAsset(anyString(), anyString()))
                .thenAnswer(inv -> Optional.ofNullable(balances.get(key(inv.getArgument(0), inv.getArgument(1)))));
        when(userBalanceRepository.save(any(UserBalance.class))).thenAnswer(inv -> {
            UserBalance balance = inv.getArgument(0);
            balances.put(key(balance.getAccount(), balance.getAsset()), balance);
            return balance;
        });
        when(userBalanceRepository.findByAccountOrderByAssetAsc(anyString())).thenAnswer(inv -> balances.values().stream()
                .filter(b -> b.getAccount().equals(inv.getArgument(0)))
                .sorted(Comparator.comparing(UserBalance::getAsset))
                .toList());
    }

    private void stubCurvesAndProtocol() {
        when(curveRepository.findById(anyString()))
                .thenAnswer(inv -> Optional.ofNullable(curves.get(inv.<String>getArgument(0))));
        when(curveRepository.save(any(InterestRateCurve.class))).thenAnswer(inv -> {
            InterestRateCurve curve = inv.getArgument(0);
            curves.put(curve.getScope(), curve);
            return curve;
        });
        when(protocolStateRepository.findById(anyLong()))
                .thenAnswer(inv -> Optional.ofNullable(protocol[0]));
        when(protocolStateRepository.save(any(ProtocolState.class))).thenAnswer(inv -> {
            protocol[0] = inv.getArgument(0);
            return protocol[0];
        });
    }

    private static String key(Object account, Object asset) {
        return account + "|" + asset;
    }
}
