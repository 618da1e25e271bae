package com.lendingpool.service;

import com.lendingpool.exception.LendingError;
import com.lendingpool.exception.LendingException;
import com.lendingpool.model.BorrowEligibility;
import com.lendingpool.model.Loan;
import com.lendingpool.model.LoanStatus;
import com.lendingpool.model.LoanView;
import com.lendingpool.model.Pool;
import com.lendingpool.model.RepaymentResult;
import com.lendingpool.util.FixedPoint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.clearInvocations;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class LoanRegistryTest {

    private static final Duration ONE_YEAR = Duration.ofSeconds(FixedPoint.SECONDS_PER_YEAR);

    private LendingFixture fx;
    private LoanRegistry registry;

    @BeforeEach
    void setUp() {
        fx = new LendingFixture();
        registry = fx.loanRegistry;
        fx.listPool("WETH", 8000, 500);
        fx.listPool("USDC", 8000, 500);
        fx.price("WETH", "1");
        fx.price("USDC", "1");
        fx.poolLedger.deposit("lender", "USDC", new BigDecimal("10000"));
    }

    @Test
    @DisplayName("Borrowing exactly at the collateral factor succeeds")
    void borrowAtCollateralFactor() {
        LoanView loan = registry.createLoan("bob", "WETH", "USDC", new BigDecimal("1000"), new BigDecimal("800"));

        assertThat(loan.id()).isEqualTo(1L);
        assertThat(loan.status()).isEqualTo(LoanStatus.ACTIVE);
        assertThat(loan.principal()).isEqualByComparingTo("800");
        assertThat(loan.collateralAmount()).isEqualByComparingTo("1000");
        assertThat(loan.liquidationThresholdBps()).isEqualTo(8500);
        // rate is fixed from the pool before this borrow: 0% utilization -> base
        assertThat(loan.interestRateBps()).isEqualTo(200);
        assertThat(fx.pool("USDC").getTotalBorrows()).isEqualByComparingTo("800");
    }

    @Test
    @DisplayName("Borrowing one unit above the collateral factor fails and changes nothing")
    void borrowAboveCollateralFactor() {
        assertThatThrownBy(() -> registry.createLoan("bob", "WETH", "USDC", new BigDecimal("1000"), new BigDecimal("801")))
                .isInstanceOf(LendingException.class)
                .extracting(e -> ((LendingException) e).getError())
                .isEqualTo(LendingError.INSUFFICIENT_COLLATERAL);

        assertThat(fx.loans).isEmpty();
        assertThat(fx.pool("USDC").getTotalBorrows()).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("Loans below the minimum size are rejected")
    void belowMinimum() {
        assertError(() -> registry.createLoan("bob", "WETH", "USDC", BigDecimal.TEN, new BigDecimal("0.5")),
                LendingError.LOAN_BELOW_MINIMUM);
    }

    @Test
    @DisplayName("Borrowing more than the pool holds fails on liquidity")
    void borrowBeyondLiquidity() {
        assertError(() -> registry.createLoan("bob", "WETH", "USDC", new BigDecimal("100000"), new BigDecimal("10001")),
                LendingError.INSUFFICIENT_LIQUIDITY);
    }

    @Test
    @DisplayName("Borrowing past the utilization cap fails even with liquidity left")
    void borrowBeyondUtilizationCap() {
        assertError(() -> registry.createLoan("bob", "WETH", "USDC", new BigDecimal("100000"), new BigDecimal("9500")),
                LendingError.UTILIZATION_LIMIT_EXCEEDED);
    }

    @Test
    @DisplayName("Insufficient collateral is reported ahead of liquidity and utilization limits")
    void collateralCheckedFirst() {
        assertError(() -> registry.createLoan("bob", "WETH", "USDC", new BigDecimal("1000"), new BigDecimal("9500")),
                LendingError.INSUFFICIENT_COLLATERAL);
        assertError(() -> registry.createLoan("bob", "WETH", "USDC", new BigDecimal("1000"), new BigDecimal("20000")),
                LendingError.INSUFFICIENT_COLLATERAL);
    }

    @Test
    @DisplayName("Borrowing from a paused pool fails")
    void borrowingDisabled() {
        fx.pool("USDC").setBorrowingEnabled(false);

        assertError(() -> registry.createLoan("bob", "WETH", "USDC", new BigDecimal("1000"), new BigDecimal("100")),
                LendingError.BORROWING_DISABLED);
    }

    @Test
    @DisplayName("Unlisted collateral is rejected")
    void unlistedCollateral() {
        fx.price("WBTC", "60000");

        assertError(() -> registry.createLoan("bob", "WBTC", "USDC", BigDecimal.ONE, new BigDecimal("100")),
                LendingError.ASSET_NOT_SUPPORTED);
    }

    @Test
    @DisplayName("A stale price aborts origination before any pool is touched")
    void stalePriceAbortsOrigination() {
        fx.clock.advance(Duration.ofHours(2));
        clearInvocations(fx.poolRepository);

        assertError(() -> registry.createLoan("bob", "WETH", "USDC", new BigDecimal("1000"), new BigDecimal("100")),
                LendingError.STALE_PRICE_DATA);

        verify(fx.poolRepository, never()).findForUpdate(anyString());
        assertThat(fx.pool("USDC").getTotalBorrows()).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("An interest-only repayment leaves principal and pool borrows alone")
    void interestOnlyRepayment() {
        Loan loan = openLoan("bob", "1000", 1000);
        fx.clock.advance(ONE_YEAR);
        fx.poolLedger.accrue("USDC");
        BigDecimal poolBorrows = fx.pool("USDC").getTotalBorrows();

        RepaymentResult result = registry.repayLoan("bob", loan.getId(), new BigDecimal("50"));

        assertThat(result.interestPaid()).isEqualByComparingTo("50");
        assertThat(result.principalPaid()).isEqualByComparingTo("0");
        assertThat(result.status()).isEqualTo(LoanStatus.ACTIVE);
        assertThat(fx.loan(loan.getId()).getAccruedInterest()).isEqualByComparingTo("50");
        assertThat(fx.loan(loan.getId()).getPrincipal()).isEqualByComparingTo("1000");
        assertThat(fx.pool("USDC").getTotalBorrows()).isEqualByComparingTo(poolBorrows);
    }

    @Test
    @DisplayName("A partial repayment pays interest first, then principal")
    void partialRepaymentSplit() {
        Loan loan = openLoan("bob", "1000", 1000);
        fx.clock.advance(ONE_YEAR);
        fx.poolLedger.accrue("USDC");
        BigDecimal poolBorrows = fx.pool("USDC").getTotalBorrows();

        RepaymentResult result = registry.repayLoan("bob", loan.getId(), new BigDecimal("300"));

        assertThat(result.interestPaid()).isEqualByComparingTo("100");
        assertThat(result.principalPaid()).isEqualByComparingTo("200");
        assertThat(result.remainingDebt()).isEqualByComparingTo("800");
        assertThat(fx.pool("USDC").getTotalBorrows()).isEqualByComparingTo(poolBorrows.subtract(new BigDecimal("200")));
    }

    @Test
    @DisplayName("Overpaying caps to the debt, closes the loan and releases all collateral")
    void fullRepayment() {
        LoanView opened = registry.createLoan("bob", "WETH", "USDC", new BigDecimal("1000"), new BigDecimal("800"));
        fx.clock.advance(ONE_YEAR);

        RepaymentResult result = registry.repayLoan("bob", opened.id(), new BigDecimal("5000"));

        // 800 at 200 bps for a year
        assertThat(result.amountApplied()).isEqualByComparingTo("816");
        assertThat(result.principalPaid()).isEqualByComparingTo("800");
        assertThat(result.collateralReleased()).isEqualByComparingTo("1000");
        assertThat(result.remainingDebt()).isEqualByComparingTo("0");
        assertThat(result.status()).isEqualTo(LoanStatus.REPAID);

        Loan loan = fx.loan(opened.id());
        assertThat(loan.getCollateralAmount()).isEqualByComparingTo("0");
        assertThat(loan.getClosedAt()).isEqualTo(fx.clock.instant());
    }

    @Test
    @DisplayName("A year at the utilization cap keeps borrows within deposits and lenders can exit after repayment")
    void yearAtUtilizationCap() {
        registry.createLoan("bob", "WETH", "USDC", new BigDecimal("11250"), new BigDecimal("9000"));
        Pool usdc = fx.pool("USDC");

        for (int month = 0; month < 12; month++) {
            fx.clock.advance(Duration.ofDays(30));
            fx.poolLedger.accrue("USDC");
            assertThat(usdc.getTotalBorrows()).isLessThanOrEqualTo(usdc.getTotalDeposits());
        }
        assertThat(usdc.getTotalBorrows()).isGreaterThan(FixedPoint.of(9000));

        RepaymentResult repaid = registry.repayLoan("bob", 1L, new BigDecimal("20000"));
        assertThat(repaid.status()).isEqualTo(LoanStatus.REPAID);
        assertThat(usdc.getTotalBorrows()).isLessThanOrEqualTo(usdc.getTotalDeposits());

        fx.poolLedger.withdraw("lender", "USDC", new BigDecimal("10000"));

        assertThat(fx.poolLedger.getUserBalance("lender", "USDC").depositedAmount()).isEqualByComparingTo("0");
        assertThat(usdc.getTotalBorrows()).isLessThanOrEqualTo(usdc.getTotalDeposits());
    }

    @Test
    @DisplayName("Repaying twice is rejected once the loan is closed")
    void doubleRepay() {
        Loan loan = openLoan("bob", "100", 500);
        registry.repayLoan("bob", loan.getId(), new BigDecimal("100"));

        assertError(() -> registry.repayLoan("bob", loan.getId(), BigDecimal.ONE), LendingError.LOAN_NOT_ACTIVE);
    }

    @Test
    @DisplayName("Only the borrower can repay")
    void repayByStranger() {
        Loan loan = openLoan("bob", "100", 500);

        assertError(() -> registry.repayLoan("mallory", loan.getId(), BigDecimal.ONE), LendingError.UNAUTHORIZED);
        assertError(() -> registry.repayLoan("bob", 99L, BigDecimal.ONE), LendingError.LOAN_NOT_FOUND);
        assertError(() -> registry.repayLoan("bob", loan.getId(), BigDecimal.ZERO), LendingError.ZERO_AMOUNT);
    }

    @Test
    @DisplayName("canBorrow mirrors createLoan without changing state")
    void canBorrow() {
        BorrowEligibility ok = registry.canBorrow("WETH", "USDC", new BigDecimal("1000"), new BigDecimal("800"));
        BorrowEligibility tooMuch = registry.canBorrow("WETH", "USDC", new BigDecimal("1000"), new BigDecimal("801"));

        assertThat(ok.allowed()).isTrue();
        assertThat(tooMuch.allowed()).isFalse();
        assertThat(tooMuch.reason()).isEqualTo(LendingError.INSUFFICIENT_COLLATERAL);
        assertThat(fx.loans).isEmpty();
    }

    @Test
    @DisplayName("Active loan views include interest pending since the last accrual")
    void viewIncludesPendingInterest() {
        Loan loan = openLoan("bob", "1000", 1000);
        fx.clock.advance(ONE_YEAR);

        LoanView view = registry.getLoan(loan.getId());

        assertThat(view.accruedInterest()).isEqualByComparingTo("100");
        assertThat(view.totalDebt()).isEqualByComparingTo("1100");
        assertThat(fx.loan(loan.getId()).getAccruedInterest()).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("Loans are listed per borrower and ids keep counting")
    void userLoansAndNextId() {
        openLoan("bob", "100", 500);
        openLoan("alice", "100", 500);
        openLoan("bob", "200", 500);

        assertThat(registry.getUserLoans("bob")).extracting(LoanView::id).containsExactly(1L, 3L);
        assertThat(registry.nextLoanId()).isEqualTo(4L);
    }

    /** Stores an ACTIVE USDC loan with a chosen rate and books its principal in the pool. */
    private Loan openLoan(String borrower, String principal, int rateBps) {
        Loan loan = new Loan();
        loan.setBorrower(borrower);
        loan.setCollateralAsset("WETH");
        loan.setBorrowAsset("USDC");
        loan.setCollateralAmount(FixedPoint.of(new BigDecimal(principal).multiply(BigDecimal.valueOf(2))));
        loan.setPrincipal(FixedPoint.of(new BigDecimal(principal)));
        loan.setInterestRateBps(rateBps);
        loan.setLiquidationThresholdBps(8500);
        loan.setStartTime(fx.clock.instant());
        loan.setLastAccrualTime(fx.clock.instant());
        Loan saved = fx.loanRepository.save(loan);

        Pool pool = fx.pool("USDC");
        pool.setTotalBorrows(pool.getTotalBorrows().add(saved.getPrincipal()));
        return saved;
    }

    private static void assertError(Runnable call, LendingError expected) {
        assertThatThrownBy(call::run)
                .isInstanceOf(LendingException.class)
                .extracting(e -> ((LendingException) e).getError())
                .isEqualTo(expected);
    }
}
