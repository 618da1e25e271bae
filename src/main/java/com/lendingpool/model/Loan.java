package com.lendingpool.model;

import com.lendingpool.util.FixedPoint;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A single collateralized loan. Owned by LoanRegistry.
 *
 * principal is the outstanding borrowed amount net of repayments; accruedInterest is
 * tracked separately because repayments settle interest first and only the principal
 * part reduces the pool's borrow total.
 *
 * INVARIANT: while ACTIVE, principal + accruedInterest > 0.
 */
@Entity
@Table(name = "loans",
       indexes = @Index(name = "idx_loans_borrower", columnList = "borrower"))
@Data
@NoArgsConstructor
public class Loan {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String borrower;

    @Column(nullable = false)
    private String collateralAsset;

    @Column(nullable = false)
    private String borrowAsset;

    @Column(nullable = false, precision = 38, scale = 18)
    private BigDecimal collateralAmount = FixedPoint.ZERO;

    @Column(nullable = false, precision = 38, scale = 18)
    private BigDecimal principal = FixedPoint.ZERO;

    @Column(nullable = false, precision = 38, scale = 18)
    private BigDecimal accruedInterest = FixedPoint.ZERO;

    // Annualized, fixed at origination
    @Column(nullable = false)
    private int interestRateBps;

    @Column(nullable = false)
    private Instant startTime;

    @Column(nullable = false)
    private Instant lastAccrualTime;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private LoanStatus status = LoanStatus.ACTIVE;

    @Column(nullable = false)
    private int liquidationThresholdBps;

    private Instant closedAt;

    public BigDecimal totalDebt() {
        return principal.add(accruedInterest);
    }

    public boolean isActive() {
        return status == LoanStatus.ACTIVE;
    }
}
