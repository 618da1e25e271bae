package com.lendingpool.model;

import com.lendingpool.util.FixedPoint;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * A depositor's claim on pool liquidity: (account, asset) -> depositedAmount.
 */
@Entity
@Table(name = "user_balances",
       uniqueConstraints = @UniqueConstraint(name = "uk_balance_account_asset", columnNames = {"account", "asset"}))
@Data
@NoArgsConstructor
public class UserBalance {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String account;

    @Column(nullable = false)
    private String asset;

    @Column(nullable = false, precision = 38, scale = 18)
    private BigDecimal depositedAmount = FixedPoint.ZERO;

    public UserBalance(String account, String asset) {
        this.account = account;
        this.asset = asset;
    }
}
