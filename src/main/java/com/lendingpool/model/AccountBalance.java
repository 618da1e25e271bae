package com.lendingpool.model;

import java.math.BigDecimal;

public record AccountBalance(String account, String asset, BigDecimal depositedAmount) {

    public static AccountBalance of(UserBalance balance) {
        return new AccountBalance(balance.getAccount(), balance.getAsset(), balance.getDepositedAmount());
    }
}
