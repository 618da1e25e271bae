package com.lendingpool.controller;

import com.lendingpool.model.AccountBalance;
import com.lendingpool.model.BalanceChange;
import com.lendingpool.model.PoolMarket;
import com.lendingpool.model.PoolView;
import com.lendingpool.service.IdempotencyService;
import com.lendingpool.service.PoolLedger;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.util.List;

/**
 * Deposits, withdrawals and pool reads.
 *
 * The engine only keeps the books: a 200 on a deposit means the transfer into custody
 * is assumed done, a 200 on a withdrawal means the caller may now pay out the amount.
 */
@RestController
@RequestMapping("/api/pools")
@RequiredArgsConstructor
@Slf4j
public class PoolController {

    public static final String CALLER_HEADER = "X-Caller-Id";
    public static final String IDEMPOTENCY_HEADER = "Idempotency-Key";

    private final PoolLedger poolLedger;
    private final IdempotencyService idempotencyService;

    /**
     * GET /api/pools
     */
    @GetMapping
    public ResponseEntity<List<PoolMarket>> listPools() {
        return ResponseEntity.ok(poolLedger.listMarkets());
    }

    /**
     * Pool totals plus utilization, borrow APY and supply APY (bps).
     *
     * GET /api/pools/{asset}
     */
    @GetMapping("/{asset}")
    public ResponseEntity<PoolMarket> getPool(@PathVariable String asset) {
        return ResponseEntity.ok(poolLedger.getMarket(asset));
    }

    /**
     * POST /api/pools/{asset}/deposits
     *
     * Example request:
     * {
     *   "amount": 1500.25
     * }
     */
    @PostMapping("/{asset}/deposits")
    public ResponseEntity<BalanceChange> deposit(
            @RequestHeader(CALLER_HEADER) String caller,
            @RequestHeader(value = IDEMPOTENCY_HEADER, required = false) String idempotencyKey,
            @PathVariable String asset,
            @Valid @RequestBody AmountRequest request) {

        log.info("Deposit request from {}: {} {}", caller, request.getAmount(), asset);
        return ResponseEntity.ok(idempotencyService.execute("deposit", caller, idempotencyKey,
                () -> poolLedger.deposit(caller, asset, request.getAmount())));
    }

    /**
     * POST /api/pools/{asset}/withdrawals
     */
    @PostMapping("/{asset}/withdrawals")
    public ResponseEntity<BalanceChange> withdraw(
            @RequestHeader(CALLER_HEADER) String caller,
            @RequestHeader(value = IDEMPOTENCY_HEADER, required = false) String idempotencyKey,
            @PathVariable String asset,
            @Valid @RequestBody AmountRequest request) {

        log.info("Withdraw request from {}: {} {}", caller, request.getAmount(), asset);
        return ResponseEntity.ok(idempotencyService.execute("withdraw", caller, idempotencyKey,
                () -> poolLedger.withdraw(caller, asset, request.getAmount())));
    }

    /**
     * Forces accrual up to now. Anyone may call it.
     *
     * POST /api/pools/{asset}/accrue
     */
    @PostMapping("/{asset}/accrue")
    public ResponseEntity<PoolView> accrue(@PathVariable String asset) {
        return ResponseEntity.ok(poolLedger.accrue(asset));
    }

    /**
     * GET /api/pools/{asset}/balances/{account}
     */
    @GetMapping("/{asset}/balances/{account}")
    public ResponseEntity<AccountBalance> getBalance(@PathVariable String asset, @PathVariable String account) {
        return ResponseEntity.ok(poolLedger.getUserBalance(account, asset));
    }

    /**
     * GET /api/pools/balances/{account}
     */
    @GetMapping("/balances/{account}")
    public ResponseEntity<List<AccountBalance>> getBalances(@PathVariable String account) {
        return ResponseEntity.ok(poolLedger.getUserBalances(account));
    }

    // ==================== DTOs ====================

    @Data
    public static class AmountRequest {
        @NotNull(message = "Amount is required")
        @Positive(message = "Amount must be positive")
        private BigDecimal amount;
    }
}
