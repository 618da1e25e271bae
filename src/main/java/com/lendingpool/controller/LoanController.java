package com.lendingpool.controller;

import com.lendingpool.model.BorrowEligibility;
import com.lendingpool.model.HealthCheck;
import com.lendingpool.model.LiquidationResult;
import com.lendingpool.model.LoanView;
import com.lendingpool.model.RepaymentResult;
import com.lendingpool.service.IdempotencyService;
import com.lendingpool.service.LiquidationEngine;
import com.lendingpool.service.LoanRegistry;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static com.lendingpool.controller.PoolController.CALLER_HEADER;
import static com.lendingpool.controller.PoolController.IDEMPOTENCY_HEADER;

/**
 * Loan origination, repayment and liquidation.
 */
@RestController
@RequestMapping("/api/loans")
@RequiredArgsConstructor
@Slf4j
public class LoanController {

    private final LoanRegistry loanRegistry;
    private final LiquidationEngine liquidationEngine;
    private final IdempotencyService idempotencyService;

    /**
     * Open a loan.
     *
     * POST /api/loans
     *
     * Example request:
     * {
     *   "collateralAsset": "WETH",
     *   "borrowAsset": "USDC",
     *   "collateralAmount": 1000,
     *   "borrowAmount": 800
     * }
     */
    @PostMapping
    public ResponseEntity<LoanView> createLoan(
            @RequestHeader(CALLER_HEADER) String caller,
            @RequestHeader(value = IDEMPOTENCY_HEADER, required = false) String idempotencyKey,
            @Valid @RequestBody LoanRequest request) {

        log.info("Loan request from {}: {} {} against {} {}", caller,
                request.getBorrowAmount(), request.getBorrowAsset(),
                request.getCollateralAmount(), request.getCollateralAsset());

        LoanView loan = idempotencyService.execute("borrow", caller, idempotencyKey,
                () -> loanRegistry.createLoan(caller, request.getCollateralAsset(), request.getBorrowAsset(),
                        request.getCollateralAmount(), request.getBorrowAmount()));
        return ResponseEntity.ok(loan);
    }

    /**
     * Dry run of POST /api/loans.
     *
     * GET /api/loans/eligibility?collateralAsset=WETH&borrowAsset=USDC&collateralAmount=1000&borrowAmount=800
     */
    @GetMapping("/eligibility")
    public ResponseEntity<BorrowEligibility> canBorrow(
            @RequestParam String collateralAsset,
            @RequestParam String borrowAsset,
            @RequestParam BigDecimal collateralAmount,
            @RequestParam BigDecimal borrowAmount) {
        return ResponseEntity.ok(loanRegistry.canBorrow(collateralAsset, borrowAsset, collateralAmount, borrowAmount));
    }

    /**
     * GET /api/loans/{loanId}
     */
    @GetMapping("/{loanId}")
    public ResponseEntity<LoanView> getLoan(@PathVariable Long loanId) {
        return ResponseEntity.ok(loanRegistry.getLoan(loanId));
    }

    /**
     * GET /api/loans?borrower=alice
     */
    @GetMapping
    public ResponseEntity<List<LoanView>> getUserLoans(@RequestParam String borrower) {
        return ResponseEntity.ok(loanRegistry.getUserLoans(borrower));
    }

    /**
     * GET /api/loans/next-id
     */
    @GetMapping("/next-id")
    public ResponseEntity<Map<String, Long>> nextLoanId() {
        return ResponseEntity.ok(Map.of("nextLoanId", loanRegistry.nextLoanId()));
    }

    /**
     * GET /api/loans/{loanId}/health
     */
    @GetMapping("/{loanId}/health")
    public ResponseEntity<HealthCheck> getHealth(@PathVariable Long loanId) {
        return ResponseEntity.ok(liquidationEngine.getLoanHealthFactor(loanId));
    }

    /**
     * POST /api/loans/{loanId}/repayments
     */
    @PostMapping("/{loanId}/repayments")
    public ResponseEntity<RepaymentResult> repay(
            @RequestHeader(CALLER_HEADER) String caller,
            @RequestHeader(value = IDEMPOTENCY_HEADER, required = false) String idempotencyKey,
            @PathVariable Long loanId,
            @Valid @RequestBody PoolController.AmountRequest request) {

        log.info("Repay request from {} on loan {}: {}", caller, loanId, request.getAmount());
        return ResponseEntity.ok(idempotencyService.execute("repay", caller, idempotencyKey,
                () -> loanRegistry.repayLoan(caller, loanId, request.getAmount())));
    }

    /**
     * POST /api/loans/{loanId}/liquidations
     */
    @PostMapping("/{loanId}/liquidations")
    public ResponseEntity<LiquidationResult> liquidate(
            @RequestHeader(CALLER_HEADER) String caller,
            @RequestHeader(value = IDEMPOTENCY_HEADER, required = false) String idempotencyKey,
            @PathVariable Long loanId,
            @Valid @RequestBody PoolController.AmountRequest request) {

        log.info("Liquidation request from {} on loan {}: {}", caller, loanId, request.getAmount());
        return ResponseEntity.ok(idempotencyService.execute("liquidate", caller, idempotencyKey,
                () -> liquidationEngine.liquidate(caller, loanId, request.getAmount())));
    }

    // ==================== DTOs ====================

    @Data
    public static class LoanRequest {
        @NotBlank(message = "Collateral asset is required")
        private String collateralAsset;

        @NotBlank(message = "Borrow asset is required")
        private String borrowAsset;

        @NotNull(message = "Collateral amount is required")
        @Positive(message = "Collateral amount must be positive")
        private BigDecimal collateralAmount;

        @NotNull(message = "Borrow amount is required")
        @Positive(message = "Borrow amount must be positive")
        private BigDecimal borrowAmount;
    }
}
