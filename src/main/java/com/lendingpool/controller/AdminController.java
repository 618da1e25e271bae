package com.lendingpool.controller;

import com.lendingpool.model.InterestRateCurve;
import com.lendingpool.model.PoolView;
import com.lendingpool.model.ProtocolState;
import com.lendingpool.oracle.PriceData;
import com.lendingpool.service.InterestRateCurveService;
import com.lendingpool.service.PoolAdminService;
import com.lendingpool.service.ProtocolStateService;
import com.lendingpool.util.AssetIds;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;

import static com.lendingpool.controller.PoolController.CALLER_HEADER;

/**
 * Operator endpoints. Authorization is decided per call by the AccessGate inside
 * {@link PoolAdminService}; the caller id comes from the X-Caller-Id header.
 */
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
@Slf4j
public class AdminController {

    private final PoolAdminService adminService;
    private final InterestRateCurveService curveService;
    private final ProtocolStateService protocolState;

    /**
     * POST /api/admin/assets
     *
     * Example request:
     * {
     *   "asset": "WETH",
     *   "collateralFactorBps": 8000,
     *   "liquidationBonusBps": 500
     * }
     */
    @PostMapping("/assets")
    public ResponseEntity<PoolView> listAsset(
            @RequestHeader(CALLER_HEADER) String caller,
            @Valid @RequestBody ListAssetRequest request) {
        return ResponseEntity.ok(adminService.listAsset(caller, request.getAsset(),
                request.getCollateralFactorBps(), request.getLiquidationBonusBps()));
    }

    /**
     * DELETE /api/admin/assets/{asset}
     */
    @DeleteMapping("/assets/{asset}")
    public ResponseEntity<PoolView> removeAsset(
            @RequestHeader(CALLER_HEADER) String caller,
            @PathVariable String asset) {
        return ResponseEntity.ok(adminService.removeAsset(caller, asset));
    }

    /**
     * PUT /api/admin/assets/{asset}/risk
     */
    @PutMapping("/assets/{asset}/risk")
    public ResponseEntity<PoolView> setRiskParameters(
            @RequestHeader(CALLER_HEADER) String caller,
            @PathVariable String asset,
            @Valid @RequestBody RiskRequest request) {
        return ResponseEntity.ok(adminService.setRiskParameters(caller, asset,
                request.getCollateralFactorBps(), request.getLiquidationBonusBps()));
    }

    @PostMapping("/assets/{asset}/pause")
    public ResponseEntity<PoolView> pausePool(
            @RequestHeader(CALLER_HEADER) String caller,
            @PathVariable String asset) {
        return ResponseEntity.ok(adminService.pausePool(caller, asset));
    }

    @PostMapping("/assets/{asset}/unpause")
    public ResponseEntity<PoolView> unpausePool(
            @RequestHeader(CALLER_HEADER) String caller,
            @PathVariable String asset) {
        return ResponseEntity.ok(adminService.unpausePool(caller, asset));
    }

    /**
     * POST /api/admin/assets/{asset}/reserves/withdrawals
     */
    @PostMapping("/assets/{asset}/reserves/withdrawals")
    public ResponseEntity<PoolView> withdrawReserves(
            @RequestHeader(CALLER_HEADER) String caller,
            @PathVariable String asset,
            @Valid @RequestBody ReserveWithdrawalRequest request) {
        return ResponseEntity.ok(adminService.withdrawReserves(caller, asset,
                request.getAmount(), request.getRecipient()));
    }

    // ========================================
    // INTEREST CURVES
    // ========================================

    @GetMapping("/interest-curves/default")
    public ResponseEntity<InterestRateCurve> getDefaultCurve() {
        return ResponseEntity.ok(curveService.defaultCurve());
    }

    @GetMapping("/interest-curves/{asset}")
    public ResponseEntity<InterestRateCurve> getCurve(@PathVariable String asset) {
        return ResponseEntity.ok(curveService.curveFor(AssetIds.normalize(asset)));
    }

    @PutMapping("/interest-curves/default")
    public ResponseEntity<InterestRateCurve> setDefaultCurve(
            @RequestHeader(CALLER_HEADER) String caller,
            @Valid @RequestBody CurveRequest request) {
        return ResponseEntity.ok(setCurve(caller, null, request));
    }

    @PutMapping("/interest-curves/{asset}")
    public ResponseEntity<InterestRateCurve> setAssetCurve(
            @RequestHeader(CALLER_HEADER) String caller,
            @PathVariable String asset,
            @Valid @RequestBody CurveRequest request) {
        return ResponseEntity.ok(setCurve(caller, asset, request));
    }

    private InterestRateCurve setCurve(String caller, String asset, CurveRequest request) {
        return adminService.setInterestCurve(caller, asset,
                request.getBaseRateBps(), request.getSlope1Bps(), request.getSlope2Bps(),
                request.getOptimalUtilizationBps(), request.getReserveFactorBps());
    }

    // ========================================
    // PROTOCOL
    // ========================================

    @GetMapping("/protocol")
    public ResponseEntity<ProtocolState> getProtocolState() {
        return ResponseEntity.ok(protocolState.current());
    }

    @PostMapping("/protocol/pause")
    public ResponseEntity<ProtocolState> pauseProtocol(@RequestHeader(CALLER_HEADER) String caller) {
        return ResponseEntity.ok(adminService.pauseProtocol(caller));
    }

    @PostMapping("/protocol/unpause")
    public ResponseEntity<ProtocolState> unpauseProtocol(@RequestHeader(CALLER_HEADER) String caller) {
        return ResponseEntity.ok(adminService.unpauseProtocol(caller));
    }

    @PutMapping("/protocol/fee-recipient")
    public ResponseEntity<ProtocolState> setFeeRecipient(
            @RequestHeader(CALLER_HEADER) String caller,
            @Valid @RequestBody FeeRecipientRequest request) {
        return ResponseEntity.ok(adminService.setFeeRecipient(caller, request.getFeeRecipient()));
    }

    /**
     * Operator-fed prices (static feed only).
     *
     * PUT /api/admin/prices/{asset}
     */
    @PutMapping("/prices/{asset}")
    public ResponseEntity<PriceData> postPrice(
            @RequestHeader(CALLER_HEADER) String caller,
            @PathVariable String asset,
            @Valid @RequestBody PriceRequest request) {
        log.info("Price update from {} for {}: {}", caller, asset, request.getPrice());
        return ResponseEntity.ok(adminService.postPrice(caller, asset, request.getPrice(), request.getConfidenceBps()));
    }

    // ==================== DTOs ====================

    @Data
    public static class ListAssetRequest {
        @NotBlank(message = "Asset is required")
        private String asset;

        @NotNull(message = "Collateral factor is required")
        private Integer collateralFactorBps;

        @NotNull(message = "Liquidation bonus is required")
        private Integer liquidationBonusBps;
    }

    @Data
    public static class RiskRequest {
        @NotNull(message = "Collateral factor is required")
        private Integer collateralFactorBps;

        @NotNull(message = "Liquidation bonus is required")
        private Integer liquidationBonusBps;
    }

    @Data
    public static class CurveRequest {
        @NotNull @Min(0)
        private Integer baseRateBps;

        @NotNull @Min(0)
        private Integer slope1Bps;

        @NotNull @Min(0)
        private Integer slope2Bps;

        @NotNull @Min(1) @Max(9999)
        private Integer optimalUtilizationBps;

        @NotNull @Min(0) @Max(10000)
        private Integer reserveFactorBps;
    }

    @Data
    public static class ReserveWithdrawalRequest {
        @NotNull(message = "Amount is required")
        @Positive(message = "Amount must be positive")
        private BigDecimal amount;

        // defaults to the protocol fee recipient
        private String recipient;
    }

    @Data
    public static class FeeRecipientRequest {
        @NotBlank(message = "Fee recipient is required")
        private String feeRecipient;
    }

    @Data
    public static class PriceRequest {
        @NotNull(message = "Price is required")
        @Positive(message = "Price must be positive")
        private BigDecimal price;

        @Min(0) @Max(10000)
        private int confidenceBps = 10000;
    }
}
