package com.ias.distributor.controller;

import com.ias.distributor.config.DistributorHeaders;
import com.ias.distributor.dto.*;
import com.ias.distributor.exception.DistributionException;
import com.ias.distributor.exception.ErrorCode;
import com.ias.distributor.service.*;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * REST API for reward distribution
 */
@RestController
@RequestMapping("/api/distributor")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Distributor", description = "Epoch reward settlement APIs")
public class DistributorController {

    private final LedgerStateService ledgerStateService;
    private final BatchDistributionService batchDistributionService;
    private final RewardClaimService rewardClaimService;
    private final DistributorAdminService adminService;
    private final SettlementAuditService auditService;

    // ==================== Queries ====================

    @GetMapping("/claimed")
    @Operation(summary = "Check claim status", description = "Whether an affiliate has been settled for an epoch")
    public ResponseEntity<?> hasClaimed(@RequestParam String affiliate, @RequestParam long epoch) {
        try {
            return ResponseEntity.ok(Map.of(
                    "affiliate", affiliate.toLowerCase(),
                    "epoch", epoch,
                    "claimed", ledgerStateService.hasClaimed(affiliate, epoch)));
        } catch (DistributionException e) {
            return failure(e);
        }
    }

    @GetMapping("/totals/{affiliate}")
    @Operation(summary = "Affiliate total", description = "Cumulative amount settled to an affiliate")
    public ResponseEntity<?> affiliateTotal(@PathVariable String affiliate) {
        try {
            return ResponseEntity.ok(Map.of(
                    "affiliate", affiliate.toLowerCase(),
                    "totalDistributed", ledgerStateService.affiliateTotal(affiliate).toString()));
        } catch (DistributionException e) {
            return failure(e);
        }
    }

    @GetMapping("/totals/global")
    @Operation(summary = "Global total", description = "Cumulative amount settled across all affiliates")
    public ResponseEntity<Map<String, Object>> globalTotal() {
        return ResponseEntity.ok(Map.of("globalTotalDistributed", ledgerStateService.globalTotal().toString()));
    }

    @GetMapping("/info")
    @Operation(summary = "Ledger info", description = "Ledger identity, authority, asset reference and balances")
    public ResponseEntity<?> info() {
        try {
            return ResponseEntity.ok(ledgerStateService.ledgerInfo());
        } catch (DistributionException e) {
            return failure(e);
        }
    }

    @GetMapping("/wallet/{address}/balance")
    @Operation(summary = "Wallet balance", description = "Asset balance of any account on the active asset gateway")
    public ResponseEntity<?> walletBalance(@PathVariable String address) {
        try {
            return ResponseEntity.ok(Map.of(
                    "success", true,
                    "address", address.toLowerCase(),
                    "balance", ledgerStateService.walletBalance(address).toString()));
        } catch (DistributionException e) {
            return failure(e);
        }
    }

    @GetMapping("/settlements")
    @Operation(summary = "Settlement history", description = "Settled epochs for an affiliate, newest first")
    public ResponseEntity<?> settlements(@RequestParam String affiliate) {
        try {
            return ResponseEntity.ok(ledgerStateService.settlements(affiliate));
        } catch (DistributionException e) {
            return failure(e);
        }
    }

    @GetMapping("/events")
    @Operation(summary = "Audit trail", description = "Recent settlement events, optionally for one affiliate")
    public ResponseEntity<?> events(@RequestParam(required = false) String affiliate) {
        return ResponseEntity.ok(affiliate == null
                ? auditService.recentEvents()
                : auditService.eventsFor(affiliate));
    }

    // ==================== Settlement ====================

    @PostMapping("/batch")
    @Operation(summary = "Batch distribute", description = "Authority-only push of rewards for one epoch, all or nothing")
    public ResponseEntity<?> batchDistribute(
            @RequestHeader(DistributorHeaders.CALLER_ADDRESS) String caller,
            @Valid @RequestBody BatchDistributionRequest request) {
        try {
            SettlementResult result = batchDistributionService.batchDistribute(
                    caller, request.getAffiliates(), request.getAmounts(), request.getEpoch());
            return ResponseEntity.ok(result);
        } catch (DistributionException e) {
            return failure(e);
        }
    }

    @PostMapping("/claim")
    @Operation(summary = "Claim reward", description = "Claim a signed reward for the calling affiliate")
    public ResponseEntity<?> claim(
            @RequestHeader(DistributorHeaders.CALLER_ADDRESS) String caller,
            @Valid @RequestBody ClaimRewardRequest request) {
        try {
            SettlementResult result = rewardClaimService.claim(
                    caller, request.getAmount(), request.getEpoch(), request.getSignature());
            return ResponseEntity.ok(result);
        } catch (DistributionException e) {
            return failure(e);
        }
    }

    // ==================== Administration ====================

    @PostMapping("/admin/asset-reference")
    @Operation(summary = "Update asset reference", description = "Switch the active asset gateway")
    public ResponseEntity<?> updateAssetReference(
            @RequestHeader(DistributorHeaders.CALLER_ADDRESS) String caller,
            @Valid @RequestBody UpdateAssetReferenceRequest request) {
        try {
            adminService.updateAssetReference(caller, request.getHandle());
            return ResponseEntity.ok(Map.of("success", true, "assetReference", request.getHandle()));
        } catch (DistributionException e) {
            return failure(e);
        }
    }

    @PostMapping("/admin/deposit")
    @Operation(summary = "Fund ledger", description = "Credit the ledger's custody through the active asset gateway")
    public ResponseEntity<?> deposit(
            @RequestHeader(DistributorHeaders.CALLER_ADDRESS) String caller,
            @Valid @RequestBody DepositRequest request) {
        try {
            String reference = adminService.depositToLedger(caller, request.getAmount());
            return ResponseEntity.ok(Map.of("success", true, "transferReference", reference));
        } catch (DistributionException e) {
            return failure(e);
        }
    }

    @PostMapping("/admin/emergency-withdraw")
    @Operation(summary = "Emergency withdraw", description = "Transfer custodied funds to the authority, bypassing bookkeeping")
    public ResponseEntity<?> emergencyWithdraw(
            @RequestHeader(DistributorHeaders.CALLER_ADDRESS) String caller,
            @Valid @RequestBody EmergencyWithdrawRequest request) {
        try {
            String reference = adminService.emergencyWithdraw(caller, request.getAmount());
            return ResponseEntity.ok(Map.of("success", true, "transferReference", reference));
        } catch (DistributionException e) {
            return failure(e);
        }
    }

    @PostMapping("/admin/authority")
    @Operation(summary = "Transfer authority", description = "Rotate the authority identity")
    public ResponseEntity<?> transferAuthority(
            @RequestHeader(DistributorHeaders.CALLER_ADDRESS) String caller,
            @Valid @RequestBody TransferAuthorityRequest request) {
        try {
            adminService.transferAuthority(caller, request.getNewAuthority());
            return ResponseEntity.ok(Map.of("success", true, "authority", request.getNewAuthority().toLowerCase()));
        } catch (DistributionException e) {
            return failure(e);
        }
    }

    // ==================== Storage failures ====================

    /**
     * The (affiliate, epoch) unique key rejected a second settlement
     */
    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<Map<String, Object>> duplicateSettlement(DataIntegrityViolationException e) {
        log.warn("Settlement rejected by unique constraint: {}", e.getMostSpecificCause().getMessage());
        return failure(new DistributionException(ErrorCode.ALREADY_CLAIMED,
                "Reward already claimed for this affiliate and epoch", e));
    }

    @ExceptionHandler(ConcurrencyFailureException.class)
    public ResponseEntity<Map<String, Object>> ledgerBusy(ConcurrencyFailureException e) {
        log.warn("Ledger lock not acquired: {}", e.getMessage());
        return failure(new DistributionException(ErrorCode.LEDGER_BUSY,
                "Ledger is busy, retry the request", e));
    }

    private static ResponseEntity<Map<String, Object>> failure(DistributionException e) {
        HttpStatus status = switch (e.getCategory()) {
            case AUTHORIZATION -> HttpStatus.FORBIDDEN;
            case STATE -> HttpStatus.CONFLICT;
            case RESOURCE -> HttpStatus.UNPROCESSABLE_ENTITY;
            case VALIDATION -> HttpStatus.BAD_REQUEST;
        };
        return ResponseEntity.status(status).body(Map.of(
                "success", false,
                "code", e.getCode().name(),
                "category", e.getCategory().name(),
                "error", e.getMessage()));
    }
}
