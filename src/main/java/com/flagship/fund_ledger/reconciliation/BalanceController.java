package com.flagship.fund_ledger.reconciliation;

import com.flagship.fund_ledger.allocation.FundAllocationService;
import com.flagship.fund_ledger.common.exception.ForbiddenException;
import com.flagship.fund_ledger.identity.Caller;
import com.flagship.fund_ledger.identity.DirectoryService;
import com.flagship.fund_ledger.reconciliation.dto.AllocationBalanceResponse;
import com.flagship.fund_ledger.reconciliation.dto.FundAvailabilityResponse;
import com.flagship.fund_ledger.reconciliation.dto.WalletBalanceResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Read-only balance endpoints: wallets and allocation balances.
 */
@RestController
@RequiredArgsConstructor
public class BalanceController {

    private final ReconciliationService reconciliationService;
    private final FundAllocationService allocationService;
    private final DirectoryService directoryService;

    @GetMapping("/api/wallet")
    public ResponseEntity<WalletBalanceResponse> myWallet(@RequestHeader(Caller.USER_ID_HEADER) UUID userId) {
        Caller caller = directoryService.resolveCaller(userId);
        WalletBalance wallet = reconciliationService.walletBalance(caller.getUserId(), caller.getOrganizationId());
        return ResponseEntity.ok(WalletBalanceResponse.from(wallet));
    }

    @GetMapping("/api/wallet/{userId}")
    public ResponseEntity<WalletBalanceResponse> userWallet(
            @RequestHeader(Caller.USER_ID_HEADER) UUID callerId,
            @PathVariable("userId") UUID userId) {
        Caller caller = directoryService.resolveCaller(callerId);
        directoryService.requireUserInOrganization(userId, caller.getOrganizationId(), "User");
        if (!caller.hasAuthorityOver(userId)) {
            throw new ForbiddenException("Can only view wallets of yourself or your team members");
        }
        WalletBalance wallet = reconciliationService.walletBalance(userId, caller.getOrganizationId());
        return ResponseEntity.ok(WalletBalanceResponse.from(wallet));
    }

    @GetMapping("/api/fund-allocations/{id}/balance")
    public ResponseEntity<AllocationBalanceResponse> allocationBalance(
            @RequestHeader(Caller.USER_ID_HEADER) UUID userId,
            @PathVariable("id") UUID id) {
        allocationService.getAllocation(directoryService.resolveCaller(userId), id);
        return ResponseEntity.ok(AllocationBalanceResponse.from(reconciliationService.allocationBalance(id)));
    }

    @GetMapping("/api/fund-allocations/{id}/availability")
    public ResponseEntity<FundAvailabilityResponse> availability(
            @RequestHeader(Caller.USER_ID_HEADER) UUID userId,
            @PathVariable("id") UUID id,
            @RequestParam("amount") BigDecimal amount) {
        allocationService.getAllocation(directoryService.resolveCaller(userId), id);
        return ResponseEntity.ok(FundAvailabilityResponse.from(reconciliationService.validateAvailability(id, amount)));
    }
}
