package com.flagship.fund_ledger.allocation;

import com.flagship.fund_ledger.allocation.dto.CreateAllocationRequest;
import com.flagship.fund_ledger.allocation.dto.FundAllocationResponse;
import com.flagship.fund_ledger.allocation.dto.UpdateAllocationRequest;
import com.flagship.fund_ledger.allocation.dto.UpdateAllocationStatusRequest;
import com.flagship.fund_ledger.common.dto.PagedResponse;
import com.flagship.fund_ledger.identity.Caller;
import com.flagship.fund_ledger.identity.DirectoryService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * REST endpoints for fund allocations. The caller is taken from the
 * {@code X-User-Id} header; authentication happens upstream.
 */
@RestController
@RequestMapping("/api/fund-allocations")
@RequiredArgsConstructor
@Slf4j
public class FundAllocationController {

    private final FundAllocationService allocationService;
    private final DirectoryService directoryService;

    @PostMapping
    public ResponseEntity<FundAllocationResponse> createAllocation(
            @RequestHeader(Caller.USER_ID_HEADER) UUID userId,
            @Valid @RequestBody CreateAllocationRequest request) {
        Caller caller = directoryService.resolveCaller(userId);
        log.info("Received fund allocation request: to={}, amount={}", request.getToUserId(), request.getAmount());

        FundAllocation allocation = allocationService.createAllocation(caller, CreateAllocationCommand.builder()
            .toUserId(request.getToUserId())
            .amount(request.getAmount())
            .purpose(request.getPurpose())
            .siteId(request.getSiteId())
            .description(request.getDescription())
            .referenceNumber(request.getReferenceNumber())
            .sourceAllocationId(request.getSourceAllocationId())
            .build());

        return ResponseEntity.status(HttpStatus.CREATED).body(FundAllocationResponse.from(allocation));
    }

    @GetMapping
    public ResponseEntity<PagedResponse<FundAllocationResponse>> listAllocations(
            @RequestHeader(Caller.USER_ID_HEADER) UUID userId,
            @RequestParam(value = "status", required = false) AllocationStatus status,
            @RequestParam(value = "site_id", required = false) UUID siteId,
            @RequestParam(value = "from_user_id", required = false) UUID fromUserId,
            @RequestParam(value = "to_user_id", required = false) UUID toUserId,
            @RequestParam(value = "page", defaultValue = "1") int page,
            @RequestParam(value = "limit", defaultValue = "50") int limit) {
        Caller caller = directoryService.resolveCaller(userId);
        PagedResponse<FundAllocation> result =
            allocationService.listAllocations(caller, status, siteId, fromUserId, toUserId, page, limit);
        return ResponseEntity.ok(result.map(FundAllocationResponse::from));
    }

    @GetMapping("/my-summary")
    public ResponseEntity<FundSummary> getFundSummary(@RequestHeader(Caller.USER_ID_HEADER) UUID userId) {
        return ResponseEntity.ok(allocationService.getFundSummary(directoryService.resolveCaller(userId)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<FundAllocationResponse> getAllocation(
            @RequestHeader(Caller.USER_ID_HEADER) UUID userId,
            @PathVariable("id") UUID id) {
        Caller caller = directoryService.resolveCaller(userId);
        return ResponseEntity.ok(FundAllocationResponse.from(allocationService.getAllocation(caller, id)));
    }

    @PutMapping("/{id}")
    public ResponseEntity<FundAllocationResponse> updateAllocation(
            @RequestHeader(Caller.USER_ID_HEADER) UUID userId,
            @PathVariable("id") UUID id,
            @Valid @RequestBody UpdateAllocationRequest request) {
        Caller caller = directoryService.resolveCaller(userId);
        FundAllocation updated = allocationService.updateAllocation(
            caller, id, request.getAmount(), request.getPurpose(), request.getDescription());
        return ResponseEntity.ok(FundAllocationResponse.from(updated));
    }

    @PutMapping("/{id}/status")
    public ResponseEntity<FundAllocationResponse> setAllocationStatus(
            @RequestHeader(Caller.USER_ID_HEADER) UUID userId,
            @PathVariable("id") UUID id,
            @Valid @RequestBody UpdateAllocationStatusRequest request) {
        Caller caller = directoryService.resolveCaller(userId);
        FundAllocation updated = allocationService.setAllocationStatus(caller, id, request.getStatus());
        return ResponseEntity.ok(FundAllocationResponse.from(updated));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteAllocation(
            @RequestHeader(Caller.USER_ID_HEADER) UUID userId,
            @PathVariable("id") UUID id) {
        allocationService.deleteAllocation(directoryService.resolveCaller(userId), id);
        return ResponseEntity.noContent().build();
    }
}
