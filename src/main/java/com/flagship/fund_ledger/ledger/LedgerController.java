package com.flagship.fund_ledger.ledger;

import com.flagship.fund_ledger.common.dto.PagedResponse;
import com.flagship.fund_ledger.identity.Caller;
import com.flagship.fund_ledger.identity.DirectoryService;
import com.flagship.fund_ledger.ledger.dto.CreateLedgerEntryRequest;
import com.flagship.fund_ledger.ledger.dto.LedgerEntryResponse;
import com.flagship.fund_ledger.ledger.dto.UpdateLedgerEntryRequest;
import com.flagship.fund_ledger.ledger.dto.WorkerBalanceResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
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

import java.time.LocalDate;
import java.util.UUID;

@RestController
@RequestMapping("/api/ledger")
@RequiredArgsConstructor
public class LedgerController {

    private final WorkerLedgerService ledgerService;
    private final DirectoryService directoryService;

    @PostMapping
    public ResponseEntity<LedgerEntryResponse> createEntry(
            @RequestHeader(Caller.USER_ID_HEADER) UUID userId,
            @Valid @RequestBody CreateLedgerEntryRequest request) {
        Caller caller = directoryService.resolveCaller(userId);
        LedgerEntry entry = ledgerService.createEntry(caller, CreateLedgerEntryCommand.builder()
            .workerId(request.getWorkerId())
            .siteId(request.getSiteId())
            .fundAllocationId(request.getFundAllocationId())
            .contractId(request.getContractId())
            .linkedAdvanceId(request.getLinkedAdvanceId())
            .type(request.getType())
            .amount(request.getAmount())
            .category(request.getCategory())
            .status(request.getStatus())
            .description(request.getDescription())
            .transactionDate(request.getTransactionDate())
            .referenceNumber(request.getReferenceNumber())
            .paymentMode(request.getPaymentMode())
            .build());
        return ResponseEntity.status(HttpStatus.CREATED).body(LedgerEntryResponse.from(entry));
    }

    @GetMapping
    public ResponseEntity<PagedResponse<LedgerEntryResponse>> listEntries(
            @RequestHeader(Caller.USER_ID_HEADER) UUID userId,
            @RequestParam(value = "worker_id", required = false) UUID workerId,
            @RequestParam(value = "site_id", required = false) UUID siteId,
            @RequestParam(value = "type", required = false) EntryType type,
            @RequestParam(value = "category", required = false) LedgerCategory category,
            @RequestParam(value = "status", required = false) LedgerStatus status,
            @RequestParam(value = "start_date", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(value = "end_date", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
            @RequestParam(value = "page", defaultValue = "1") int page,
            @RequestParam(value = "limit", defaultValue = "50") int limit) {
        Caller caller = directoryService.resolveCaller(userId);
        LedgerEntryFilter filter = LedgerEntryFilter.builder()
            .workerId(workerId)
            .siteId(siteId)
            .type(type)
            .category(category)
            .status(status)
            .startDate(startDate)
            .endDate(endDate)
            .build();
        return ResponseEntity.ok(ledgerService.listEntries(caller, filter, page, limit).map(LedgerEntryResponse::from));
    }

    @GetMapping("/balance/{workerId}")
    public ResponseEntity<WorkerBalanceResponse> workerBalance(
            @RequestHeader(Caller.USER_ID_HEADER) UUID userId,
            @PathVariable("workerId") UUID workerId) {
        Caller caller = directoryService.resolveCaller(userId);
        return ResponseEntity.ok(WorkerBalanceResponse.from(ledgerService.workerBalance(caller, workerId)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<LedgerEntryResponse> getEntry(
            @RequestHeader(Caller.USER_ID_HEADER) UUID userId,
            @PathVariable("id") UUID id) {
        Caller caller = directoryService.resolveCaller(userId);
        return ResponseEntity.ok(LedgerEntryResponse.from(ledgerService.getEntry(caller, id)));
    }

    @PutMapping("/{id}")
    public ResponseEntity<LedgerEntryResponse> updateEntry(
            @RequestHeader(Caller.USER_ID_HEADER) UUID userId,
            @PathVariable("id") UUID id,
            @Valid @RequestBody UpdateLedgerEntryRequest request) {
        Caller caller = directoryService.resolveCaller(userId);
        LedgerEntry updated = ledgerService.updateEntry(caller, id, request.getAmount(), request.getDescription(),
            request.getTransactionDate(), request.getReferenceNumber(), request.getPaymentMode());
        return ResponseEntity.ok(LedgerEntryResponse.from(updated));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteEntry(
            @RequestHeader(Caller.USER_ID_HEADER) UUID userId,
            @PathVariable("id") UUID id) {
        ledgerService.deleteEntry(directoryService.resolveCaller(userId), id);
        return ResponseEntity.noContent().build();
    }
}
