package com.flagship.fund_ledger.settlement;

import com.flagship.fund_ledger.identity.Caller;
import com.flagship.fund_ledger.identity.DirectoryService;
import com.flagship.fund_ledger.settlement.dto.BulkPaySalaryRequest;
import com.flagship.fund_ledger.settlement.dto.BulkSettlementSummaryResponse;
import com.flagship.fund_ledger.settlement.dto.PaySalaryRequest;
import com.flagship.fund_ledger.settlement.dto.PendingSalaryResponse;
import com.flagship.fund_ledger.settlement.dto.SettlementSummaryResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Salary settlement endpoints. They live under the ledger path because every
 * settlement ends up as ledger rows.
 */
@RestController
@RequestMapping("/api/ledger")
@RequiredArgsConstructor
@Slf4j
public class SettlementController {

    private final SalarySettlementService settlementService;
    private final DirectoryService directoryService;

    @GetMapping("/pending-salary/{workerId}")
    public ResponseEntity<PendingSalaryResponse> pendingSalary(
            @RequestHeader(Caller.USER_ID_HEADER) UUID userId,
            @PathVariable("workerId") UUID workerId,
            @RequestParam(value = "site_id", required = false) UUID siteId,
            @RequestParam(value = "start_date", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(value = "end_date", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {
        Caller caller = directoryService.resolveCaller(userId);
        SettlementOptions options = SettlementOptions.builder()
            .siteId(siteId)
            .startDate(startDate)
            .endDate(endDate)
            .build();
        return ResponseEntity.ok(PendingSalaryResponse.from(settlementService.pendingSalary(caller, workerId, options)));
    }

    @PostMapping("/pay-salary")
    public ResponseEntity<SettlementSummaryResponse> paySalary(
            @RequestHeader(Caller.USER_ID_HEADER) UUID userId,
            @Valid @RequestBody PaySalaryRequest request) {
        log.info("Received salary settlement request: worker={}, allocation={}",
            request.getWorkerId(), request.getFundAllocationId());

        Caller caller = directoryService.resolveCaller(userId);
        SettlementOptions options = SettlementOptions.builder()
            .siteId(request.getSiteId())
            .startDate(request.getStartDate())
            .endDate(request.getEndDate())
            .paymentMode(request.getPaymentMode())
            .referenceNumber(request.getReferenceNumber())
            .description(request.getDescription())
            .build();
        SettlementSummary summary = settlementService.paySalary(
            caller, request.getWorkerId(), request.getFundAllocationId(), options);
        return ResponseEntity.status(HttpStatus.CREATED).body(SettlementSummaryResponse.from(summary));
    }

    @PostMapping("/bulk-pay-salary")
    public ResponseEntity<BulkSettlementSummaryResponse> bulkPaySalary(
            @RequestHeader(Caller.USER_ID_HEADER) UUID userId,
            @Valid @RequestBody BulkPaySalaryRequest request) {
        log.info("Received bulk salary settlement request: workers={}, allocation={}",
            request.getWorkerIds().size(), request.getFundAllocationId());

        Caller caller = directoryService.resolveCaller(userId);
        SettlementOptions options = SettlementOptions.builder()
            .siteId(request.getSiteId())
            .startDate(request.getStartDate())
            .endDate(request.getEndDate())
            .paymentMode(request.getPaymentMode())
            .referenceNumber(request.getReferenceNumber())
            .description(request.getDescription())
            .build();
        BulkSettlementSummary summary = settlementService.bulkPaySalary(
            caller, request.getWorkerIds(), request.getFundAllocationId(), options);
        return ResponseEntity.status(HttpStatus.CREATED).body(BulkSettlementSummaryResponse.from(summary));
    }
}
