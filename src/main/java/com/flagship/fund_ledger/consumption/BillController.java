package com.flagship.fund_ledger.consumption;

import com.flagship.fund_ledger.consumption.dto.BillResponse;
import com.flagship.fund_ledger.consumption.dto.CreateBillRequest;
import com.flagship.fund_ledger.consumption.dto.UpdateBillStatusRequest;
import com.flagship.fund_ledger.identity.Caller;
import com.flagship.fund_ledger.identity.DirectoryService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/bills")
@RequiredArgsConstructor
public class BillController {

    private final BillService billService;
    private final DirectoryService directoryService;

    @PostMapping
    public ResponseEntity<BillResponse> createBill(
            @RequestHeader(Caller.USER_ID_HEADER) UUID userId,
            @Valid @RequestBody CreateBillRequest request) {
        Caller caller = directoryService.resolveCaller(userId);
        Bill bill = billService.createBill(caller, CreateBillCommand.builder()
            .siteId(request.getSiteId())
            .fundAllocationId(request.getFundAllocationId())
            .vendorName(request.getVendorName())
            .vendorGstNumber(request.getVendorGstNumber())
            .invoiceNumber(request.getInvoiceNumber())
            .billDate(request.getBillDate())
            .baseAmount(request.getBaseAmount())
            .gstAmount(request.getGstAmount())
            .gstRate(request.getGstRate())
            .billType(request.getBillType())
            .description(request.getDescription())
            .build());
        return ResponseEntity.status(HttpStatus.CREATED).body(BillResponse.from(bill));
    }

    @PutMapping("/{id}/status")
    public ResponseEntity<BillResponse> setBillStatus(
            @RequestHeader(Caller.USER_ID_HEADER) UUID userId,
            @PathVariable("id") UUID id,
            @Valid @RequestBody UpdateBillStatusRequest request) {
        Caller caller = directoryService.resolveCaller(userId);
        return ResponseEntity.ok(BillResponse.from(billService.setBillStatus(caller, id, request.getStatus())));
    }
}
