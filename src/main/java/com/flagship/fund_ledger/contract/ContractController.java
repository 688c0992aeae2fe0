package com.flagship.fund_ledger.contract;

import com.flagship.fund_ledger.contract.dto.ContractPaymentRequest;
import com.flagship.fund_ledger.contract.dto.ContractPaymentResponse;
import com.flagship.fund_ledger.contract.dto.ContractResponse;
import com.flagship.fund_ledger.contract.dto.CreateContractRequest;
import com.flagship.fund_ledger.identity.Caller;
import com.flagship.fund_ledger.identity.DirectoryService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/contracts")
@RequiredArgsConstructor
public class ContractController {

    private final ContractService contractService;
    private final DirectoryService directoryService;

    @PostMapping
    public ResponseEntity<ContractResponse> createContract(
            @RequestHeader(Caller.USER_ID_HEADER) UUID userId,
            @Valid @RequestBody CreateContractRequest request) {
        Caller caller = directoryService.resolveCaller(userId);
        Contract contract = contractService.createContract(caller, CreateContractCommand.builder()
            .workerId(request.getWorkerId())
            .siteId(request.getSiteId())
            .fundAllocationId(request.getFundAllocationId())
            .contractType(request.getContractType())
            .title(request.getTitle())
            .description(request.getDescription())
            .totalAmount(request.getTotalAmount())
            .numberOfInstallments(request.getNumberOfInstallments())
            .dailyRate(request.getDailyRate())
            .startDate(request.getStartDate())
            .endDate(request.getEndDate())
            .build());
        return ResponseEntity.status(HttpStatus.CREATED).body(ContractResponse.from(contract));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ContractResponse> getContract(
            @RequestHeader(Caller.USER_ID_HEADER) UUID userId,
            @PathVariable("id") UUID id) {
        Caller caller = directoryService.resolveCaller(userId);
        return ResponseEntity.ok(ContractResponse.from(contractService.getContract(caller, id)));
    }

    @PutMapping("/{id}/activate")
    public ResponseEntity<ContractResponse> activateContract(
            @RequestHeader(Caller.USER_ID_HEADER) UUID userId,
            @PathVariable("id") UUID id) {
        Caller caller = directoryService.resolveCaller(userId);
        return ResponseEntity.ok(ContractResponse.from(contractService.activateContract(caller, id)));
    }

    @PostMapping("/{id}/payment")
    public ResponseEntity<ContractPaymentResponse> recordPayment(
            @RequestHeader(Caller.USER_ID_HEADER) UUID userId,
            @PathVariable("id") UUID id,
            @Valid @RequestBody ContractPaymentRequest request) {
        Caller caller = directoryService.resolveCaller(userId);
        ContractPayment payment = contractService.recordContractPayment(caller, id, ContractPaymentCommand.builder()
            .installmentNumber(request.getInstallmentNumber())
            .amount(request.getAmount())
            .fundAllocationId(request.getFundAllocationId())
            .paymentMode(request.getPaymentMode())
            .referenceNumber(request.getReferenceNumber())
            .notes(request.getNotes())
            .build());
        return ResponseEntity.status(HttpStatus.CREATED).body(ContractPaymentResponse.from(payment));
    }
}
