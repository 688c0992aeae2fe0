package com.flagship.fund_ledger.consumption;

import com.flagship.fund_ledger.consumption.dto.CreateExpenseRequest;
import com.flagship.fund_ledger.consumption.dto.ExpenseResponse;
import com.flagship.fund_ledger.consumption.dto.UpdateExpenseStatusRequest;
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
@RequestMapping("/api/expenses")
@RequiredArgsConstructor
public class ExpenseController {

    private final ExpenseService expenseService;
    private final DirectoryService directoryService;

    @PostMapping
    public ResponseEntity<ExpenseResponse> createExpense(
            @RequestHeader(Caller.USER_ID_HEADER) UUID userId,
            @Valid @RequestBody CreateExpenseRequest request) {
        Caller caller = directoryService.resolveCaller(userId);
        Expense expense = expenseService.createExpense(caller, CreateExpenseCommand.builder()
            .siteId(request.getSiteId())
            .fundAllocationId(request.getFundAllocationId())
            .amount(request.getAmount())
            .description(request.getDescription())
            .vendorName(request.getVendorName())
            .expenseDate(request.getExpenseDate())
            .build());
        return ResponseEntity.status(HttpStatus.CREATED).body(ExpenseResponse.from(expense));
    }

    @PutMapping("/{id}/status")
    public ResponseEntity<ExpenseResponse> setExpenseStatus(
            @RequestHeader(Caller.USER_ID_HEADER) UUID userId,
            @PathVariable("id") UUID id,
            @Valid @RequestBody UpdateExpenseStatusRequest request) {
        Caller caller = directoryService.resolveCaller(userId);
        return ResponseEntity.ok(ExpenseResponse.from(expenseService.setExpenseStatus(caller, id, request.getStatus())));
    }
}
