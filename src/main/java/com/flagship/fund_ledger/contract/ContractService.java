package com.flagship.fund_ledger.contract;

import com.flagship.fund_ledger.allocation.FundAllocationRepository;
import com.flagship.fund_ledger.common.Amounts;
import com.flagship.fund_ledger.common.exception.ForbiddenException;
import com.flagship.fund_ledger.common.exception.NotFoundException;
import com.flagship.fund_ledger.identity.Caller;
import com.flagship.fund_ledger.identity.DirectoryService;
import com.flagship.fund_ledger.identity.Role;
import com.flagship.fund_ledger.identity.UserRecord;
import com.flagship.fund_ledger.ledger.CreateLedgerEntryCommand;
import com.flagship.fund_ledger.ledger.EntryType;
import com.flagship.fund_ledger.ledger.LedgerCategory;
import com.flagship.fund_ledger.ledger.LedgerEntry;
import com.flagship.fund_ledger.ledger.LedgerStatus;
import com.flagship.fund_ledger.ledger.WorkerLedgerService;
import com.flagship.fund_ledger.observability.SettlementMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Worker contracts and their installment payments.
 *
 * A payment is an ordinary cash-moving ledger credit tagged with the
 * contract, so it is gated and reconciled exactly like any other spend.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContractService {

    private final ContractRepository repository;
    private final FundAllocationRepository allocationRepository;
    private final DirectoryService directoryService;
    private final WorkerLedgerService ledgerService;
    private final SettlementMetrics metrics;

    @Transactional
    public Contract createContract(Caller caller, CreateContractCommand command) {
        requireManager(caller);
        if (command.getTitle() == null || command.getTitle().isBlank()) {
            throw new IllegalArgumentException("title is required");
        }
        BigDecimal total = Amounts.requirePositive(command.getTotalAmount(), "totalAmount");

        UserRecord worker = ledgerService.requireManageableWorker(caller, command.getWorkerId());
        if (command.getSiteId() == null) {
            throw new IllegalArgumentException("siteId is required");
        }
        directoryService.requireSite(command.getSiteId(), caller.getOrganizationId());
        if (command.getFundAllocationId() != null) {
            allocationRepository.findById(command.getFundAllocationId())
                .filter(allocation -> caller.getOrganizationId().equals(allocation.getOrganizationId()))
                .orElseThrow(() -> new NotFoundException("FundAllocation", command.getFundAllocationId()));
        }

        Contract contract = Contract.create(
            caller.getOrganizationId(),
            worker.getId(),
            command.getSiteId(),
            caller.getUserId(),
            command.getFundAllocationId(),
            command.getContractType(),
            command.getTitle(),
            command.getDescription(),
            total,
            command.getNumberOfInstallments() != null ? command.getNumberOfInstallments() : 1,
            command.getDailyRate(),
            command.getStartDate() != null ? command.getStartDate() : LocalDate.now(),
            command.getEndDate()
        );
        Contract saved = repository.save(ContractEntity.fromDomain(contract)).toDomain();

        log.info("Contract created: id={}, worker={}, total={}, installments={}",
            saved.getId(), saved.getWorkerId(), saved.getTotalAmount(), saved.getNumberOfInstallments());
        return saved;
    }

    @Transactional(readOnly = true)
    public Contract getContract(Caller caller, UUID contractId) {
        Contract contract = repository.findByIdAndOrganizationId(contractId, caller.getOrganizationId())
            .map(ContractEntity::toDomain)
            .orElseThrow(() -> new NotFoundException("Contract", contractId));
        if (!caller.hasAuthorityOver(contract.getWorkerId()) && !caller.getUserId().equals(contract.getCreatedBy())) {
            throw new ForbiddenException("Access denied");
        }
        return contract;
    }

    @Transactional
    public Contract activateContract(Caller caller, UUID contractId) {
        requireManager(caller);
        ContractEntity entity = repository.findByIdForUpdate(contractId, caller.getOrganizationId())
            .orElseThrow(() -> new NotFoundException("Contract", contractId));
        Contract current = entity.toDomain();
        if (!caller.hasAuthorityOver(current.getWorkerId())) {
            throw new ForbiddenException("Can only activate contracts of your team members");
        }

        entity.updateFromDomain(current.activate());
        log.info("Contract {} activated", contractId);
        return entity.toDomain();
    }

    /**
     * Pays towards one installment of an active contract.
     *
     * The contract row is locked first, then the ledger credit goes through
     * the allocation gate. The installment and the contract total are updated
     * only after the credit has been written.
     */
    @Transactional
    public ContractPayment recordContractPayment(Caller caller, UUID contractId, ContractPaymentCommand command) {
        requireManager(caller);
        BigDecimal amount = Amounts.requirePositive(command.getAmount(), "amount");

        ContractEntity entity = repository.findByIdForUpdate(contractId, caller.getOrganizationId())
            .orElseThrow(() -> new NotFoundException("Contract", contractId));
        Contract contract = entity.toDomain();
        contract.requirePayable(command.getInstallmentNumber(), amount);

        UUID allocationId = command.getFundAllocationId() != null
            ? command.getFundAllocationId()
            : contract.getFundAllocationId();
        if (allocationId == null) {
            throw new IllegalArgumentException("A fund allocation is required to pay a contract without a default allocation");
        }

        LedgerEntry entry = ledgerService.createEntry(caller, CreateLedgerEntryCommand.builder()
            .workerId(contract.getWorkerId())
            .siteId(contract.getSiteId())
            .fundAllocationId(allocationId)
            .contractId(contract.getId())
            .type(EntryType.CREDIT)
            .category(LedgerCategory.CONTRACT_PAYMENT)
            .amount(amount)
            .status(LedgerStatus.PAID)
            .description(String.format("Contract payment - %s - Installment %d",
                contract.getTitle(), command.getInstallmentNumber()))
            .referenceNumber(command.getReferenceNumber())
            .paymentMode(command.getPaymentMode())
            .build());

        Contract updated = contract.recordPayment(command.getInstallmentNumber(), amount, entry.getId(), command.getNotes());
        entity.updateFromDomain(updated);
        metrics.recordConsumption("contract_payment", updated.getStatus().name());

        log.info("Contract payment recorded: contract={}, installment={}, amount={}, totalPaid={}, status={}",
            contractId, command.getInstallmentNumber(), amount, updated.getTotalPaid(), updated.getStatus());
        return new ContractPayment(updated, entry);
    }

    private void requireManager(Caller caller) {
        if (!caller.hasRole(Role.DEVELOPER, Role.ENGINEER, Role.SUPERVISOR)) {
            throw new ForbiddenException("Insufficient role to manage contracts");
        }
    }
}
