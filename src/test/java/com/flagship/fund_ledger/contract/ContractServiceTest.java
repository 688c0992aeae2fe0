package com.flagship.fund_ledger.contract;

import com.flagship.fund_ledger.allocation.FundAllocation;
import com.flagship.fund_ledger.allocation.FundAllocationService;
import com.flagship.fund_ledger.common.exception.ErrorCode;
import com.flagship.fund_ledger.common.exception.ForbiddenException;
import com.flagship.fund_ledger.common.exception.InsufficientFundsException;
import com.flagship.fund_ledger.common.exception.InvalidStateException;
import com.flagship.fund_ledger.common.exception.NotFoundException;
import com.flagship.fund_ledger.identity.DirectoryService;
import com.flagship.fund_ledger.ledger.EntryType;
import com.flagship.fund_ledger.ledger.LedgerCategory;
import com.flagship.fund_ledger.ledger.LedgerEntry;
import com.flagship.fund_ledger.ledger.WorkerLedgerService;
import com.flagship.fund_ledger.reconciliation.ReconciliationService;
import com.flagship.fund_ledger.support.OrganizationFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Worker contracts paid in installments.
 *
 * These tests verify that:
 * - Payments are refused until the contract is active
 * - Each payment writes a gated CONTRACT_PAYMENT credit linked to the contract
 * - Installments go PARTIAL then PAID, and the contract completes when fully paid
 * - A failed payment leaves the installment untouched
 */
@SpringBootTest
@ActiveProfiles("test")
class ContractServiceTest {

    @Autowired
    private ContractService contractService;

    @Autowired
    private WorkerLedgerService ledgerService;

    @Autowired
    private FundAllocationService allocationService;

    @Autowired
    private ReconciliationService reconciliationService;

    @Autowired
    private DirectoryService directoryService;

    private OrganizationFixture org;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @BeforeEach
    void setUp() {
        org = new OrganizationFixture(directoryService, allocationService);
    }

    private Contract contract(UUID allocationId, String total, int installments) {
        return contractService.createContract(org.supervisor(), CreateContractCommand.builder()
            .workerId(org.worker1Id)
            .siteId(org.siteId)
            .fundAllocationId(allocationId)
            .title("Plastering")
            .totalAmount(new BigDecimal(total))
            .numberOfInstallments(installments)
            .build());
    }

    private ContractPayment pay(Contract contract, int installment, String amount) {
        return contractService.recordContractPayment(org.supervisor(), contract.getId(), ContractPaymentCommand.builder()
            .installmentNumber(installment)
            .amount(new BigDecimal(amount))
            .build());
    }

    @Test
    @DisplayName("Installment payments complete the contract and consume its allocation")
    void testRecordContractPayment_FullLifecycle() {
        printTestHeader("Contract lifecycle");
        FundAllocation allocation = org.disburse(org.supervisorId, "5000.00");
        Contract created = contract(allocation.getId(), "3000.00", 3);

        assertEquals(ContractStatus.DRAFT, created.getStatus());
        assertEquals(ContractType.FIXED, created.getContractType());
        assertEquals(3, created.getInstallments().size());

        InvalidStateException draft = assertThrows(InvalidStateException.class, () -> pay(created, 1, "1000.00"));
        assertEquals(ErrorCode.CONTRACT_NOT_ACTIVE, draft.getCode());

        contractService.activateContract(org.supervisor(), created.getId());

        ContractPayment first = pay(created, 1, "1000.00");
        printOutput("First payment", first.getLedgerEntry());
        LedgerEntry entry = first.getLedgerEntry();
        assertEquals(EntryType.CREDIT, entry.getType());
        assertEquals(LedgerCategory.CONTRACT_PAYMENT, entry.getCategory());
        assertEquals(created.getId(), entry.getContractId());
        assertEquals(allocation.getId(), entry.getFundAllocationId());
        assertEquals("Contract payment - Plastering - Installment 1", entry.getDescription());
        assertEquals(entry.getId(), first.getContract().getInstallments().get(0).getLedgerEntryId());

        ContractPayment partial = pay(created, 2, "600.00");
        assertEquals(InstallmentStatus.PARTIAL, partial.getContract().getInstallments().get(1).getStatus());
        assertThrows(IllegalArgumentException.class, () -> pay(created, 2, "500.00"));

        pay(created, 2, "400.00");
        ContractPayment last = pay(created, 3, "1000.00");

        assertEquals(ContractStatus.COMPLETED, last.getContract().getStatus());
        assertEquals(new BigDecimal("3000.00"), last.getContract().getTotalPaid());
        last.getContract().getInstallments()
            .forEach(installment -> assertEquals(InstallmentStatus.PAID, installment.getStatus()));
        assertEquals(new BigDecimal("2000.00"),
            reconciliationService.allocationBalance(allocation.getId()).getRemaining());

        Contract reloaded = contractService.getContract(org.supervisor(), created.getId());
        assertEquals(ContractStatus.COMPLETED, reloaded.getStatus());
        assertEquals(new BigDecimal("0.00"), reloaded.remainingAmount());
        printSuccess("Contract completed after four payments");
    }

    @Test
    @DisplayName("A payment the allocation cannot cover leaves the contract untouched")
    void testRecordContractPayment_InsufficientFunds() {
        FundAllocation allocation = org.disburse(org.supervisorId, "1000.00");
        Contract created = contract(allocation.getId(), "4000.00", 2);
        contractService.activateContract(org.supervisor(), created.getId());

        assertThrows(InsufficientFundsException.class, () -> pay(created, 1, "2000.00"));

        Contract reloaded = contractService.getContract(org.supervisor(), created.getId());
        assertEquals(new BigDecimal("0.00"), reloaded.getTotalPaid());
        assertEquals(InstallmentStatus.PENDING, reloaded.getInstallments().get(0).getStatus());
        assertEquals(ContractStatus.ACTIVE, reloaded.getStatus());
    }

    @Test
    @DisplayName("An entry recorded against an installment cannot be deleted")
    void testDeleteEntry_ReferencedByInstallment() {
        FundAllocation allocation = org.disburse(org.supervisorId, "500.00");
        Contract created = contract(allocation.getId(), "500.00", 1);
        contractService.activateContract(org.supervisor(), created.getId());
        ContractPayment payment = pay(created, 1, "500.00");

        assertThrows(InvalidStateException.class,
            () -> ledgerService.deleteEntry(org.developer(), payment.getLedgerEntry().getId()));
    }

    @Test
    @DisplayName("A payment with no allocation on the command or the contract is refused")
    void testRecordContractPayment_RequiresAllocation() {
        Contract created = contract(null, "1000000.00", 1);
        contractService.activateContract(org.supervisor(), created.getId());

        assertThrows(IllegalArgumentException.class, () -> pay(created, 1, "1000000.00"));

        Contract after = contractService.getContract(org.supervisor(), created.getId());
        assertEquals(new BigDecimal("0.00"), after.getTotalPaid());
        assertEquals(InstallmentStatus.PENDING, after.getInstallments().get(0).getStatus());
        assertNull(after.getInstallments().get(0).getLedgerEntryId());
        assertEquals(new BigDecimal("0.00"),
            reconciliationService.walletBalance(org.supervisorId, org.organizationId).getLedgerNet());
    }

    @Test
    @DisplayName("Contracts are created only for team members, at valid sites and allocations")
    void testCreateContract_Validation() {
        assertThrows(ForbiddenException.class, () -> contractService.createContract(org.worker1(),
            CreateContractCommand.builder().workerId(org.worker1Id).siteId(org.siteId).title("T")
                .totalAmount(BigDecimal.TEN).build()));
        assertThrows(ForbiddenException.class, () -> contractService.createContract(org.supervisor(),
            CreateContractCommand.builder().workerId(org.engineerId).siteId(org.siteId).title("T")
                .totalAmount(BigDecimal.TEN).build()));
        assertThrows(IllegalArgumentException.class, () -> contractService.createContract(org.supervisor(),
            CreateContractCommand.builder().workerId(org.worker1Id).title("T").totalAmount(BigDecimal.TEN).build()));
        assertThrows(NotFoundException.class, () -> contract(UUID.randomUUID(), "100.00", 1));
        assertThrows(IllegalArgumentException.class, () -> contract(null, "100.00", 0));

        Contract single = contract(null, "100.00", 1);
        assertEquals(1, single.getInstallments().size());
        assertEquals(new BigDecimal("100.00"), single.getInstallments().get(0).getAmount());
    }

    @Test
    @DisplayName("The worker and their managers read a contract; managers activate it once")
    void testGetAndActivate_Authority() {
        Contract created = contract(null, "100.00", 1);

        assertNotNull(contractService.getContract(org.worker1(), created.getId()));
        assertThrows(ForbiddenException.class,
            () -> contractService.getContract(directoryService.resolveCaller(org.worker2Id), created.getId()));
        assertThrows(NotFoundException.class, () -> contractService.getContract(org.supervisor(), UUID.randomUUID()));
        assertNotNull(contractService.getContract(org.engineer(), created.getId()));

        assertEquals(ContractStatus.ACTIVE, contractService.activateContract(org.engineer(), created.getId()).getStatus());
        assertThrows(InvalidStateException.class, () -> contractService.activateContract(org.supervisor(), created.getId()));
    }
}
