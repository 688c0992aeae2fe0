package com.flagship.fund_ledger.consumption;

import com.flagship.fund_ledger.common.Amounts;
import com.flagship.fund_ledger.common.exception.ForbiddenException;
import com.flagship.fund_ledger.common.exception.NotFoundException;
import com.flagship.fund_ledger.identity.Caller;
import com.flagship.fund_ledger.identity.DirectoryService;
import com.flagship.fund_ledger.identity.Role;
import com.flagship.fund_ledger.identity.UserRecord;
import com.flagship.fund_ledger.observability.SettlementMetrics;
import com.flagship.fund_ledger.reconciliation.FundGate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class BillService {

    private final BillRepository repository;
    private final DirectoryService directoryService;
    private final FundGate fundGate;
    private final SettlementMetrics metrics;

    /**
     * Records a GST bill. When the bill names a fund allocation its total is
     * gated against that allocation; otherwise it is charged to the creator's
     * wallet once credited or paid.
     */
    @Transactional
    public Bill createBill(Caller caller, CreateBillCommand command) {
        if (command.getVendorName() == null || command.getVendorName().isBlank()) {
            throw new IllegalArgumentException("vendorName is required");
        }
        BigDecimal base = Amounts.requirePositive(command.getBaseAmount(), "baseAmount");
        BigDecimal gst = Amounts.normalize(command.getGstAmount());
        if (gst.signum() < 0) {
            throw new IllegalArgumentException("gstAmount must not be negative");
        }
        BigDecimal total = base.add(gst);

        if (command.getSiteId() != null) {
            directoryService.requireSite(command.getSiteId(), caller.getOrganizationId());
        }
        if (command.getFundAllocationId() != null) {
            fundGate.reserve(caller, command.getFundAllocationId(), total);
        }

        Instant now = Instant.now();
        Bill bill = Bill.builder()
            .id(UUID.randomUUID())
            .organizationId(caller.getOrganizationId())
            .siteId(command.getSiteId())
            .createdBy(caller.getUserId())
            .fundAllocationId(command.getFundAllocationId())
            .vendorName(command.getVendorName())
            .vendorGstNumber(command.getVendorGstNumber())
            .invoiceNumber(command.getInvoiceNumber())
            .billDate(command.getBillDate() != null ? command.getBillDate() : LocalDate.now())
            .baseAmount(base)
            .gstAmount(gst)
            .gstRate(command.getGstRate() != null ? command.getGstRate() : Bill.DEFAULT_GST_RATE)
            .totalAmount(total)
            .billType(command.getBillType() != null ? command.getBillType() : BillType.MATERIAL)
            .status(BillStatus.PENDING)
            .description(command.getDescription())
            .createdAt(now)
            .updatedAt(now)
            .build();

        Bill saved = repository.save(BillEntity.fromDomain(bill)).toDomain();
        metrics.recordConsumption("bill", saved.getStatus().name());

        log.info("Bill created: id={}, vendor={}, total={}, allocation={}",
            saved.getId(), saved.getVendorName(), saved.getTotalAmount(), saved.getFundAllocationId());
        return saved;
    }

    /**
     * Developer-only bookkeeping of a bill's payment state. A bill without an
     * allocation reaches its creator's wallet when it is first credited or
     * paid, so that move is gated against the wallet.
     */
    @Transactional
    public Bill setBillStatus(Caller caller, UUID billId, BillStatus target) {
        if (!caller.isDeveloper()) {
            throw new ForbiddenException("Only developers can change bill status");
        }
        if (target == null || target == BillStatus.PENDING) {
            throw new IllegalArgumentException("Bill status must be CREDITED, PAID or REJECTED");
        }
        BillEntity entity = repository.findByIdAndOrganizationId(billId, caller.getOrganizationId())
            .orElseThrow(() -> new NotFoundException("Bill", billId));

        Bill current = entity.toDomain();
        Bill updated = current.transitionTo(target);
        if (current.getFundAllocationId() == null && current.getStatus() == BillStatus.PENDING
                && target != BillStatus.REJECTED) {
            chargeCreatorWallet(current);
        }
        entity.updateFromDomain(updated);
        metrics.recordConsumption("bill", target.name());

        log.info("Bill {} moved from {} to {}", billId, current.getStatus(), target);
        return entity.toDomain();
    }

    private void chargeCreatorWallet(Bill bill) {
        UserRecord creator = directoryService.findUser(bill.getCreatedBy())
            .orElseThrow(() -> new NotFoundException("User", bill.getCreatedBy()));
        if (creator.getRole() != Role.DEVELOPER) {
            fundGate.reserveWallet(creator.getId(), bill.getOrganizationId(), bill.getTotalAmount());
        }
    }
}
