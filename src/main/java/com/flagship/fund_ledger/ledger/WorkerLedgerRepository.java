package com.flagship.fund_ledger.ledger;

import lombok.Value;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC access to {@code worker_ledger_entries}.
 *
 * Kept on plain JDBC like the rest of the money path: every statement is
 * visible here, and row locks and batch updates are explicit.
 */
@Repository
public class WorkerLedgerRepository {

    private static final String COLUMNS =
        "id, organization_id, worker_id, site_id, created_by, fund_allocation_id, contract_id, " +
        "linked_advance_id, entry_type, amount, category, status, description, transaction_date, " +
        "reference_number, payment_mode, paid_at, created_at, updated_at, sequence_number";

    private final JdbcTemplate jdbcTemplate;

    public WorkerLedgerRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public LedgerEntry insert(LedgerEntry entry) {
        jdbcTemplate.update(
            "INSERT INTO worker_ledger_entries (id, organization_id, worker_id, site_id, created_by, " +
            "fund_allocation_id, contract_id, linked_advance_id, entry_type, amount, category, status, " +
            "description, transaction_date, reference_number, payment_mode, paid_at, created_at, updated_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)",
            entry.getId(),
            entry.getOrganizationId(),
            entry.getWorkerId(),
            entry.getSiteId(),
            entry.getCreatedBy(),
            entry.getFundAllocationId(),
            entry.getContractId(),
            entry.getLinkedAdvanceId(),
            entry.getType().name(),
            entry.getAmount(),
            entry.getCategory().name(),
            entry.getStatus().name(),
            entry.getDescription(),
            entry.getTransactionDate(),
            entry.getReferenceNumber(),
            entry.getPaymentMode().name(),
            toTimestamp(entry.getPaidAt())
        );
        return findById(entry.getId())
            .orElseThrow(() -> new IllegalStateException("Ledger entry vanished after insert: " + entry.getId()));
    }

    public Optional<LedgerEntry> findById(UUID id) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM worker_ledger_entries WHERE id = ?",
            rowMapper(),
            id
        ).stream().findFirst();
    }

    /**
     * Updates the editable fields of an entry. Worker, direction, category and
     * allocation stay as created.
     */
    public void updateTerms(LedgerEntry entry) {
        jdbcTemplate.update(
            "UPDATE worker_ledger_entries SET amount = ?, description = ?, transaction_date = ?, " +
            "reference_number = ?, payment_mode = ?, updated_at = CURRENT_TIMESTAMP WHERE id = ?",
            entry.getAmount(),
            entry.getDescription(),
            entry.getTransactionDate(),
            entry.getReferenceNumber(),
            entry.getPaymentMode().name(),
            entry.getId()
        );
    }

    public int delete(UUID id) {
        return jdbcTemplate.update("DELETE FROM worker_ledger_entries WHERE id = ?", id);
    }

    public List<LedgerEntry> find(LedgerEntryFilter filter, int page, int limit) {
        List<Object> params = new ArrayList<>();
        String where = whereClause(filter, params);
        params.add(limit);
        params.add((long) (page - 1) * limit);
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM worker_ledger_entries" + where +
            " ORDER BY transaction_date DESC, sequence_number DESC LIMIT ? OFFSET ?",
            rowMapper(),
            params.toArray()
        );
    }

    public long count(LedgerEntryFilter filter) {
        List<Object> params = new ArrayList<>();
        String where = whereClause(filter, params);
        Long total = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM worker_ledger_entries" + where, Long.class, params.toArray());
        return total != null ? total : 0L;
    }

    /**
     * Pending salary accruals of a worker, oldest first. With {@code forUpdate}
     * the rows stay locked until the calling transaction ends, so two
     * settlements of the same worker cannot both claim them.
     */
    public List<LedgerEntry> findPendingSalary(UUID organizationId, UUID workerId, UUID siteId,
                                               LocalDate startDate, LocalDate endDate, boolean forUpdate) {
        List<Object> params = new ArrayList<>(List.of(organizationId, workerId));
        StringBuilder sql = new StringBuilder("SELECT " + COLUMNS + " FROM worker_ledger_entries " +
            "WHERE organization_id = ? AND worker_id = ? AND category = 'PENDING_SALARY' AND status = 'PENDING'");
        if (siteId != null) {
            sql.append(" AND site_id = ?");
            params.add(siteId);
        }
        if (startDate != null) {
            sql.append(" AND transaction_date >= ?");
            params.add(startDate);
        }
        if (endDate != null) {
            sql.append(" AND transaction_date <= ?");
            params.add(endDate);
        }
        sql.append(" ORDER BY transaction_date, sequence_number");
        if (forUpdate) {
            sql.append(" FOR UPDATE");
        }
        return jdbcTemplate.query(sql.toString(), rowMapper(), params.toArray());
    }

    /**
     * Advance credits that no deduction references yet.
     */
    public List<LedgerEntry> findUnpaidAdvances(UUID organizationId, UUID workerId) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM worker_ledger_entries a " +
            "WHERE a.organization_id = ? AND a.worker_id = ? AND a.entry_type = 'CREDIT' AND a.category = 'ADVANCE' " +
            "AND NOT EXISTS (SELECT 1 FROM worker_ledger_entries d WHERE d.linked_advance_id = a.id) " +
            "ORDER BY a.transaction_date, a.sequence_number",
            rowMapper(),
            organizationId,
            workerId
        );
    }

    /**
     * Marks pending entries as paid from the given allocation.
     *
     * @return number of rows that were still pending and got marked
     */
    public int markPaid(List<UUID> entryIds, UUID fundAllocationId) {
        int[] counts = jdbcTemplate.batchUpdate(
            "UPDATE worker_ledger_entries SET status = 'PAID', fund_allocation_id = ?, " +
            "paid_at = CURRENT_TIMESTAMP, updated_at = CURRENT_TIMESTAMP WHERE id = ? AND status = 'PENDING'",
            entryIds.stream().map(id -> new Object[]{fundAllocationId, id}).toList()
        );
        int updated = 0;
        for (int count : counts) {
            updated += Math.max(count, 0);
        }
        return updated;
    }

    public boolean hasDeductionFor(UUID advanceId) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM worker_ledger_entries WHERE linked_advance_id = ?", Integer.class, advanceId);
        return count != null && count > 0;
    }

    public boolean isReferencedByInstallment(UUID entryId) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM contract_installments WHERE ledger_entry_id = ?", Integer.class, entryId);
        return count != null && count > 0;
    }

    public boolean contractExists(UUID contractId, UUID organizationId) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM contracts WHERE id = ? AND organization_id = ?",
            Integer.class, contractId, organizationId);
        return count != null && count > 0;
    }

    /**
     * Totals per (type, category) for one worker.
     */
    public List<CategoryTotal> summarizeByCategory(UUID organizationId, UUID workerId) {
        return jdbcTemplate.query(
            "SELECT entry_type, category, SUM(amount) AS total, COUNT(*) AS entries " +
            "FROM worker_ledger_entries WHERE organization_id = ? AND worker_id = ? " +
            "GROUP BY entry_type, category ORDER BY entry_type, category",
            (rs, rowNum) -> new CategoryTotal(
                EntryType.valueOf(rs.getString("entry_type")),
                LedgerCategory.valueOf(rs.getString("category")),
                rs.getBigDecimal("total"),
                rs.getLong("entries")
            ),
            organizationId,
            workerId
        );
    }

    private String whereClause(LedgerEntryFilter filter, List<Object> params) {
        StringBuilder where = new StringBuilder(" WHERE organization_id = ?");
        params.add(filter.getOrganizationId());
        if (filter.getVisibleWorkerIds() != null) {
            if (filter.getVisibleWorkerIds().isEmpty()) {
                where.append(" AND 1 = 0");
            } else {
                where.append(" AND worker_id IN (")
                    .append(String.join(", ", filter.getVisibleWorkerIds().stream().map(id -> "?").toList()))
                    .append(")");
                params.addAll(filter.getVisibleWorkerIds());
            }
        }
        if (filter.getWorkerId() != null) {
            where.append(" AND worker_id = ?");
            params.add(filter.getWorkerId());
        }
        if (filter.getSiteId() != null) {
            where.append(" AND site_id = ?");
            params.add(filter.getSiteId());
        }
        if (filter.getType() != null) {
            where.append(" AND entry_type = ?");
            params.add(filter.getType().name());
        }
        if (filter.getCategory() != null) {
            where.append(" AND category = ?");
            params.add(filter.getCategory().name());
        }
        if (filter.getStatus() != null) {
            where.append(" AND status = ?");
            params.add(filter.getStatus().name());
        }
        if (filter.getStartDate() != null) {
            where.append(" AND transaction_date >= ?");
            params.add(filter.getStartDate());
        }
        if (filter.getEndDate() != null) {
            where.append(" AND transaction_date <= ?");
            params.add(filter.getEndDate());
        }
        return where.toString();
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private static Instant toInstant(ResultSet rs, String column) throws SQLException {
        Timestamp timestamp = rs.getTimestamp(column);
        return timestamp != null ? timestamp.toInstant() : null;
    }

    private RowMapper<LedgerEntry> rowMapper() {
        return (rs, rowNum) -> LedgerEntry.builder()
            .id(rs.getObject("id", UUID.class))
            .organizationId(rs.getObject("organization_id", UUID.class))
            .workerId(rs.getObject("worker_id", UUID.class))
            .siteId(rs.getObject("site_id", UUID.class))
            .createdBy(rs.getObject("created_by", UUID.class))
            .fundAllocationId(rs.getObject("fund_allocation_id", UUID.class))
            .contractId(rs.getObject("contract_id", UUID.class))
            .linkedAdvanceId(rs.getObject("linked_advance_id", UUID.class))
            .type(EntryType.valueOf(rs.getString("entry_type")))
            .amount(rs.getBigDecimal("amount"))
            .category(LedgerCategory.valueOf(rs.getString("category")))
            .status(LedgerStatus.valueOf(rs.getString("status")))
            .description(rs.getString("description"))
            .transactionDate(rs.getObject("transaction_date", LocalDate.class))
            .referenceNumber(rs.getString("reference_number"))
            .paymentMode(PaymentMode.valueOf(rs.getString("payment_mode")))
            .paidAt(toInstant(rs, "paid_at"))
            .createdAt(toInstant(rs, "created_at"))
            .updatedAt(toInstant(rs, "updated_at"))
            .sequenceNumber(rs.getLong("sequence_number"))
            .build();
    }

    /**
     * Sum and count of one worker's entries of a given type and category.
     */
    @Value
    public static class CategoryTotal {
        EntryType type;
        LedgerCategory category;
        BigDecimal total;
        long entries;
    }
}
