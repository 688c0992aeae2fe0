package com.flagship.fund_ledger.failure;

import com.flagship.fund_ledger.allocation.AllocationStatus;
import com.flagship.fund_ledger.allocation.CreateAllocationCommand;
import com.flagship.fund_ledger.allocation.FundAllocation;
import com.flagship.fund_ledger.allocation.FundAllocationService;
import com.flagship.fund_ledger.common.exception.InsufficientFundsException;
import com.flagship.fund_ledger.common.exception.NoPendingWorkException;
import com.flagship.fund_ledger.identity.DirectoryService;
import com.flagship.fund_ledger.ledger.CreateLedgerEntryCommand;
import com.flagship.fund_ledger.ledger.EntryType;
import com.flagship.fund_ledger.ledger.LedgerCategory;
import com.flagship.fund_ledger.ledger.WorkerLedgerService;
import com.flagship.fund_ledger.reconciliation.ReconciliationService;
import com.flagship.fund_ledger.settlement.SalarySettlementService;
import com.flagship.fund_ledger.settlement.SettlementOptions;
import com.flagship.fund_ledger.support.OrganizationFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Concurrent spends against one allocation on a real PostgreSQL.
 *
 * These tests verify that:
 * - Row locks on the allocation serialize concurrent spends
 * - The remaining balance never goes negative
 * - A worker's pending salary is paid exactly once under concurrent settlements
 * - A spend through an allocation and a wallet-funded disbursement cannot both take the same money
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class ConcurrentSpendTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("fund_ledger_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        // No broker in these tests
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("outbox.publisher.enabled", () -> "false");
    }

    @Autowired
    private WorkerLedgerService ledgerService;

    @Autowired
    private SalarySettlementService settlementService;

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

    @Test
    @DisplayName("Concurrent credits never overdraw the allocation")
    void testConcurrentCredits_NeverOverdraw() throws InterruptedException {
        printTestHeader("Concurrent credits against one allocation");
        FundAllocation allocation = org.disburse(org.supervisorId, "1000.00");

        int threadCount = 5;
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(threadCount);
        AtomicInteger successCount = new AtomicInteger(0);
        AtomicInteger rejectedCount = new AtomicInteger(0);
        AtomicInteger unexpectedCount = new AtomicInteger(0);

        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        for (int i = 0; i < threadCount; i++) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    ledgerService.createEntry(org.supervisor(), CreateLedgerEntryCommand.builder()
                        .workerId(org.worker1Id)
                        .fundAllocationId(allocation.getId())
                        .type(EntryType.CREDIT)
                        .category(LedgerCategory.BONUS)
                        .amount(new BigDecimal("300.00"))
                        .build());
                    successCount.incrementAndGet();
                } catch (InsufficientFundsException e) {
                    rejectedCount.incrementAndGet();
                } catch (Exception e) {
                    unexpectedCount.incrementAndGet();
                    System.out.println("Unexpected failure: " + e);
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertTrue(doneLatch.await(30, TimeUnit.SECONDS));
        executor.shutdown();

        BigDecimal remaining = reconciliationService.allocationBalance(allocation.getId()).getRemaining();
        printOutput("Succeeded", successCount.get());
        printOutput("Rejected", rejectedCount.get());
        printOutput("Remaining", remaining);

        assertEquals(0, unexpectedCount.get());
        assertEquals(3, successCount.get());
        assertEquals(2, rejectedCount.get());
        assertEquals(new BigDecimal("100.00"), remaining);
        printSuccess("Three credits passed, two were rejected, balance stayed positive");
    }

    @Test
    @DisplayName("Concurrent settlements of one worker pay the pending salary once")
    void testConcurrentSettlements_PayOnce() throws InterruptedException {
        printTestHeader("Concurrent settlements of one worker");
        FundAllocation allocation = org.disburse(org.supervisorId, "5000.00");
        ledgerService.createEntry(org.supervisor(), CreateLedgerEntryCommand.builder()
            .workerId(org.worker1Id)
            .type(EntryType.CREDIT)
            .category(LedgerCategory.PENDING_SALARY)
            .amount(new BigDecimal("1200.00"))
            .build());

        int threadCount = 3;
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(threadCount);
        AtomicInteger successCount = new AtomicInteger(0);
        AtomicInteger noWorkCount = new AtomicInteger(0);

        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        for (int i = 0; i < threadCount; i++) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    settlementService.paySalary(org.supervisor(), org.worker1Id, allocation.getId(),
                        SettlementOptions.none());
                    successCount.incrementAndGet();
                } catch (NoPendingWorkException e) {
                    noWorkCount.incrementAndGet();
                } catch (Exception e) {
                    System.out.println("Unexpected failure: " + e);
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertTrue(doneLatch.await(30, TimeUnit.SECONDS));
        executor.shutdown();

        assertEquals(1, successCount.get());
        assertEquals(threadCount - 1, noWorkCount.get());
        assertEquals(new BigDecimal("3800.00"),
            reconciliationService.allocationBalance(allocation.getId()).getRemaining());
    }

    @Test
    @DisplayName("An allocation spend and a wallet-funded disbursement racing for one wallet: one wins")
    void testConcurrentCrossPath_OneWins() throws InterruptedException {
        printTestHeader("Allocation spend racing a wallet-funded disbursement");
        FundAllocation funding = org.disburse(org.supervisorId, "1000.00");
        FundAllocation toWorker = allocationService.createAllocation(org.supervisor(), CreateAllocationCommand.builder()
            .toUserId(org.worker1Id)
            .amount(new BigDecimal("1000.00"))
            .build());

        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(2);
        AtomicInteger successCount = new AtomicInteger(0);
        AtomicInteger rejectedCount = new AtomicInteger(0);

        ExecutorService executor = Executors.newFixedThreadPool(2);
        executor.submit(() -> {
            try {
                startLatch.await();
                ledgerService.createEntry(org.supervisor(), CreateLedgerEntryCommand.builder()
                    .workerId(org.worker2Id)
                    .fundAllocationId(funding.getId())
                    .type(EntryType.CREDIT)
                    .category(LedgerCategory.BONUS)
                    .amount(new BigDecimal("1000.00"))
                    .build());
                successCount.incrementAndGet();
            } catch (InsufficientFundsException e) {
                rejectedCount.incrementAndGet();
            } catch (Exception e) {
                System.out.println("Unexpected failure: " + e);
            } finally {
                doneLatch.countDown();
            }
        });
        executor.submit(() -> {
            try {
                startLatch.await();
                allocationService.setAllocationStatus(org.worker1(), toWorker.getId(), AllocationStatus.DISBURSED);
                successCount.incrementAndGet();
            } catch (InsufficientFundsException e) {
                rejectedCount.incrementAndGet();
            } catch (Exception e) {
                System.out.println("Unexpected failure: " + e);
            } finally {
                doneLatch.countDown();
            }
        });

        startLatch.countDown();
        assertTrue(doneLatch.await(30, TimeUnit.SECONDS));
        executor.shutdown();

        BigDecimal wallet = reconciliationService.walletBalance(org.supervisorId, org.organizationId).getBalance();
        printOutput("Succeeded", successCount.get());
        printOutput("Supervisor wallet", wallet);

        assertEquals(1, successCount.get());
        assertEquals(1, rejectedCount.get());
        assertEquals(new BigDecimal("0.00"), wallet);
        printSuccess("Only one path spent the supervisor's 1000.00");
    }
}
