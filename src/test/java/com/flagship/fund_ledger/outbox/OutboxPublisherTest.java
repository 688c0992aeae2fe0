package com.flagship.fund_ledger.outbox;

import com.flagship.fund_ledger.allocation.FundAllocation;
import com.flagship.fund_ledger.allocation.FundAllocationService;
import com.flagship.fund_ledger.identity.DirectoryService;
import com.flagship.fund_ledger.support.OrganizationFixture;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.KafkaContainer;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Outbox publisher against real PostgreSQL and Kafka.
 *
 * These tests verify that:
 * - Outbox events reach the topic of their aggregate
 * - The aggregate id is the record key
 * - Published events are marked and leave the backlog
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class OutboxPublisherTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("fund_ledger_test")
            .withUsername("test")
            .withPassword("test");

    @Container
    static KafkaContainer kafka = new KafkaContainer(
            DockerImageName.parse("confluentinc/cp-kafka:7.5.0"));

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.kafka.bootstrap-servers", kafka::getBootstrapServers);
        // Publisher bean is needed, the schedule is not; tests trigger it directly
        registry.add("outbox.publisher.enabled", () -> "true");
        registry.add("outbox.publisher.poll-interval-ms", () -> "3600000");
    }

    @Autowired
    private OutboxPublisher outboxPublisher;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private FundAllocationService allocationService;

    @Autowired
    private DirectoryService directoryService;

    private OrganizationFixture org;
    private KafkaConsumer<String, String> consumer;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @BeforeEach
    void setUp() {
        org = new OrganizationFixture(directoryService, allocationService);

        Properties props = new Properties();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, kafka.getBootstrapServers());
        props.put(ConsumerConfig.GROUP_ID_CONFIG, "test-group-" + UUID.randomUUID());
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");

        consumer = new KafkaConsumer<>(props);
        consumer.subscribe(List.of("fund-allocations"));
    }

    @AfterEach
    void tearDown() {
        consumer.close();
    }

    private List<ConsumerRecord<String, String>> consumeRecords(String key, long timeoutMs) {
        List<ConsumerRecord<String, String>> records = new ArrayList<>();
        long deadline = System.currentTimeMillis() + timeoutMs;
        while (System.currentTimeMillis() < deadline && records.isEmpty()) {
            consumer.poll(Duration.ofMillis(200)).forEach(record -> {
                if (key.equals(record.key())) {
                    records.add(record);
                }
            });
        }
        return records;
    }

    @Test
    @DisplayName("An allocation event is published keyed by the allocation id")
    void testPublisher_SendsToKafka() {
        printTestHeader("Publisher sends allocation events to Kafka");
        FundAllocation allocation = org.disburse(org.engineerId, "250.00");

        outboxPublisher.publishPendingEvents();

        List<OutboxEvent> events =
            outboxService.getEventsForAggregate(OutboxPublisher.ALLOCATION_AGGREGATE, allocation.getId());
        assertEquals(1, events.size());
        assertTrue(events.get(0).isPublished());

        List<ConsumerRecord<String, String>> records = consumeRecords(allocation.getId().toString(), 10000);
        assertEquals(1, records.size());
        assertTrue(records.get(0).value().contains("FundAllocationCreated"));
        printSuccess("Event published and marked");
    }

    @Test
    @DisplayName("Settlement events go to the settlements topic")
    void testTopicRouting() {
        assertEquals("worker-settlements", outboxPublisher.topicFor(OutboxPublisher.SETTLEMENT_AGGREGATE));
        assertEquals("fund-allocations", outboxPublisher.topicFor(OutboxPublisher.ALLOCATION_AGGREGATE));
    }
}
