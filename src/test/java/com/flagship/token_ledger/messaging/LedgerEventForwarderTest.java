package com.flagship.token_ledger.messaging;

import com.fasterxml.jackson.databind.JsonNode;
import com.flagship.token_ledger.LedgerFixture;
import com.flagship.token_ledger.ledger.TokenLedgerService;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Kafka forwarding of committed ledger events.
 *
 * These tests verify that:
 * - every channel is forwarded, keyed by the account id
 * - a failed send is counted and never affects the ledger
 * - a hanging broker does not hold up ledger commits
 * - after shutdown nothing more is sent
 */
class LedgerEventForwarderTest {

    private static final String ACCOUNT = "0xA11CE00000000000000000000000000000000001";
    private static final String TOPIC = "ledger-events-test";

    private LedgerFixture fixture;
    private TokenLedgerService ledger;
    private KafkaTemplate<String, String> kafkaTemplate;
    private LedgerEventForwarder forwarder;

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
    @SuppressWarnings("unchecked")
    void setUp() {
        fixture = LedgerFixture.create();
        ledger = fixture.ledger;
        kafkaTemplate = mock(KafkaTemplate.class);
        forwarder = new LedgerEventForwarder(ledger, kafkaTemplate, fixture.objectMapper, fixture.metrics, TOPIC);
        forwarder.subscribe();
    }

    @AfterEach
    void tearDown() {
        forwarder.shutdown();
        fixture.close();
    }

    private static SendResult<String, String> sendResult() {
        RecordMetadata metadata = new RecordMetadata(new TopicPartition(TOPIC, 0), 0L, 0, 0L, 0, 0);
        return new SendResult<>(null, metadata);
    }

    @Test
    @DisplayName("Committed events are forwarded with the account id as key")
    void testForwardsEvents() throws Exception {
        printTestHeader("Forward Events");
        when(kafkaTemplate.send(eq(TOPIC), anyString(), anyString()))
            .thenReturn(CompletableFuture.completedFuture(sendResult()));

        ledger.initialize(ACCOUNT).join();
        ledger.contribute("vegan_outreach", new BigDecimal("10")).join();
        forwarder.shutdown();

        ArgumentCaptor<String> keys = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<String> values = ArgumentCaptor.forClass(String.class);
        verify(kafkaTemplate, atLeastOnce()).send(eq(TOPIC), keys.capture(), values.capture());

        List<String> channels = values.getAllValues().stream()
            .map(this::readChannel)
            .toList();
        printOutput("Forwarded channels", channels);

        assertTrue(keys.getAllValues().stream().allMatch(ACCOUNT::equals));
        assertEquals(List.of("balance_updated", "state_changed",
            "balance_updated", "contribution_made", "state_changed"), channels);

        JsonNode contribution = fixture.objectMapper.readTree(values.getAllValues().get(3));
        assertEquals("vegan_outreach", contribution.path("payload").path("contribution").path("causeId").asText());
        assertFalse(contribution.path("occurredAt").asText().isEmpty());
        assertEquals(0.0, fixture.registry.counter("ledger.events.forwarding.failures",
            "channel", "state_changed").count());
        printSuccess("Five events forwarded in commit order");
    }

    @Test
    @DisplayName("A failed send is counted and the operation still commits")
    void testFailedSendIsCounted() {
        printTestHeader("Failed Send");
        when(kafkaTemplate.send(eq(TOPIC), anyString(), anyString()))
            .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker unavailable")));

        ledger.initialize(ACCOUNT).join();
        forwarder.shutdown();

        double failures = fixture.registry.counter("ledger.events.forwarding.failures",
            "channel", "state_changed").count();
        printOutput("state_changed failures", failures);
        assertEquals(1.0, failures);
        assertEquals(1.0, fixture.registry.counter("ledger.events.forwarding.failures",
            "channel", "balance_updated").count());
        assertTrue(ledger.getState().isInitialized());
        assertEquals(0, new BigDecimal("100").compareTo(ledger.getBalance().getPrimary()));
        printSuccess("Send failure absorbed by the forwarder");
    }

    @Test
    @DisplayName("A send that throws before returning a future is counted")
    void testSendThrowsIsCounted() {
        printTestHeader("Send Throws");
        when(kafkaTemplate.send(eq(TOPIC), anyString(), anyString()))
            .thenThrow(new IllegalStateException("Topic not present in metadata after 5000 ms"));

        ledger.initialize(ACCOUNT).join();
        forwarder.shutdown();

        assertEquals(1.0, fixture.registry.counter("ledger.events.forwarding.failures",
            "channel", "balance_updated").count());
        assertTrue(ledger.getState().isInitialized());
        printSuccess("Synchronous send failure absorbed by the forwarder");
    }

    @Test
    @DisplayName("A hanging broker does not hold up ledger commits")
    void testHangingBrokerDoesNotBlockLedger() throws Exception {
        printTestHeader("Hanging Broker");
        CountDownLatch brokerBack = new CountDownLatch(1);
        when(kafkaTemplate.send(eq(TOPIC), anyString(), anyString())).thenAnswer(invocation -> {
            brokerBack.await(10, TimeUnit.SECONDS);
            return CompletableFuture.completedFuture(sendResult());
        });

        assertTimeoutPreemptively(Duration.ofSeconds(2), () -> {
            ledger.initialize(ACCOUNT).join();
            ledger.contribute("vegan_outreach", new BigDecimal("10")).join();
            ledger.stakeTokens(new BigDecimal("20")).join();
        });
        printOutput("Balance while broker hangs", ledger.getBalance().getPrimary());
        assertEquals(0, new BigDecimal("70").compareTo(ledger.getBalance().getPrimary()));

        brokerBack.countDown();
        forwarder.shutdown();

        verify(kafkaTemplate, times(7)).send(eq(TOPIC), anyString(), anyString());
        printSuccess("Ledger committed while sends were stuck; all events sent afterwards");
    }

    @Test
    @DisplayName("Nothing is sent after shutdown")
    void testShutdown() {
        printTestHeader("Shutdown");
        forwarder.shutdown();

        ledger.initialize(ACCOUNT).join();

        verify(kafkaTemplate, never()).send(anyString(), anyString(), anyString());
        printSuccess("No records after shutdown");
    }

    private String readChannel(String value) {
        try {
            return fixture.objectMapper.readTree(value).path("channel").asText();
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }
}
