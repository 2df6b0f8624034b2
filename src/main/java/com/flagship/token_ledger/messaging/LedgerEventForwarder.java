package com.flagship.token_ledger.messaging;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.token_ledger.event.LedgerEvent;
import com.flagship.token_ledger.event.LedgerEventChannel;
import com.flagship.token_ledger.event.LedgerEventListener;
import com.flagship.token_ledger.ledger.TokenLedgerService;
import com.flagship.token_ledger.observability.LedgerMetrics;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Forwards committed ledger events to Kafka.
 *
 * Records are {@code {channel, occurredAt, payload}} JSON keyed by the
 * account id, so a consumer sees one account's events in commit order.
 *
 * Events arrive on the ledger writer thread. They are serialized there and
 * handed to a single sender thread, so a slow or unreachable broker never
 * holds up the writer. A failed send is logged and counted and never
 * reaches the ledger.
 */
@Component
@ConditionalOnProperty(name = "ledger.events.kafka.enabled", havingValue = "true")
@Slf4j
public class LedgerEventForwarder implements LedgerEventListener {

    private static final String UNINITIALIZED_KEY = "uninitialized";
    private static final String SENDER_THREAD_NAME = "ledger-event-forwarder";

    private final TokenLedgerService ledger;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final LedgerMetrics metrics;
    private final String topic;
    private final ExecutorService sender;

    public LedgerEventForwarder(TokenLedgerService ledger,
                                KafkaTemplate<String, String> kafkaTemplate,
                                ObjectMapper objectMapper,
                                LedgerMetrics metrics,
                                @Value("${ledger.events.kafka.topic:ledger-events}") String topic) {
        this.ledger = ledger;
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.topic = topic;
        this.sender = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, SENDER_THREAD_NAME);
            thread.setDaemon(true);
            return thread;
        });
    }

    @PostConstruct
    public void subscribe() {
        for (LedgerEventChannel channel : LedgerEventChannel.values()) {
            ledger.on(channel, this);
        }
        log.info("Forwarding ledger events to Kafka topic {}", topic);
    }

    /**
     * Stops listening, then waits for queued sends to be handed to Kafka.
     */
    @PreDestroy
    public void shutdown() {
        for (LedgerEventChannel channel : LedgerEventChannel.values()) {
            ledger.off(channel, this);
        }
        sender.shutdown();
        try {
            if (!sender.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Event forwarder did not drain within 10s, dropping queued events");
                sender.shutdownNow();
            }
        } catch (InterruptedException e) {
            sender.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void onEvent(LedgerEvent event) {
        String channel = event.getChannel().wireName();
        String value;
        try {
            value = objectMapper.writeValueAsString(toRecord(event));
        } catch (JsonProcessingException e) {
            metrics.recordForwardingFailure(channel);
            log.error("Failed to serialize {} event: {}", channel, e.getMessage());
            return;
        }

        String accountId = ledger.getState().getAccountId();
        String key = accountId != null ? accountId : UNINITIALIZED_KEY;

        try {
            sender.execute(() -> send(channel, key, value));
        } catch (RejectedExecutionException e) {
            metrics.recordForwardingFailure(channel);
            log.warn("Event forwarder is shut down, dropping {} event", channel);
        }
    }

    private void send(String channel, String key, String value) {
        try {
            kafkaTemplate.send(topic, key, value).whenComplete((result, error) -> {
                if (error != null) {
                    metrics.recordForwardingFailure(channel);
                    log.error("Failed to forward {} event: key={}, error={}", channel, key, error.getMessage());
                } else {
                    log.debug("Forwarded {} event: partition={}, offset={}", channel,
                            result.getRecordMetadata().partition(),
                            result.getRecordMetadata().offset());
                }
            });
        } catch (RuntimeException e) {
            // send() itself throws when metadata cannot be fetched within max.block.ms
            metrics.recordForwardingFailure(channel);
            log.error("Failed to forward {} event: key={}, error={}", channel, key, e.getMessage());
        }
    }

    private Map<String, Object> toRecord(LedgerEvent event) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("channel", event.getChannel().wireName());
        record.put("occurredAt", event.getOccurredAt());
        record.put("payload", event.getPayload());
        return record;
    }
}
