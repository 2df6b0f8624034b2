package com.flagship.token_ledger.event;

import com.flagship.token_ledger.observability.LedgerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Publish/subscribe over named ledger channels.
 *
 * Delivery rules:
 * - listeners are notified in registration order
 * - a listener that throws is logged and skipped; the remaining listeners
 *   are still notified and the committed mutation stands
 * - registration and removal go by identity, so the same lambda instance
 *   must be passed to {@link #off}
 */
@Component
@Slf4j
public class LedgerEventNotifier {

    private final Map<LedgerEventChannel, List<LedgerEventListener>> listeners =
        new EnumMap<>(LedgerEventChannel.class);
    private final LedgerMetrics metrics;
    private final Clock clock;

    public LedgerEventNotifier(LedgerMetrics metrics, Clock clock) {
        this.metrics = metrics;
        this.clock = clock;
        for (LedgerEventChannel channel : LedgerEventChannel.values()) {
            listeners.put(channel, new CopyOnWriteArrayList<>());
        }
    }

    public void on(LedgerEventChannel channel, LedgerEventListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("Listener cannot be null");
        }
        List<LedgerEventListener> registered = listeners.get(channel);
        synchronized (registered) {
            registered.add(listener);
        }
    }

    /**
     * Removes the first registration of exactly this listener instance.
     *
     * @return true if a registration was removed
     */
    public boolean off(LedgerEventChannel channel, LedgerEventListener listener) {
        List<LedgerEventListener> registered = listeners.get(channel);
        synchronized (registered) {
            for (int i = 0; i < registered.size(); i++) {
                if (registered.get(i) == listener) {
                    registered.remove(i);
                    return true;
                }
            }
        }
        return false;
    }

    public int listenerCount(LedgerEventChannel channel) {
        return listeners.get(channel).size();
    }

    public void publish(LedgerEventChannel channel, Object payload) {
        LedgerEvent event = new LedgerEvent(channel, payload, Instant.now(clock));
        for (LedgerEventListener listener : listeners.get(channel)) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                metrics.recordListenerFailure(channel.wireName());
                log.warn("Listener failed on channel {}: {}", channel.wireName(), e.getMessage(), e);
            }
        }
        log.debug("Published {} to {} listener(s)", channel.wireName(), listeners.get(channel).size());
    }
}
