package com.flagship.token_ledger.event;

import lombok.Value;

import java.time.Instant;

/**
 * Notification published after a committed ledger operation.
 */
@Value
public class LedgerEvent {
    LedgerEventChannel channel;
    Object payload;
    Instant occurredAt;

    /**
     * Typed access to the payload.
     *
     * @throws ClassCastException if the payload is not of the requested type
     */
    public <T> T payloadAs(Class<T> type) {
        return type.cast(payload);
    }
}
