package com.flagship.token_ledger.event;

/**
 * Subscriber callback. Listeners are registered and removed by identity.
 */
@FunctionalInterface
public interface LedgerEventListener {

    void onEvent(LedgerEvent event);
}
