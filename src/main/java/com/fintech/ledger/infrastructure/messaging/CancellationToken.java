package com.fintech.ledger.infrastructure.messaging;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal shared between the operator and the producer.
 *
 * Raising it never interrupts work in flight; the producer observes it before each
 * read and before each blocking send.
 */
public class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    /**
     * @return true if this call raised the signal, false if it was already raised
     */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
