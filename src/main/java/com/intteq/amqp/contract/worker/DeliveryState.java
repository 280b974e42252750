package com.intteq.amqp.contract.worker;

/**
 * Lifecycle of one delivery inside a worker.
 *
 * <pre>
 * RECEIVED → DECOMPRESSED → VALIDATED → HANDLED → ACKED
 *                                               ↘ RETRIED_VIA_WAIT_QUEUE
 *                                               ↘ DEAD_LETTERED
 *                                               ↘ REQUEUED
 * </pre>
 *
 * <p>Decoding and validation failures jump straight to {@link #DEAD_LETTERED}.</p>
 */
public enum DeliveryState {

    RECEIVED(false),
    DECOMPRESSED(false),
    VALIDATED(false),
    HANDLED(false),

    /** Handler succeeded. */
    ACKED(true),

    /** A copy went to the wait queue and the original was acknowledged. */
    RETRIED_VIA_WAIT_QUEUE(true),

    /** Rejected without requeue; the broker forwards it to the queue's dead-letter exchange. */
    DEAD_LETTERED(true),

    /** Rejected with requeue: legacy mode without retry policy, or a failed retry copy. */
    REQUEUED(true);

    private final boolean terminal;

    DeliveryState(boolean terminal) {
        this.terminal = terminal;
    }

    public boolean isTerminal() {
        return terminal;
    }
}
