package com.intteq.amqp.contract.topology;

/**
 * A queue as it may appear in a contract: either a plain {@link QueueDefinition}
 * or a {@link QueueWithTtlBackoffInfrastructure} carrying its generated wait
 * queue and bindings.
 *
 * <p>Code that only needs the queue itself calls {@link #getQueue()} regardless
 * of the variant; code that cares about the generated infrastructure switches
 * on {@link #getKind()}.</p>
 */
public interface QueueEntry {

    Kind getKind();

    /**
     * @return the main queue of this entry
     */
    QueueDefinition getQueue();

    enum Kind {
        PLAIN,
        TTL_BACKOFF
    }
}
