package com.intteq.amqp.contract.topology;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A queue together with the wait queue and bindings that give it delayed
 * redelivery. Created by {@link TtlBackoffInfrastructure}; a contract expands
 * it into its four parts.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class QueueWithTtlBackoffInfrastructure implements QueueEntry {

    private final QueueDefinition queue;
    private final QueueDefinition waitQueue;
    private final QueueBindingDefinition waitQueueBinding;
    private final QueueBindingDefinition mainQueueRetryBinding;

    QueueWithTtlBackoffInfrastructure(QueueDefinition queue,
                                      QueueDefinition waitQueue,
                                      QueueBindingDefinition waitQueueBinding,
                                      QueueBindingDefinition mainQueueRetryBinding) {
        this.queue = queue;
        this.waitQueue = waitQueue;
        this.waitQueueBinding = waitQueueBinding;
        this.mainQueueRetryBinding = mainQueueRetryBinding;
    }

    @Override
    public Kind getKind() {
        return Kind.TTL_BACKOFF;
    }
}
