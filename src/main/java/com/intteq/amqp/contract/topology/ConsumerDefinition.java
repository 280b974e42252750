package com.intteq.amqp.contract.topology;

import com.intteq.amqp.contract.exception.ContractConfigurationException;
import com.intteq.amqp.contract.exception.ContractConfigurationException.Code;
import lombok.Getter;
import lombok.ToString;

import java.util.Map;
import java.util.Objects;

/**
 * What a named consumer reads and from which queue.
 */
@Getter
@ToString
public final class ConsumerDefinition {

    private final QueueDefinition queue;
    private final MessageDefinition message;
    private final Integer prefetch;

    private ConsumerDefinition(QueueDefinition queue, MessageDefinition message, Integer prefetch) {
        this.queue = Objects.requireNonNull(queue, "queue must not be null");
        this.message = Objects.requireNonNull(message, "message must not be null");
        if (prefetch != null && prefetch < 1) {
            throw new ContractConfigurationException(Code.INVALID_PREFETCH,
                    "Consumer prefetch must be a positive integer, got " + prefetch,
                    Map.of("queue", queue.getName()));
        }
        this.prefetch = prefetch;
    }

    public static ConsumerDefinition of(QueueEntry queue, MessageDefinition message) {
        return new ConsumerDefinition(queue.getQueue(), message, null);
    }

    public static ConsumerDefinition of(QueueEntry queue, MessageDefinition message, int prefetch) {
        return new ConsumerDefinition(queue.getQueue(), message, prefetch);
    }
}
