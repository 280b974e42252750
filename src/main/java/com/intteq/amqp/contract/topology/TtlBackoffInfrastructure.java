package com.intteq.amqp.contract.topology;

import com.intteq.amqp.contract.exception.ContractConfigurationException;
import com.intteq.amqp.contract.exception.ContractConfigurationException.Code;

import java.util.Map;

/**
 * Derives the topology that emulates delayed redelivery for a queue.
 *
 * <p>For a queue {@code Q} dead-lettering to exchange {@code DLX}:</p>
 * <ul>
 *     <li>wait queue {@code Q-wait}, classic, dead-lettering to {@code DLX} with key {@code Q}</li>
 *     <li>binding {@code DLX -> Q-wait} on key {@code Q-wait}</li>
 *     <li>binding {@code DLX -> Q} on key {@code Q}</li>
 * </ul>
 *
 * <p>A worker retries a message by publishing a copy to {@code DLX} with key
 * {@code Q-wait} and a per-message expiration equal to the backoff delay. When the
 * copy expires, the wait queue dead-letters it to {@code DLX} with key {@code Q},
 * which routes it back to {@code Q}.</p>
 *
 * <p>When {@code Q} has no dead-letter routing key, a rejected message keeps its own
 * key, which is {@code Q} once it has been retried. The worker therefore dead-letters
 * such messages explicitly with their original routing key.</p>
 */
public final class TtlBackoffInfrastructure {

    public static final String WAIT_QUEUE_SUFFIX = "-wait";

    private TtlBackoffInfrastructure() {
    }

    public static String waitQueueName(String queueName) {
        return queueName + WAIT_QUEUE_SUFFIX;
    }

    /**
     * Wraps a queue with its retry infrastructure. The wait queue has the
     * durability of the main queue.
     *
     * @throws ContractConfigurationException if the queue has no dead-letter exchange
     */
    public static QueueWithTtlBackoffInfrastructure wrap(QueueEntry entry) {
        return wrap(entry, null);
    }

    /**
     * Wraps a queue with its retry infrastructure.
     *
     * @param waitQueueDurable durability override for the wait queue, {@code null} to inherit
     * @throws ContractConfigurationException if the queue has no dead-letter exchange, a fanout
     *                                        one, or a dead-letter routing key of {@code Q} or {@code Q-wait}
     */
    public static QueueWithTtlBackoffInfrastructure wrap(QueueEntry entry, Boolean waitQueueDurable) {
        QueueDefinition queue = entry.getQueue();

        if (!queue.hasDeadLetter()) {
            throw new ContractConfigurationException(Code.RETRY_REQUIRES_DEAD_LETTER,
                    "Queue \"" + queue.getName() + "\" does not have a dead letter exchange configured. "
                            + "TTL-backoff retry requires deadLetter to be set on the queue.",
                    Map.of("queue", queue.getName()));
        }

        ExchangeDefinition dlx = queue.getDeadLetter().getExchange();
        if (dlx.getType() == ExchangeType.FANOUT) {
            throw new ContractConfigurationException(Code.RETRY_REQUIRES_DEAD_LETTER,
                    "Queue \"" + queue.getName() + "\" dead-letters to fanout exchange \"" + dlx.getName()
                            + "\". TTL-backoff retry routes by key and needs a direct or topic exchange.",
                    Map.of("queue", queue.getName(), "exchange", dlx.getName()));
        }
        String waitName = waitQueueName(queue.getName());

        String deadLetterKey = queue.getDeadLetter().getRoutingKey();
        if (queue.getName().equals(deadLetterKey) || waitName.equals(deadLetterKey)) {
            throw new ContractConfigurationException(Code.INVALID_DEAD_LETTER_ROUTING_KEY,
                    "Queue \"" + queue.getName() + "\" dead-letters with routing key \"" + deadLetterKey
                            + "\", which the retry bindings route back into the queue. "
                            + "Use a key bound to a dead letter queue.",
                    Map.of("queue", queue.getName(), "routingKey", deadLetterKey));
        }

        QueueDefinition waitQueue = QueueDefinition.builder()
                .name(waitName)
                .type(QueueType.CLASSIC)
                .durable(waitQueueDurable != null ? waitQueueDurable : queue.isDurable())
                .deadLetter(DeadLetterConfig.of(dlx, queue.getName()))
                .build();

        return new QueueWithTtlBackoffInfrastructure(
                queue,
                waitQueue,
                QueueBindingDefinition.of(waitQueue, dlx, waitName),
                QueueBindingDefinition.of(queue, dlx, queue.getName())
        );
    }

    /**
     * @return whether failed deliveries of this queue are retried through a wait queue
     */
    public static boolean usesWaitQueue(QueueDefinition queue) {
        return queue.getRetry() != null
                && queue.getRetry().getMaxRetries() > 0
                && queue.hasDeadLetter();
    }

    /**
     * @return whether dead-lettering a message received with {@code routingKey} would route it
     * back into {@code queue} or its wait queue through the retry bindings
     */
    public static boolean reentersRetryLoop(QueueDefinition queue, String routingKey) {
        if (!queue.hasDeadLetter() || queue.getDeadLetter().getRoutingKey() != null || routingKey == null) {
            return false;
        }
        return routingKey.equals(queue.getName()) || routingKey.equals(waitQueueName(queue.getName()));
    }
}
