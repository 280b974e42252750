package com.intteq.amqp.contract.topology;

import com.intteq.amqp.contract.exception.ContractConfigurationException;
import com.intteq.amqp.contract.exception.ContractConfigurationException.Code;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The complete, validated messaging topology shared by clients and workers.
 *
 * <p><b>Build-time processing:</b></p>
 * <ul>
 *     <li>{@link QueueWithTtlBackoffInfrastructure} entries registered under key {@code k}
 *         expand into queues {@code k} and {@code kWait} and bindings {@code kWaitBinding}
 *         and {@code kRetryBinding}</li>
 *     <li>a plain queue with {@code retry.maxRetries > 0} and a dead-letter exchange is
 *         wrapped the same way; without a dead-letter exchange the build fails</li>
 *     <li>every exchange and queue referenced by bindings, publishers, consumers and
 *         dead-letter settings must be declared in the contract</li>
 * </ul>
 *
 * <p>All maps keep declaration order and are unmodifiable. Instances are thread-safe.</p>
 *
 * <pre>
 * ContractDefinition contract = ContractDefinition.builder()
 *         .exchange("orders", orders)
 *         .exchange("ordersDlx", dlx)
 *         .queue("orderProcessing", orderQueue)
 *         .binding("orderCreated", QueueBindingDefinition.of(orderQueue, orders, "order.created"))
 *         .publisher("orderCreated", PublisherDefinition.of(orders, "order.created", orderMessage))
 *         .consumer("processOrder", ConsumerDefinition.of(orderQueue, orderMessage))
 *         .build();
 * </pre>
 */
@Getter
@ToString
public final class ContractDefinition {

    private final Map<String, ExchangeDefinition> exchanges;
    private final Map<String, QueueDefinition> queues;
    private final Map<String, BindingDefinition> bindings;
    private final Map<String, PublisherDefinition> publishers;
    private final Map<String, ConsumerDefinition> consumers;

    private ContractDefinition(Map<String, ExchangeDefinition> exchanges,
                               Map<String, QueueDefinition> queues,
                               Map<String, BindingDefinition> bindings,
                               Map<String, PublisherDefinition> publishers,
                               Map<String, ConsumerDefinition> consumers) {
        this.exchanges = Collections.unmodifiableMap(new LinkedHashMap<>(exchanges));
        this.queues = Collections.unmodifiableMap(new LinkedHashMap<>(queues));
        this.bindings = Collections.unmodifiableMap(new LinkedHashMap<>(bindings));
        this.publishers = Collections.unmodifiableMap(new LinkedHashMap<>(publishers));
        this.consumers = Collections.unmodifiableMap(new LinkedHashMap<>(consumers));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.exchanges.putAll(exchanges);
        builder.queues.putAll(queues);
        builder.bindings.putAll(bindings);
        builder.publishers.putAll(publishers);
        builder.consumers.putAll(consumers);
        return builder;
    }

    public Optional<PublisherDefinition> findPublisher(String name) {
        return Optional.ofNullable(publishers.get(name));
    }

    public Optional<ConsumerDefinition> findConsumer(String name) {
        return Optional.ofNullable(consumers.get(name));
    }

    /**
     * Combines contracts in argument order. On a key collision the later
     * contract's definition wins. The result is validated again.
     */
    public static ContractDefinition merge(ContractDefinition... contracts) {
        Builder builder = new Builder();
        for (ContractDefinition contract : contracts) {
            Objects.requireNonNull(contract, "contract must not be null");
            builder.exchanges.putAll(contract.exchanges);
            builder.queues.putAll(contract.queues);
            builder.bindings.putAll(contract.bindings);
            builder.publishers.putAll(contract.publishers);
            builder.consumers.putAll(contract.consumers);
        }
        return builder.build();
    }

    // =====================================================================
    // BUILDER
    // =====================================================================

    public static final class Builder {

        private final Map<String, ExchangeDefinition> exchanges = new LinkedHashMap<>();
        private final Map<String, QueueEntry> queues = new LinkedHashMap<>();
        private final Map<String, BindingDefinition> bindings = new LinkedHashMap<>();
        private final Map<String, PublisherDefinition> publishers = new LinkedHashMap<>();
        private final Map<String, ConsumerDefinition> consumers = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder exchange(String key, ExchangeDefinition exchange) {
            exchanges.put(requireKey(key), Objects.requireNonNull(exchange, "exchange must not be null"));
            return this;
        }

        public Builder queue(String key, QueueEntry queue) {
            queues.put(requireKey(key), Objects.requireNonNull(queue, "queue must not be null"));
            return this;
        }

        public Builder binding(String key, BindingDefinition binding) {
            bindings.put(requireKey(key), Objects.requireNonNull(binding, "binding must not be null"));
            return this;
        }

        public Builder publisher(String key, PublisherDefinition publisher) {
            publishers.put(requireKey(key), Objects.requireNonNull(publisher, "publisher must not be null"));
            return this;
        }

        public Builder consumer(String key, ConsumerDefinition consumer) {
            consumers.put(requireKey(key), Objects.requireNonNull(consumer, "consumer must not be null"));
            return this;
        }

        /**
         * Registers a consumer together with the binding that feeds its queue,
         * stored under {@code keyBinding}.
         */
        public Builder consumer(String key, ConsumerDefinition consumer, QueueBindingDefinition binding) {
            consumer(key, consumer);
            return binding(key + "Binding", binding);
        }

        /**
         * Expands retry infrastructure, validates references and freezes the contract.
         *
         * @throws ContractConfigurationException on the first violation found; further
         *                                        violations are attached as suppressed exceptions
         */
        public ContractDefinition build() {
            Map<String, QueueDefinition> expandedQueues = new LinkedHashMap<>();
            Map<String, BindingDefinition> expandedBindings = new LinkedHashMap<>(bindings);

            queues.forEach((key, entry) -> {
                QueueWithTtlBackoffInfrastructure infra = infrastructureOf(key, entry);
                if (infra == null) {
                    expandedQueues.put(key, entry.getQueue());
                    return;
                }
                expandedQueues.put(key, infra.getQueue());
                expandedQueues.put(key + "Wait", infra.getWaitQueue());
                expandedBindings.put(key + "WaitBinding", infra.getWaitQueueBinding());
                expandedBindings.put(key + "RetryBinding", infra.getMainQueueRetryBinding());
            });

            ContractDefinition contract = new ContractDefinition(
                    exchanges, expandedQueues, expandedBindings, publishers, consumers);
            ContractValidator.assertValid(contract);
            return contract;
        }

        private static QueueWithTtlBackoffInfrastructure infrastructureOf(String key, QueueEntry entry) {
            if (entry.getKind() == QueueEntry.Kind.TTL_BACKOFF) {
                return (QueueWithTtlBackoffInfrastructure) entry;
            }
            QueueDefinition queue = entry.getQueue();
            RetryPolicy retry = queue.getRetry();
            if (retry == null || retry.getMaxRetries() == 0) {
                return null;
            }
            if (!queue.hasDeadLetter()) {
                throw new ContractConfigurationException(Code.RETRY_REQUIRES_DEAD_LETTER,
                        "Queue \"" + queue.getName() + "\" (key \"" + key + "\") declares maxRetries="
                                + retry.getMaxRetries() + " but has no dead letter exchange. "
                                + "TTL-backoff retry requires deadLetter to be set on the queue.",
                        Map.of("queue", queue.getName(), "key", key));
            }
            return TtlBackoffInfrastructure.wrap(queue);
        }

        private static String requireKey(String key) {
            if (key == null || key.isBlank()) {
                throw new IllegalArgumentException("contract key must not be blank");
            }
            return key;
        }
    }
}
