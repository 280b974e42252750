package com.intteq.amqp.contract.topology;

import com.intteq.amqp.contract.exception.ContractConfigurationException;
import com.intteq.amqp.contract.exception.ContractConfigurationException.Code;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable declaration of a queue.
 *
 * <p>Defaults: {@link QueueType#QUORUM}, durable, not exclusive, not auto-delete.</p>
 *
 * <p><b>Rejected at build time:</b></p>
 * <ul>
 *     <li>a blank name</li>
 *     <li>{@code maxPriority} on a quorum queue, or outside 1..255</li>
 *     <li>an exclusive quorum queue</li>
 *     <li>{@code deliveryLimit} on a classic queue, or below 1</li>
 *     <li>negative {@code messageTtl} or {@code maxLength}</li>
 * </ul>
 *
 * <pre>
 * QueueDefinition orders = QueueDefinition.builder()
 *         .name("orders")
 *         .deadLetter(DeadLetterConfig.of(dlx, "orders.failed"))
 *         .retry(RetryPolicy.of(3, BackoffPolicy.exponential()))
 *         .build();
 * </pre>
 */
@Getter
@ToString
@EqualsAndHashCode
public final class QueueDefinition implements QueueEntry {

    public static final String ARG_QUEUE_TYPE = "x-queue-type";
    public static final String ARG_MAX_PRIORITY = "x-max-priority";
    public static final String ARG_MESSAGE_TTL = "x-message-ttl";
    public static final String ARG_MAX_LENGTH = "x-max-length";
    public static final String ARG_DELIVERY_LIMIT = "x-delivery-limit";
    public static final String ARG_DEAD_LETTER_EXCHANGE = "x-dead-letter-exchange";
    public static final String ARG_DEAD_LETTER_ROUTING_KEY = "x-dead-letter-routing-key";

    private final String name;
    private final QueueType type;
    private final boolean durable;
    private final boolean exclusive;
    private final boolean autoDelete;
    private final Integer maxPriority;
    private final Long messageTtl;
    private final Long maxLength;
    private final Integer deliveryLimit;
    private final DeadLetterConfig deadLetter;
    private final RetryPolicy retry;
    private final Map<String, Object> arguments;

    @Builder(toBuilder = true)
    private QueueDefinition(String name,
                            QueueType type,
                            Boolean durable,
                            boolean exclusive,
                            boolean autoDelete,
                            Integer maxPriority,
                            Long messageTtl,
                            Long maxLength,
                            Integer deliveryLimit,
                            DeadLetterConfig deadLetter,
                            RetryPolicy retry,
                            Map<String, Object> arguments) {
        if (name == null || name.isBlank()) {
            throw new ContractConfigurationException(Code.INVALID_QUEUE_NAME, "Queue name must not be blank");
        }
        this.name = name;
        this.type = type == null ? QueueType.QUORUM : type;
        this.durable = durable == null || durable;
        this.exclusive = exclusive;
        this.autoDelete = autoDelete;
        this.maxPriority = maxPriority;
        this.messageTtl = messageTtl;
        this.maxLength = maxLength;
        this.deliveryLimit = deliveryLimit;
        this.deadLetter = deadLetter;
        this.retry = retry;
        this.arguments = arguments == null ? Map.of() : Map.copyOf(arguments);
        validate();
    }

    private void validate() {
        Map<String, Object> ctx = Map.of("queue", name);

        if (maxPriority != null) {
            if (type == QueueType.QUORUM) {
                throw new ContractConfigurationException(Code.PRIORITY_REQUIRES_CLASSIC_QUEUE,
                        "Queue \"" + name + "\" declares maxPriority but quorum queues do not support priorities. "
                                + "Use QueueType.CLASSIC.", ctx);
            }
            if (maxPriority < 1 || maxPriority > 255) {
                throw new ContractConfigurationException(Code.INVALID_MAX_PRIORITY,
                        "Queue \"" + name + "\" maxPriority must be between 1 and 255, got " + maxPriority, ctx);
            }
        }
        if (exclusive && type == QueueType.QUORUM) {
            throw new ContractConfigurationException(Code.EXCLUSIVE_REQUIRES_CLASSIC_QUEUE,
                    "Queue \"" + name + "\" is exclusive but quorum queues cannot be exclusive", ctx);
        }
        if (deliveryLimit != null) {
            if (type != QueueType.QUORUM) {
                throw new ContractConfigurationException(Code.INVALID_DELIVERY_LIMIT,
                        "Queue \"" + name + "\" declares deliveryLimit which requires a quorum queue", ctx);
            }
            if (deliveryLimit < 1) {
                throw new ContractConfigurationException(Code.INVALID_DELIVERY_LIMIT,
                        "Queue \"" + name + "\" deliveryLimit must be a positive integer, got " + deliveryLimit, ctx);
            }
        }
        if (messageTtl != null && messageTtl < 0) {
            throw new ContractConfigurationException(Code.INVALID_QUEUE_OPTION,
                    "Queue \"" + name + "\" messageTtl must not be negative", ctx);
        }
        if (maxLength != null && maxLength < 0) {
            throw new ContractConfigurationException(Code.INVALID_QUEUE_OPTION,
                    "Queue \"" + name + "\" maxLength must not be negative", ctx);
        }
    }

    public static QueueDefinition quorum(String name) {
        return builder().name(name).type(QueueType.QUORUM).build();
    }

    public static QueueDefinition classic(String name) {
        return builder().name(name).type(QueueType.CLASSIC).build();
    }

    @Override
    public Kind getKind() {
        return Kind.PLAIN;
    }

    @Override
    public QueueDefinition getQueue() {
        return this;
    }

    public boolean hasDeadLetter() {
        return deadLetter != null;
    }

    /**
     * Broker arguments derived from this definition, layered over the
     * user-supplied {@link #getArguments() arguments}.
     */
    public Map<String, Object> toArguments() {
        Map<String, Object> args = new LinkedHashMap<>(arguments);
        args.put(ARG_QUEUE_TYPE, type.argumentValue());
        if (maxPriority != null) {
            args.put(ARG_MAX_PRIORITY, maxPriority);
        }
        if (messageTtl != null) {
            args.put(ARG_MESSAGE_TTL, messageTtl);
        }
        if (maxLength != null) {
            args.put(ARG_MAX_LENGTH, maxLength);
        }
        if (deliveryLimit != null) {
            args.put(ARG_DELIVERY_LIMIT, deliveryLimit);
        }
        if (deadLetter != null) {
            args.put(ARG_DEAD_LETTER_EXCHANGE, deadLetter.getExchange().getName());
            if (deadLetter.getRoutingKey() != null) {
                args.put(ARG_DEAD_LETTER_ROUTING_KEY, deadLetter.getRoutingKey());
            }
        }
        return args;
    }
}
