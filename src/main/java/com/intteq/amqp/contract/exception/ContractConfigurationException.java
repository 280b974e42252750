package com.intteq.amqp.contract.exception;

import lombok.Getter;

import java.util.Map;

/**
 * A contract, queue or worker was declared with an invalid configuration.
 *
 * <p>Always raised eagerly, while definitions are built or a worker starts,
 * never while messages flow.</p>
 */
@Getter
public class ContractConfigurationException extends AmqpContractException {

    private final Code code;
    private final Map<String, Object> context;

    public ContractConfigurationException(Code code, String message) {
        this(code, message, Map.of());
    }

    public ContractConfigurationException(Code code, String message, Map<String, Object> context) {
        super(message);
        this.code = code;
        this.context = Map.copyOf(context);
    }

    /**
     * Machine-readable reason.
     */
    public enum Code {
        INVALID_EXCHANGE_NAME,
        INVALID_QUEUE_NAME,
        INVALID_MAX_PRIORITY,
        PRIORITY_REQUIRES_CLASSIC_QUEUE,
        EXCLUSIVE_REQUIRES_CLASSIC_QUEUE,
        INVALID_DELIVERY_LIMIT,
        INVALID_QUEUE_OPTION,
        INVALID_RETRY_POLICY,
        RETRY_REQUIRES_DEAD_LETTER,
        MISSING_ROUTING_KEY,
        ROUTING_KEY_CONTAINS_WILDCARDS,
        BINDING_REFERENCES_UNDEFINED_EXCHANGE,
        BINDING_REFERENCES_UNDEFINED_QUEUE,
        PUBLISHER_REFERENCES_UNDEFINED_EXCHANGE,
        CONSUMER_REFERENCES_UNDEFINED_QUEUE,
        QUEUE_REFERENCES_UNDEFINED_DEAD_LETTER_EXCHANGE,
        CONSUMER_NOT_FOUND,
        HANDLER_NOT_PROVIDED,
        INVALID_PREFETCH,
        INVALID_CONCURRENCY,
        INVALID_BATCH_SIZE,
        INVALID_BATCH_TIMEOUT,
        INVALID_DEAD_LETTER_ROUTING_KEY
    }
}
