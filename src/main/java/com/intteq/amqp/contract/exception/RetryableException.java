package com.intteq.amqp.contract.exception;

/**
 * Thrown by a handler to signal a transient failure. The message is routed
 * through the queue's retry policy.
 *
 * <p>Any other exception thrown by a handler, except {@link NonRetryableException},
 * is treated the same way.</p>
 */
public class RetryableException extends AmqpContractException {

    public RetryableException(String message) {
        super(message);
    }

    public RetryableException(String message, Throwable cause) {
        super(message, cause);
    }
}
