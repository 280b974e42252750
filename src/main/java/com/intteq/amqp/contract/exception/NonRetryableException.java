package com.intteq.amqp.contract.exception;

/**
 * Thrown by a handler to signal a permanent failure. The message is
 * dead-lettered immediately, regardless of the remaining retry budget.
 */
public class NonRetryableException extends AmqpContractException {

    public NonRetryableException(String message) {
        super(message);
    }

    public NonRetryableException(String message, Throwable cause) {
        super(message, cause);
    }
}
