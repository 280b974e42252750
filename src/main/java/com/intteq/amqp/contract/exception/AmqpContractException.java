package com.intteq.amqp.contract.exception;

/**
 * Root of the unchecked exception hierarchy raised by the contract runtime.
 */
public class AmqpContractException extends RuntimeException {

    public AmqpContractException(String message) {
        super(message);
    }

    public AmqpContractException(String message, Throwable cause) {
        super(message, cause);
    }
}
