package com.intteq.amqp.contract.exception;

/**
 * Infrastructure or runtime failure: broker unreachable, publish rejected,
 * unknown publisher, undecodable message body.
 */
public class TechnicalException extends AmqpContractException {

    public TechnicalException(String message) {
        super(message);
    }

    public TechnicalException(String message, Throwable cause) {
        super(message, cause);
    }
}
