package com.intteq.amqp.contract.worker;

/**
 * Application callback for one consumer.
 *
 * <p>Returning normally acknowledges the message. Throwing
 * {@link com.intteq.amqp.contract.exception.NonRetryableException} dead-letters it;
 * any other exception routes it through the queue's retry policy.</p>
 *
 * <p>Deliveries are at-least-once and may be redelivered out of order, so
 * handlers must be idempotent.</p>
 *
 * @param <P> validated payload type
 */
@FunctionalInterface
public interface ConsumerHandler<P> {

    void handle(ConsumedMessage<P> message) throws Exception;
}
