package com.intteq.amqp.contract.worker;

import java.util.List;

/**
 * Application callback receiving up to {@code batchSize} validated messages of one consumer.
 *
 * <p>Returning normally acknowledges every message of the batch. Throwing
 * {@link com.intteq.amqp.contract.exception.NonRetryableException} dead-letters all of
 * them; any other exception sends each message through the queue's retry policy on its
 * own, according to its own retry count.</p>
 *
 * @param <P> validated payload type
 */
@FunctionalInterface
public interface BatchConsumerHandler<P> {

    void handle(List<ConsumedMessage<P>> messages) throws Exception;
}
