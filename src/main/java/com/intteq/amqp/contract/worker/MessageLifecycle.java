package com.intteq.amqp.contract.worker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.intteq.amqp.contract.exception.NonRetryableException;
import com.intteq.amqp.contract.topology.ConsumerDefinition;
import com.rabbitmq.client.Channel;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.rabbit.listener.api.ChannelAwareMessageListener;

import java.io.IOException;
import java.util.Objects;

/**
 * Drives one delivery of one consumer from receipt to settlement.
 *
 * <p><b>Settlement rules:</b></p>
 * <ul>
 *     <li>undecodable body (unknown content-encoding, corrupt data, invalid JSON) → dead-letter</li>
 *     <li>payload or header schema failure → dead-letter</li>
 *     <li>handler success → ack</li>
 *     <li>{@link NonRetryableException} → dead-letter</li>
 *     <li>any other handler exception → retry decision:
 *         <ul>
 *             <li>queue without retry policy → nack with requeue</li>
 *             <li>retry budget left → copy to the wait queue with an incremented
 *                 {@code x-retry-count} and a TTL of the backoff delay, then ack</li>
 *             <li>budget exhausted → dead-letter</li>
 *         </ul>
 *     </li>
 * </ul>
 *
 * <p>Dead-lettering is a nack without requeue; the broker forwards the message to the
 * queue's dead-letter exchange with the queue's dead-letter routing key. When the queue
 * has no dead-letter key and the delivery came in through the retry loop, the worker
 * publishes the message to the dead-letter exchange under its original routing key
 * instead, then acks.</p>
 */
@Slf4j
public class MessageLifecycle implements ChannelAwareMessageListener {

    private final ConsumerHandler<Object> handler;
    private final DeliverySettler settler;

    public MessageLifecycle(String consumerName,
                            ConsumerDefinition consumer,
                            ConsumerHandler<Object> handler,
                            ObjectMapper objectMapper,
                            @Nullable MeterRegistry meterRegistry) {
        this.handler = Objects.requireNonNull(handler, "handler must not be null");
        this.settler = new DeliverySettler(consumerName, consumer, objectMapper, meterRegistry);
    }

    public String getConsumerName() {
        return settler.consumerName();
    }

    @Override
    public void onMessage(Message message, Channel channel) throws Exception {
        process(message, channel);
    }

    /**
     * Processes and settles one delivery.
     *
     * @return the terminal state reached
     * @throws IOException if the channel fails while settling
     */
    public DeliveryState process(Message message, Channel channel) throws IOException {
        DeliverySettler.Decoded decoded = settler.decode(message);
        if (decoded.isRejected()) {
            return settler.deadLetter(message, channel, decoded.rejectReason());
        }

        long start = System.nanoTime();
        try {
            handler.handle(decoded.message());
        } catch (Exception e) {
            settler.recordLatency(start);
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            return settler.fail(message, channel, e);
        }
        settler.recordLatency(start);

        DeliveryState state = settler.ack(message, channel);
        log.debug("Message consumed → consumer={} queue={}", settler.consumerName(), settler.queueName());
        return state;
    }
}
