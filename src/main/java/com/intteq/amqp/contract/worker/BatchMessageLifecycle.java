package com.intteq.amqp.contract.worker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.intteq.amqp.contract.topology.ConsumerDefinition;
import com.rabbitmq.client.Channel;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpIOException;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.rabbit.listener.api.ChannelAwareBatchMessageListener;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Drives a batch of deliveries of one consumer through a {@link BatchConsumerHandler}.
 *
 * <p>Each message is decoded and validated on its own; invalid ones are dead-lettered
 * and left out of the batch. The remaining messages go to the handler together:</p>
 * <ul>
 *     <li>success → every message is acked</li>
 *     <li>{@link com.intteq.amqp.contract.exception.NonRetryableException} → every message is dead-lettered</li>
 *     <li>any other exception → each message follows the retry decision of its own retry count</li>
 * </ul>
 */
@Slf4j
public class BatchMessageLifecycle implements ChannelAwareBatchMessageListener {

    private final BatchConsumerHandler<Object> handler;
    private final DeliverySettler settler;

    public BatchMessageLifecycle(String consumerName,
                                 ConsumerDefinition consumer,
                                 BatchConsumerHandler<Object> handler,
                                 ObjectMapper objectMapper,
                                 @Nullable MeterRegistry meterRegistry) {
        this.handler = Objects.requireNonNull(handler, "handler must not be null");
        this.settler = new DeliverySettler(consumerName, consumer, objectMapper, meterRegistry);
    }

    public String getConsumerName() {
        return settler.consumerName();
    }

    @Override
    public void onMessageBatch(List<Message> messages, Channel channel) {
        try {
            process(messages, channel);
        } catch (IOException e) {
            throw new AmqpIOException(e);
        }
    }

    /**
     * Processes and settles a batch.
     *
     * @return the terminal state of each message, in delivery order
     * @throws IOException if the channel fails while settling
     */
    public List<DeliveryState> process(List<Message> messages, Channel channel) throws IOException {
        DeliveryState[] states = new DeliveryState[messages.size()];
        List<Integer> accepted = new ArrayList<>();
        List<ConsumedMessage<Object>> batch = new ArrayList<>();

        for (int i = 0; i < messages.size(); i++) {
            DeliverySettler.Decoded decoded = settler.decode(messages.get(i));
            if (decoded.isRejected()) {
                states[i] = settler.deadLetter(messages.get(i), channel, decoded.rejectReason());
            } else {
                accepted.add(i);
                batch.add(decoded.message());
            }
        }

        if (batch.isEmpty()) {
            return List.of(states);
        }

        log.debug("Processing batch → consumer={} queue={} size={}",
                settler.consumerName(), settler.queueName(), batch.size());

        long start = System.nanoTime();
        try {
            handler.handle(Collections.unmodifiableList(batch));
        } catch (Exception e) {
            settler.recordLatency(start);
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            log.error("Batch handler failed (consumer={} queue={} size={})",
                    settler.consumerName(), settler.queueName(), batch.size(), e);
            for (int i : accepted) {
                states[i] = settler.fail(messages.get(i), channel, e);
            }
            return List.of(states);
        }
        settler.recordLatency(start);

        for (int i : accepted) {
            states[i] = settler.ack(messages.get(i), channel);
        }
        log.debug("Batch consumed → consumer={} queue={} size={}",
                settler.consumerName(), settler.queueName(), batch.size());
        return List.of(states);
    }
}
