package com.intteq.amqp.contract.worker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.intteq.amqp.contract.compression.MessageCodec;
import com.intteq.amqp.contract.exception.MessageValidationException;
import com.intteq.amqp.contract.exception.NonRetryableException;
import com.intteq.amqp.contract.exception.TechnicalException;
import com.intteq.amqp.contract.retry.RetryDecision;
import com.intteq.amqp.contract.retry.RetryDecisionEngine;
import com.intteq.amqp.contract.retry.RetryHeaders;
import com.intteq.amqp.contract.schema.SchemaValidationResult;
import com.intteq.amqp.contract.topology.ConsumerDefinition;
import com.intteq.amqp.contract.topology.MessageDefinition;
import com.intteq.amqp.contract.topology.QueueDefinition;
import com.intteq.amqp.contract.topology.RetryPolicy;
import com.intteq.amqp.contract.topology.TtlBackoffInfrastructure;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Return;
import com.rabbitmq.client.ReturnListener;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageDeliveryMode;
import org.springframework.amqp.core.MessageProperties;

import java.io.IOException;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Decoding and settlement of deliveries for one consumer, shared by single-message
 * and batch consumption.
 *
 * <p>Copies published by the worker (retry copies, explicit dead-letters) are sent
 * mandatory and awaited with publisher confirms before the original is acknowledged.
 * A copy that is nacked, returned as unroutable or not confirmed in time leaves the
 * original requeued instead.</p>
 */
@Slf4j
final class DeliverySettler {

    static final Duration PUBLISH_CONFIRM_TIMEOUT = Duration.ofSeconds(5);

    private final String consumerName;
    private final ConsumerDefinition consumer;
    private final ObjectMapper objectMapper;

    @Nullable
    private final MeterRegistry meterRegistry;

    DeliverySettler(String consumerName,
                    ConsumerDefinition consumer,
                    ObjectMapper objectMapper,
                    @Nullable MeterRegistry meterRegistry) {
        this.consumerName = Objects.requireNonNull(consumerName, "consumerName must not be null");
        this.consumer = Objects.requireNonNull(consumer, "consumer must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.meterRegistry = meterRegistry;
    }

    String consumerName() {
        return consumerName;
    }

    String queueName() {
        return consumer.getQueue().getName();
    }

    // =====================================================================
    // DECODE & VALIDATE
    // =====================================================================

    /**
     * Decompresses, parses and validates one delivery without settling it.
     */
    Decoded decode(Message message) {
        MessageProperties properties = message.getMessageProperties();
        long tag = properties.getDeliveryTag();
        String queue = queueName();
        MessageDefinition definition = consumer.getMessage();
        trace(tag, DeliveryState.RECEIVED);

        byte[] body;
        try {
            body = MessageCodec.decompress(message.getBody(), properties.getContentEncoding());
        } catch (TechnicalException e) {
            log.error("Failed to decompress message → dead-lettering (consumer={} queue={} contentEncoding={})",
                    consumerName, queue, properties.getContentEncoding(), e);
            return Decoded.rejected("decode_failure");
        }
        trace(tag, DeliveryState.DECOMPRESSED);

        Object tree;
        try {
            tree = objectMapper.readValue(body, Object.class);
        } catch (IOException e) {
            log.error("Failed to parse message body as JSON → dead-lettering (consumer={} queue={})",
                    consumerName, queue, e);
            return Decoded.rejected("invalid_json");
        }

        SchemaValidationResult<?> payload = definition.getPayload().validate(tree);
        if (!payload.isValid()) {
            MessageValidationException error = new MessageValidationException(consumerName, payload.issues());
            log.error("Payload validation failed → dead-lettering (consumer={} queue={}): {}",
                    consumerName, queue, error.getMessage());
            return Decoded.rejected("invalid_payload");
        }

        Object headers = null;
        if (definition.hasHeaderSchema()) {
            SchemaValidationResult<?> headerResult = definition.getHeaders().validate(properties.getHeaders());
            if (!headerResult.isValid()) {
                MessageValidationException error = new MessageValidationException(consumerName, headerResult.issues());
                log.error("Header validation failed → dead-lettering (consumer={} queue={}): {}",
                        consumerName, queue, error.getMessage());
                return Decoded.rejected("invalid_headers");
            }
            headers = headerResult.value();
        }
        trace(tag, DeliveryState.VALIDATED);

        return Decoded.of(new ConsumedMessage<>(consumerName, payload.value(), headers, message));
    }

    // =====================================================================
    // SETTLEMENT
    // =====================================================================

    DeliveryState ack(Message message, Channel channel) throws IOException {
        long tag = message.getMessageProperties().getDeliveryTag();
        trace(tag, DeliveryState.HANDLED);
        channel.basicAck(tag, false);
        record(DeliveryState.ACKED, "success");
        return DeliveryState.ACKED;
    }

    /**
     * Settles a delivery whose handler threw {@code error}.
     */
    DeliveryState fail(Message message, Channel channel, Exception error) throws IOException {
        if (error instanceof NonRetryableException) {
            log.error("Handler rejected message as non-retryable → dead-lettering (consumer={} queue={})",
                    consumerName, queueName(), error);
            return deadLetter(message, channel, "non_retryable");
        }
        return retry(message, channel, error);
    }

    /**
     * Rejects a delivery to the queue's dead-letter exchange.
     *
     * <p>Normally a nack without requeue. When the queue dead-letters without a routing
     * key and the message arrived through the retry binding, a nack would route it back
     * into the queue; the message is then published to the dead-letter exchange with its
     * original routing key and acknowledged.</p>
     */
    DeliveryState deadLetter(Message message, Channel channel, String reason) throws IOException {
        MessageProperties source = message.getMessageProperties();
        long tag = source.getDeliveryTag();
        QueueDefinition queue = consumer.getQueue();
        String receivedKey = source.getReceivedRoutingKey();

        if (TtlBackoffInfrastructure.reentersRetryLoop(queue, receivedKey)) {
            String originalKey = RetryHeaders.originalRoutingKey(source.getHeaders());

            if (originalKey != null && !TtlBackoffInfrastructure.reentersRetryLoop(queue, originalKey)) {
                AMQP.BasicProperties properties = copyProperties(source, copyHeaders(source), null);
                boolean published = publishCopy(channel,
                        queue.getDeadLetter().getExchange().getName(), originalKey, properties, message.getBody());
                if (!published) {
                    return requeue(channel, tag, "dead_letter_failed");
                }
                channel.basicAck(tag, false);
                record(DeliveryState.DEAD_LETTERED, reason);
                return DeliveryState.DEAD_LETTERED;
            }

            log.error("Message with routing key \"{}\" has no original routing key to dead-letter with; "
                            + "it may be routed back into queue \"{}\" (consumer={})",
                    receivedKey, queue.getName(), consumerName);
        }

        channel.basicNack(tag, false, false);
        record(DeliveryState.DEAD_LETTERED, reason);
        return DeliveryState.DEAD_LETTERED;
    }

    // =====================================================================
    // RETRY
    // =====================================================================

    private DeliveryState retry(Message message, Channel channel, Exception error) throws IOException {
        long tag = message.getMessageProperties().getDeliveryTag();
        QueueDefinition queue = consumer.getQueue();
        RetryPolicy policy = queue.getRetry();

        if (policy == null) {
            log.warn("Handler failed, queue has no retry policy → requeue (consumer={} queue={})",
                    consumerName, queue.getName(), error);
            return requeue(channel, tag, "legacy_requeue");
        }

        int retryCount = RetryHeaders.retryCount(message.getMessageProperties());
        RetryDecision decision = RetryDecisionEngine.decide(retryCount, policy);

        if (!decision.shouldRetry()) {
            log.error("Max retries exceeded → dead-lettering (consumer={} queue={} retryCount={} maxRetries={})",
                    consumerName, queue.getName(), decision.currentRetryCount(), policy.getMaxRetries(), error);
            return deadLetter(message, channel, "max_retries");
        }

        if (!TtlBackoffInfrastructure.usesWaitQueue(queue)) {
            log.warn("Handler failed, queue \"{}\" has no dead letter exchange for retries → requeue (consumer={})",
                    queue.getName(), consumerName, error);
            return requeue(channel, tag, "no_wait_queue");
        }

        log.warn("Handler failed → retrying via wait queue (consumer={} queue={} retryCount={} delayMs={}): {}",
                consumerName, queue.getName(), retryCount, decision.delay().toMillis(), error.toString());

        MessageProperties source = message.getMessageProperties();
        Map<String, Object> headers = copyHeaders(source);
        headers.put(RetryHeaders.RETRY_COUNT, decision.currentRetryCount() + 1);
        headers.put(RetryHeaders.LAST_ERROR, describe(error));
        headers.putIfAbsent(RetryHeaders.FIRST_FAILURE_TIMESTAMP, System.currentTimeMillis());
        if (source.getReceivedRoutingKey() != null) {
            headers.putIfAbsent(RetryHeaders.ORIGINAL_ROUTING_KEY, source.getReceivedRoutingKey());
        }

        boolean published = publishCopy(channel,
                queue.getDeadLetter().getExchange().getName(),
                TtlBackoffInfrastructure.waitQueueName(queue.getName()),
                copyProperties(source, headers, String.valueOf(decision.delay().toMillis())),
                message.getBody());

        if (!published) {
            log.error("Failed to republish message for retry, falling back to requeue (consumer={} queue={} retryCount={})",
                    consumerName, queue.getName(), retryCount);
            return requeue(channel, tag, "republish_failed");
        }

        channel.basicAck(tag, false);
        record(DeliveryState.RETRIED_VIA_WAIT_QUEUE, "retry");
        return DeliveryState.RETRIED_VIA_WAIT_QUEUE;
    }

    private DeliveryState requeue(Channel channel, long tag, String reason) throws IOException {
        channel.basicNack(tag, false, true);
        record(DeliveryState.REQUEUED, reason);
        return DeliveryState.REQUEUED;
    }

    // =====================================================================
    // CONFIRMED PUBLISH
    // =====================================================================

    /**
     * @return whether the broker confirmed and routed the copy
     */
    private boolean publishCopy(Channel channel,
                                String exchange,
                                String routingKey,
                                AMQP.BasicProperties properties,
                                byte[] body) {
        try {
            publishConfirmed(channel, exchange, routingKey, properties, body);
            return true;
        } catch (IOException | TimeoutException | RuntimeException e) {
            log.error("Failed to publish message copy (consumer={} exchange={} routingKey={})",
                    consumerName, exchange, routingKey, e);
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted while awaiting publish confirm (consumer={} exchange={} routingKey={})",
                    consumerName, exchange, routingKey, e);
            return false;
        }
    }

    private static void publishConfirmed(Channel channel,
                                         String exchange,
                                         String routingKey,
                                         AMQP.BasicProperties properties,
                                         byte[] body) throws IOException, InterruptedException, TimeoutException {
        if (channel.getNextPublishSeqNo() == 0) {
            channel.confirmSelect();
        }

        AtomicReference<Return> returned = new AtomicReference<>();
        ReturnListener listener = channel.addReturnListener((Return r) -> {
            if (exchange.equals(r.getExchange()) && routingKey.equals(r.getRoutingKey())) {
                returned.set(r);
            }
        });
        try {
            channel.basicPublish(exchange, routingKey, true, properties, body);
            if (!channel.waitForConfirms(PUBLISH_CONFIRM_TIMEOUT.toMillis())) {
                throw new IOException("Broker rejected message for exchange \"" + exchange
                        + "\" with routing key \"" + routingKey + "\"");
            }
        } finally {
            channel.removeReturnListener(listener);
        }

        if (returned.get() != null) {
            throw new IOException("Message for exchange \"" + exchange + "\" with routing key \"" + routingKey
                    + "\" was unroutable: " + returned.get().getReplyText());
        }
    }

    private static Map<String, Object> copyHeaders(MessageProperties source) {
        Map<String, Object> headers = new HashMap<>();
        source.getHeaders().forEach((k, v) -> {
            if (v != null) {
                headers.put(k, v);
            }
        });
        return headers;
    }

    private static AMQP.BasicProperties copyProperties(MessageProperties source,
                                                       Map<String, Object> headers,
                                                       @Nullable String expiration) {
        return new AMQP.BasicProperties.Builder()
                .contentType(source.getContentType())
                .contentEncoding(source.getContentEncoding())
                .headers(headers)
                .deliveryMode(deliveryMode(source))
                .priority(source.getPriority())
                .correlationId(source.getCorrelationId())
                .replyTo(source.getReplyTo())
                .expiration(expiration)
                .messageId(source.getMessageId())
                .timestamp(source.getTimestamp())
                .type(source.getType())
                .appId(source.getAppId())
                .build();
    }

    private static int deliveryMode(MessageProperties source) {
        MessageDeliveryMode mode = source.getReceivedDeliveryMode() != null
                ? source.getReceivedDeliveryMode()
                : source.getDeliveryMode();
        return MessageDeliveryMode.toInt(mode != null ? mode : MessageDeliveryMode.PERSISTENT);
    }

    private static String describe(Exception error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getName();
    }

    // =====================================================================
    // METRICS
    // =====================================================================

    void trace(long tag, DeliveryState state) {
        log.trace("Delivery {} → {} (consumer={})", tag, state, consumerName);
    }

    void record(DeliveryState outcome, String reason) {
        if (meterRegistry == null) return;

        meterRegistry.counter(
                        "amqp.contract.consume",
                        "consumer", consumerName,
                        "queue", queueName(),
                        "outcome", outcome.name().toLowerCase(),
                        "reason", reason
                )
                .increment();
    }

    void recordLatency(long startNanos) {
        if (meterRegistry == null) return;

        meterRegistry.timer(
                        "amqp.contract.consume.latency",
                        "consumer", consumerName,
                        "queue", queueName()
                )
                .record(System.nanoTime() - startNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Outcome of {@link #decode}: a validated message, or the reason it must be dead-lettered.
     */
    static final class Decoded {

        @Nullable
        private final ConsumedMessage<Object> message;

        @Nullable
        private final String rejectReason;

        private Decoded(@Nullable ConsumedMessage<Object> message, @Nullable String rejectReason) {
            this.message = message;
            this.rejectReason = rejectReason;
        }

        static Decoded of(ConsumedMessage<Object> message) {
            return new Decoded(message, null);
        }

        static Decoded rejected(String reason) {
            return new Decoded(null, reason);
        }

        boolean isRejected() {
            return rejectReason != null;
        }

        ConsumedMessage<Object> message() {
            return message;
        }

        String rejectReason() {
            return rejectReason;
        }
    }
}
