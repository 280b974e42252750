package com.intteq.amqp.contract.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.intteq.amqp.contract.compression.CompressionAlgorithm;
import com.intteq.amqp.contract.compression.MessageCodec;
import com.intteq.amqp.contract.exception.AmqpContractException;
import com.intteq.amqp.contract.exception.MessageValidationException;
import com.intteq.amqp.contract.exception.TechnicalException;
import com.intteq.amqp.contract.rabbitmq.ConnectionLease;
import com.intteq.amqp.contract.rabbitmq.RabbitTopologyEngine;
import com.intteq.amqp.contract.schema.SchemaValidationResult;
import com.intteq.amqp.contract.topology.ContractDefinition;
import com.intteq.amqp.contract.topology.ExchangeType;
import com.intteq.amqp.contract.topology.MessageDefinition;
import com.intteq.amqp.contract.topology.PublisherDefinition;
import com.intteq.amqp.contract.topology.RoutingKeys;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageDeliveryMode;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.connection.CorrelationData;
import org.springframework.amqp.rabbit.core.RabbitTemplate;

import java.util.Date;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;

/**
 * Publishes messages through the publishers declared in a {@link ContractDefinition}.
 *
 * <p><b>Publish pipeline:</b></p>
 * <ol>
 *     <li>look up the publisher by name</li>
 *     <li>validate the payload, and the headers when the message declares a header schema</li>
 *     <li>resolve the routing key</li>
 *     <li>serialize to JSON and optionally compress</li>
 *     <li>send to the publisher's exchange, awaiting the broker confirm when enabled</li>
 * </ol>
 *
 * <p>{@link #publish} never throws. Failures complete the returned future
 * exceptionally with a {@link MessageValidationException} (nothing was sent) or a
 * {@link TechnicalException} (unknown publisher, closed client, broker failure).</p>
 *
 * <p>Thread-safe. Closing the client releases its connection lease.</p>
 */
@Slf4j
public class ContractClient implements AutoCloseable {

    private final ContractDefinition contract;
    private final ObjectMapper objectMapper;
    private final ClientOptions options;

    @Nullable
    private final ConnectionLease lease;

    @Nullable
    private final MeterRegistry meterRegistry;

    private volatile RabbitTemplate template;

    ContractClient(ContractDefinition contract,
                   RabbitTemplate template,
                   @Nullable ConnectionLease lease,
                   ObjectMapper objectMapper,
                   @Nullable MeterRegistry meterRegistry,
                   ClientOptions options) {
        this.contract = Objects.requireNonNull(contract, "contract must not be null");
        this.template = Objects.requireNonNull(template, "template must not be null");
        this.lease = lease;
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.meterRegistry = meterRegistry;
        this.options = Objects.requireNonNull(options, "options must not be null");
    }

    // =====================================================================
    // CREATION
    // =====================================================================

    public static ContractClient create(ContractDefinition contract, ConnectionLease lease) {
        return create(contract, lease, new ObjectMapper().findAndRegisterModules(), null, ClientOptions.defaults());
    }

    /**
     * Asserts the contract's topology and returns a ready client that owns {@code lease}.
     *
     * @throws TechnicalException if the topology cannot be asserted; the lease is released
     */
    public static ContractClient create(ContractDefinition contract,
                                        ConnectionLease lease,
                                        ObjectMapper objectMapper,
                                        @Nullable MeterRegistry meterRegistry,
                                        ClientOptions options) {
        try {
            ConnectionFactory connectionFactory = lease.connectionFactory();
            RabbitTopologyEngine.forConnectionFactory(connectionFactory).assertTopology(contract);

            RabbitTemplate template = createTemplate(connectionFactory);
            log.info("Contract client ready → publishers={}", contract.getPublishers().keySet());
            return new ContractClient(contract, template, lease, objectMapper, meterRegistry,
                    effectiveOptions(connectionFactory, options));
        } catch (RuntimeException e) {
            lease.close();
            throw e;
        }
    }

    /**
     * Publisher confirms need a factory with correlated confirms enabled; without them no
     * confirm ever arrives, so the client sends unconfirmed instead.
     */
    static ClientOptions effectiveOptions(ConnectionFactory connectionFactory, ClientOptions options) {
        if (!options.isPublisherConfirms() || connectionFactory.isPublisherConfirms()) {
            return options;
        }
        log.warn("Connection factory has publisher confirms disabled → publishing without confirms "
                + "(enable publisher-confirm-type=correlated to get broker confirms)");
        return options.toBuilder().publisherConfirms(false).build();
    }

    static RabbitTemplate createTemplate(ConnectionFactory connectionFactory) {
        RabbitTemplate template = new RabbitTemplate(connectionFactory);
        template.setMandatory(true);

        template.setConfirmCallback((CorrelationData cd, boolean ack, String cause) -> {
            if (ack) {
                log.debug("Publish confirmed: correlationId={}", cd != null ? cd.getId() : null);
            } else {
                log.error("Publish failed: correlationId={} cause={}",
                        cd != null ? cd.getId() : null, cause);
            }
        });

        template.setReturnsCallback(returned ->
                log.error("Returned message: exchange={} routingKey={} replyCode={} replyText={}",
                        returned.getExchange(),
                        returned.getRoutingKey(),
                        returned.getReplyCode(),
                        returned.getReplyText())
        );

        return template;
    }

    // =====================================================================
    // PUBLISH
    // =====================================================================

    public CompletableFuture<Void> publish(String publisherName, Object payload) {
        return publish(publisherName, payload, PublishOptions.none());
    }

    public CompletableFuture<Void> publish(String publisherName, Object payload, Map<String, Object> headers) {
        return publish(publisherName, payload, headers != null ? PublishOptions.headers(headers) : PublishOptions.none());
    }

    public CompletableFuture<Void> publish(String publisherName, Object payload, PublishOptions publishOptions) {
        try {
            return doPublish(publisherName, payload,
                    publishOptions != null ? publishOptions : PublishOptions.none());
        } catch (AmqpContractException e) {
            return fail(publisherName, e);
        } catch (RuntimeException e) {
            return fail(publisherName, new TechnicalException(
                    "Unexpected failure publishing \"" + publisherName + "\"", e));
        }
    }

    private CompletableFuture<Void> doPublish(String publisherName, Object payload, PublishOptions publishOptions) {
        PublisherDefinition publisher = contract.getPublishers().get(publisherName);
        if (publisher == null) {
            return fail(publisherName, new TechnicalException(
                    "Publisher \"" + publisherName + "\" not found in contract. Available publishers: "
                            + String.join(", ", contract.getPublishers().keySet())));
        }

        MessageDefinition definition = publisher.getMessage();

        SchemaValidationResult<?> payloadResult = definition.getPayload().validate(payload);
        if (!payloadResult.isValid()) {
            recordPublish(publisherName, "invalid");
            log.warn("Publish rejected by payload schema → publisher={} issues={}",
                    publisherName, payloadResult.issues());
            return CompletableFuture.failedFuture(
                    new MessageValidationException(publisherName, payloadResult.issues()));
        }

        Map<String, Object> headers = publishOptions.getHeaders();
        if (definition.hasHeaderSchema()) {
            SchemaValidationResult<?> headerResult = definition.getHeaders().validate(headers);
            if (!headerResult.isValid()) {
                recordPublish(publisherName, "invalid");
                log.warn("Publish rejected by header schema → publisher={} issues={}",
                        publisherName, headerResult.issues());
                return CompletableFuture.failedFuture(
                        new MessageValidationException(publisherName, headerResult.issues()));
            }
        }

        String routingKey = resolveRoutingKey(publisherName, publisher, publishOptions.getRoutingKey());

        RabbitTemplate current = template;
        if (current == null) {
            return fail(publisherName, new TechnicalException(
                    "Client is closed; cannot publish \"" + publisherName + "\""));
        }

        CompressionAlgorithm compression = publishOptions.getCompression() != null
                ? publishOptions.getCompression()
                : options.getDefaultCompression();
        Message message = toMessage(serialize(publisherName, payloadResult.value()), compression, publishOptions);
        String exchange = publisher.getExchange().getName();

        if (!options.isPublisherConfirms()) {
            try {
                current.send(exchange, routingKey, message);
            } catch (AmqpException e) {
                return fail(publisherName, new TechnicalException(
                        "Failed to publish \"" + publisherName + "\" to exchange \"" + exchange + "\"", e));
            }
            recordPublish(publisherName, "success");
            log.debug("Published → publisher={} exchange={} routingKey={}", publisherName, exchange, routingKey);
            return CompletableFuture.completedFuture(null);
        }

        CorrelationData correlation = new CorrelationData(message.getMessageProperties().getMessageId());
        try {
            current.send(exchange, routingKey, message, correlation);
        } catch (AmqpException e) {
            return fail(publisherName, new TechnicalException(
                    "Failed to publish \"" + publisherName + "\" to exchange \"" + exchange + "\"", e));
        }

        return correlation.getFuture()
                .orTimeout(options.getConfirmTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .handle((confirm, error) -> {
                    TechnicalException failure = null;
                    if (error != null) {
                        failure = new TechnicalException(
                                "No publisher confirm for \"" + publisherName + "\" within "
                                        + options.getConfirmTimeout().toMillis() + " ms", error);
                    } else if (!confirm.isAck()) {
                        failure = new TechnicalException(
                                "Broker rejected \"" + publisherName + "\": " + confirm.getReason());
                    } else if (correlation.getReturned() != null) {
                        failure = new TechnicalException(
                                "Message for \"" + publisherName + "\" was unroutable: exchange=" + exchange
                                        + " routingKey=" + routingKey
                                        + " replyText=" + correlation.getReturned().getReplyText());
                    }
                    if (failure != null) {
                        recordPublish(publisherName, "failure");
                        log.error("Publish failed → publisher={}", publisherName, failure);
                        throw new CompletionException(failure);
                    }
                    recordPublish(publisherName, "success");
                    log.debug("Published → publisher={} exchange={} routingKey={}", publisherName, exchange, routingKey);
                    return null;
                });
    }

    // =====================================================================
    // MESSAGE ASSEMBLY
    // =====================================================================

    static String resolveRoutingKey(String publisherName, PublisherDefinition publisher, @Nullable String requested) {
        String declared = publisher.getRoutingKey();

        if (requested == null) {
            if (publisher.isRoutingKeyPattern()) {
                throw new TechnicalException("Publisher \"" + publisherName + "\" declares routing key pattern \""
                        + declared + "\"; a concrete routing key must be supplied");
            }
            return declared;
        }
        if (RoutingKeys.containsWildcards(requested)) {
            throw new TechnicalException("Routing key \"" + requested + "\" for publisher \""
                    + publisherName + "\" must not contain wildcards");
        }
        if (publisher.getExchange().getType() != ExchangeType.FANOUT && !RoutingKeys.matches(declared, requested)) {
            throw new TechnicalException("Routing key \"" + requested + "\" does not match \""
                    + declared + "\" declared by publisher \"" + publisherName + "\"");
        }
        return requested;
    }

    private byte[] serialize(String publisherName, Object value) {
        try {
            return objectMapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new TechnicalException("Failed to serialize payload of \"" + publisherName + "\" to JSON", e);
        }
    }

    private static Message toMessage(byte[] json, @Nullable CompressionAlgorithm compression, PublishOptions publishOptions) {
        MessageProperties properties = new MessageProperties();
        properties.setContentType(MessageProperties.CONTENT_TYPE_JSON);
        properties.setDeliveryMode(publishOptions.isPersistent()
                ? MessageDeliveryMode.PERSISTENT
                : MessageDeliveryMode.NON_PERSISTENT);
        properties.setMessageId(publishOptions.getMessageId() != null
                ? publishOptions.getMessageId()
                : UUID.randomUUID().toString());
        properties.setTimestamp(new Date());

        if (publishOptions.getPriority() != null) {
            properties.setPriority(publishOptions.getPriority());
        }
        if (publishOptions.getCorrelationId() != null) {
            properties.setCorrelationId(publishOptions.getCorrelationId());
        }
        if (publishOptions.getReplyTo() != null) {
            properties.setReplyTo(publishOptions.getReplyTo());
        }
        if (publishOptions.getExpiration() != null) {
            properties.setExpiration(String.valueOf(publishOptions.getExpiration().toMillis()));
        }
        publishOptions.getHeaders().forEach(properties::setHeader);

        byte[] body = json;
        if (compression != null) {
            body = MessageCodec.compress(json, compression);
            properties.setContentEncoding(compression.encoding());
        }
        return new Message(body, properties);
    }

    // =====================================================================
    // METRICS & FAILURES
    // =====================================================================

    private CompletableFuture<Void> fail(String publisherName, AmqpContractException error) {
        recordPublish(publisherName, "failure");
        log.error("Failed to publish message publisher={}", publisherName, error);
        return CompletableFuture.failedFuture(error);
    }

    private void recordPublish(String publisherName, String result) {
        if (meterRegistry == null) return;

        meterRegistry.counter(
                        "amqp.contract.publish",
                        "publisher", publisherName,
                        "result", result
                )
                .increment();
    }

    // =====================================================================
    // SHUTDOWN
    // =====================================================================

    public boolean isClosed() {
        return template == null;
    }

    @Override
    public void close() {
        RabbitTemplate current = template;
        template = null;
        if (current == null) {
            return;
        }
        try {
            current.destroy();
        } finally {
            if (lease != null) {
                lease.close();
            }
        }
        log.info("Contract client closed");
    }
}
