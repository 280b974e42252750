package com.intteq.amqp.contract.worker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.intteq.amqp.contract.engine.TopologyEngine;
import com.intteq.amqp.contract.exception.ContractConfigurationException;
import com.intteq.amqp.contract.exception.ContractConfigurationException.Code;
import com.intteq.amqp.contract.exception.TechnicalException;
import com.intteq.amqp.contract.rabbitmq.ConnectionLease;
import com.intteq.amqp.contract.rabbitmq.RabbitTopologyEngine;
import com.intteq.amqp.contract.topology.ConsumerDefinition;
import com.intteq.amqp.contract.topology.ContractDefinition;
import com.intteq.amqp.contract.topology.ContractValidator;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.core.AcknowledgeMode;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.listener.SimpleMessageListenerContainer;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Consumes every consumer of a {@link ContractDefinition} with its registered handler.
 *
 * <p><b>Start-up:</b></p>
 * <ol>
 *     <li>every contract consumer must have exactly one handler, and every handler
 *         must name a contract consumer</li>
 *     <li>the contract's topology is asserted</li>
 *     <li>one listener container per consumer is started with MANUAL acknowledgment,
 *         the effective prefetch and the requested concurrency</li>
 * </ol>
 *
 * <p>Each delivery is processed by a {@link MessageLifecycle}. Consumers registered with
 * {@link Builder#batchHandler} receive up to {@code batchSize} messages at once through a
 * {@link BatchMessageLifecycle}; a partial batch is handed over once no further message
 * arrives within {@code batchTimeout}.</p>
 *
 * <p><b>Shutdown:</b> {@link #close()} cancels every consumer, waits up to the shutdown
 * timeout for in-flight handlers, closes the channels, then releases the connection lease.</p>
 *
 * <pre>
 * ContractWorker worker = ContractWorker.builder()
 *         .contract(contract)
 *         .connection(registry.acquire(urls))
 *         .handler("processOrder", (ConsumedMessage&lt;OrderCreated&gt; m) -&gt; orders.process(m.payload()))
 *         .build()
 *         .start();
 * </pre>
 */
@Slf4j
public class ContractWorker implements AutoCloseable {

    private final ContractDefinition contract;
    private final ConnectionLease lease;
    private final Map<String, Registration> handlers;
    private final ObjectMapper objectMapper;
    private final WorkerOptions options;

    @Nullable
    private final MeterRegistry meterRegistry;

    @Nullable
    private final TopologyEngine topologyEngine;

    /** Active listener containers keyed by consumer name. */
    private final Map<String, SimpleMessageListenerContainer> containers = new LinkedHashMap<>();

    private boolean started;
    private boolean closed;

    private ContractWorker(Builder builder) {
        this.contract = Objects.requireNonNull(builder.contract, "contract must not be null");
        this.lease = Objects.requireNonNull(builder.lease, "connection lease must not be null");
        this.handlers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.handlers));
        this.objectMapper = builder.objectMapper != null ? builder.objectMapper : new ObjectMapper().findAndRegisterModules();
        this.options = builder.options != null ? builder.options : WorkerOptions.defaults();
        this.meterRegistry = builder.meterRegistry;
        this.topologyEngine = builder.topologyEngine;
    }

    public static Builder builder() {
        return new Builder();
    }

    // =====================================================================
    // START
    // =====================================================================

    /**
     * Validates handlers, asserts topology and starts consuming. On failure the worker
     * is closed and its connection lease released.
     *
     * @return this worker
     * @throws ContractConfigurationException if handlers do not match consumers or options are invalid
     * @throws TechnicalException             if topology assertion or consumer start-up fails
     */
    public synchronized ContractWorker start() {
        if (closed) {
            throw new TechnicalException("Worker has been closed");
        }
        if (started) {
            return this;
        }

        try {
            ContractValidator.assertHandlersMatchConsumers(contract, handlers.keySet());
            handlers.forEach(this::validateOptions);

            ConnectionFactory connectionFactory = lease.connectionFactory();
            TopologyEngine engine = topologyEngine != null
                    ? topologyEngine
                    : RabbitTopologyEngine.forConnectionFactory(connectionFactory);
            engine.assertTopology(contract);

            log.info("Initializing contract consumers → {}", handlers.keySet());
            for (Map.Entry<String, Registration> entry : handlers.entrySet()) {
                String name = entry.getKey();
                try {
                    containers.put(name, createAndStartContainer(connectionFactory, name, entry.getValue()));
                } catch (RuntimeException e) {
                    throw new TechnicalException("Failed to start consuming for \"" + name + "\"", e);
                }
            }
        } catch (RuntimeException e) {
            log.error("Contract worker failed to start → releasing connection", e);
            closed = true;
            stopContainers();
            lease.close();
            throw e;
        }

        started = true;
        return this;
    }

    private void validateOptions(String name, Registration registration) {
        ConsumerOptions consumerOptions = registration.options;
        if (consumerOptions.getPrefetch() != null && consumerOptions.getPrefetch() < 1) {
            throw new ContractConfigurationException(Code.INVALID_PREFETCH,
                    "Invalid prefetch value for \"" + name + "\": must be a positive integer, got "
                            + consumerOptions.getPrefetch(),
                    Map.of("consumer", name));
        }
        if (consumerOptions.getConcurrency() != null && consumerOptions.getConcurrency() < 1) {
            throw new ContractConfigurationException(Code.INVALID_CONCURRENCY,
                    "Invalid concurrency value for \"" + name + "\": must be a positive integer, got "
                            + consumerOptions.getConcurrency(),
                    Map.of("consumer", name));
        }
        if (consumerOptions.getBatchSize() != null && consumerOptions.getBatchSize() < 1) {
            throw new ContractConfigurationException(Code.INVALID_BATCH_SIZE,
                    "Invalid batchSize for \"" + name + "\": must be a positive integer, got "
                            + consumerOptions.getBatchSize(),
                    Map.of("consumer", name));
        }
        Duration batchTimeout = consumerOptions.getBatchTimeout();
        if (batchTimeout != null && (batchTimeout.isZero() || batchTimeout.isNegative())) {
            throw new ContractConfigurationException(Code.INVALID_BATCH_TIMEOUT,
                    "Invalid batchTimeout for \"" + name + "\": must be positive, got " + batchTimeout,
                    Map.of("consumer", name));
        }
        if (registration.isBatch() && !consumerOptions.isBatch()) {
            throw new ContractConfigurationException(Code.INVALID_BATCH_SIZE,
                    "Batch handler for \"" + name + "\" requires a batchSize",
                    Map.of("consumer", name));
        }
        if (!registration.isBatch() && (consumerOptions.isBatch() || batchTimeout != null)) {
            throw new ContractConfigurationException(Code.INVALID_BATCH_SIZE,
                    "batchSize and batchTimeout of \"" + name + "\" require a batch handler",
                    Map.of("consumer", name));
        }
    }

    /**
     * Handler options win over the batch size, then the consumer definition, then the worker default.
     */
    static int effectivePrefetch(ConsumerOptions consumerOptions, ConsumerDefinition consumer, int defaultPrefetch) {
        if (consumerOptions.getPrefetch() != null) {
            return consumerOptions.getPrefetch();
        }
        if (consumerOptions.isBatch()) {
            return consumerOptions.getBatchSize();
        }
        if (consumer.getPrefetch() != null) {
            return consumer.getPrefetch();
        }
        return defaultPrefetch;
    }

    private SimpleMessageListenerContainer createAndStartContainer(ConnectionFactory connectionFactory,
                                                                   String name,
                                                                   Registration registration) {
        ConsumerDefinition consumer = contract.getConsumers().get(name);
        String queueName = consumer.getQueue().getName();

        int prefetch = effectivePrefetch(registration.options, consumer, options.getDefaultPrefetch());
        int concurrency = registration.options.getConcurrency() != null ? registration.options.getConcurrency() : 1;

        SimpleMessageListenerContainer container = new SimpleMessageListenerContainer(connectionFactory);

        container.setQueueNames(queueName);
        container.setAcknowledgeMode(AcknowledgeMode.MANUAL);
        container.setPrefetchCount(prefetch);
        container.setConcurrentConsumers(concurrency);
        container.setMissingQueuesFatal(false);
        container.setRecoveryInterval(options.getRecoveryInterval().toMillis());
        container.setShutdownTimeout(options.getShutdownTimeout().toMillis());
        container.setDefaultRequeueRejected(false);

        if (registration.isBatch()) {
            container.setConsumerBatchEnabled(true);
            container.setBatchSize(registration.options.getBatchSize());
            container.setReceiveTimeout(registration.options.effectiveBatchTimeout().toMillis());
            container.setMessageListener(
                    new BatchMessageLifecycle(name, consumer, registration.batchHandler, objectMapper, meterRegistry));
        } else {
            container.setMessageListener(
                    new MessageLifecycle(name, consumer, registration.handler, objectMapper, meterRegistry));
        }

        container.afterPropertiesSet();
        container.start();

        if (registration.isBatch()) {
            log.info("RabbitMQ batch listener STARTED → consumer={} queue={} prefetch={} concurrency={} batchSize={} batchTimeoutMs={}",
                    name, queueName, prefetch, concurrency,
                    registration.options.getBatchSize(), registration.options.effectiveBatchTimeout().toMillis());
        } else {
            log.info("RabbitMQ listener STARTED → consumer={} queue={} prefetch={} concurrency={}",
                    name, queueName, prefetch, concurrency);
        }

        return container;
    }

    // =====================================================================
    // STATE
    // =====================================================================

    public synchronized boolean isRunning() {
        return started && !closed;
    }

    public Set<String> getConsumerNames() {
        return handlers.keySet();
    }

    // =====================================================================
    // SHUTDOWN
    // =====================================================================

    /**
     * Stops every consumer after in-flight handlers finish, then releases the connection.
     */
    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;

        log.info("Stopping contract consumers...");
        stopContainers();
        lease.close();
    }

    private void stopContainers() {
        containers.forEach((name, container) -> {
            try {
                container.stop();
                log.info("Stopped RabbitMQ listener → consumer={}", name);
            } catch (RuntimeException e) {
                log.warn("Failed to stop RabbitMQ listener → consumer={}", name, e);
            }
        });
        containers.clear();
    }

    // =====================================================================
    // BUILDER
    // =====================================================================

    private static final class Registration {
        private final ConsumerHandler<Object> handler;
        private final BatchConsumerHandler<Object> batchHandler;
        private final ConsumerOptions options;

        private Registration(ConsumerHandler<Object> handler,
                             BatchConsumerHandler<Object> batchHandler,
                             ConsumerOptions options) {
            this.handler = handler;
            this.batchHandler = batchHandler;
            this.options = options != null ? options : ConsumerOptions.defaults();
        }

        private boolean isBatch() {
            return batchHandler != null;
        }
    }

    public static final class Builder {

        private ContractDefinition contract;
        private ConnectionLease lease;
        private final Map<String, Registration> handlers = new LinkedHashMap<>();
        private ObjectMapper objectMapper;
        private WorkerOptions options;
        private MeterRegistry meterRegistry;
        private TopologyEngine topologyEngine;

        private Builder() {
        }

        public Builder contract(ContractDefinition contract) {
            this.contract = contract;
            return this;
        }

        /**
         * The worker owns the lease and releases it on {@link ContractWorker#close()}.
         */
        public Builder connection(ConnectionLease lease) {
            this.lease = lease;
            return this;
        }

        public <P> Builder handler(String consumerName, ConsumerHandler<P> handler) {
            return handler(consumerName, handler, ConsumerOptions.defaults());
        }

        @SuppressWarnings("unchecked")
        public <P> Builder handler(String consumerName, ConsumerHandler<P> handler, ConsumerOptions consumerOptions) {
            Objects.requireNonNull(consumerName, "consumerName must not be null");
            Objects.requireNonNull(handler, "handler must not be null");
            handlers.put(consumerName, new Registration(
                    (ConsumerHandler<Object>) (ConsumerHandler<?>) handler, null, consumerOptions));
            return this;
        }

        /**
         * Registers a handler receiving messages in batches of up to
         * {@link ConsumerOptions#getBatchSize()}, which must be set.
         */
        @SuppressWarnings("unchecked")
        public <P> Builder batchHandler(String consumerName,
                                        BatchConsumerHandler<P> handler,
                                        ConsumerOptions consumerOptions) {
            Objects.requireNonNull(consumerName, "consumerName must not be null");
            Objects.requireNonNull(handler, "handler must not be null");
            handlers.put(consumerName, new Registration(
                    null, (BatchConsumerHandler<Object>) (BatchConsumerHandler<?>) handler, consumerOptions));
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        public Builder options(WorkerOptions options) {
            this.options = options;
            return this;
        }

        public Builder meterRegistry(@Nullable MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
            return this;
        }

        /**
         * Replaces the RabbitMQ topology assertion, e.g. for another backend.
         */
        public Builder topologyEngine(TopologyEngine topologyEngine) {
            this.topologyEngine = topologyEngine;
            return this;
        }

        public ContractWorker build() {
            return new ContractWorker(this);
        }
    }
}
