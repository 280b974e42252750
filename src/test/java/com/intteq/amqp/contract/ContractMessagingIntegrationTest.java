package com.intteq.amqp.contract;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.intteq.amqp.contract.client.ClientOptions;
import com.intteq.amqp.contract.client.ContractClient;
import com.intteq.amqp.contract.client.PublishOptions;
import com.intteq.amqp.contract.compression.CompressionAlgorithm;
import com.intteq.amqp.contract.exception.MessageValidationException;
import com.intteq.amqp.contract.rabbitmq.SharedConnectionRegistry;
import com.intteq.amqp.contract.retry.RetryHeaders;
import com.intteq.amqp.contract.schema.MessageSchema;
import com.intteq.amqp.contract.testsupport.OrderContracts;
import com.intteq.amqp.contract.testsupport.OrderCreated;
import com.intteq.amqp.contract.testsupport.RabbitContainerSupport;
import com.intteq.amqp.contract.topology.BackoffPolicy;
import com.intteq.amqp.contract.topology.ConsumerDefinition;
import com.intteq.amqp.contract.topology.ContractDefinition;
import com.intteq.amqp.contract.topology.ExchangeDefinition;
import com.intteq.amqp.contract.topology.MessageDefinition;
import com.intteq.amqp.contract.topology.PublisherDefinition;
import com.intteq.amqp.contract.topology.QueueBindingDefinition;
import com.intteq.amqp.contract.topology.QueueDefinition;
import com.intteq.amqp.contract.topology.QueueType;
import com.intteq.amqp.contract.topology.RetryPolicy;
import com.intteq.amqp.contract.worker.ConsumedMessage;
import com.intteq.amqp.contract.worker.ConsumerOptions;
import com.intteq.amqp.contract.worker.ContractWorker;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.rabbit.connection.CachingConnectionFactory;
import org.springframework.amqp.rabbit.core.RabbitTemplate;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

@DisplayName("[Integration] Publishing and consuming against RabbitMQ")
class ContractMessagingIntegrationTest extends RabbitContainerSupport {

    private static final OrderCreated ORDER = new OrderCreated("ORD-1", new BigDecimal("42.50"));

    private SharedConnectionRegistry registry;
    private CachingConnectionFactory inspectionFactory;
    private RabbitTemplate inspection;
    private String prefix;

    @BeforeEach
    void setUp() {
        registry = new SharedConnectionRegistry();
        inspectionFactory = new CachingConnectionFactory(brokerUrls().get(0));
        inspection = new RabbitTemplate(inspectionFactory);
        prefix = uniquePrefix();
    }

    @AfterEach
    void tearDown() {
        registry.destroy();
        inspectionFactory.destroy();
    }

    private Message awaitDeadLetter() {
        String dlq = OrderContracts.deadLetterQueue(prefix).getName();
        Message[] holder = new Message[1];
        await().atMost(Duration.ofSeconds(20)).until(() -> (holder[0] = inspection.receive(dlq)) != null);
        return holder[0];
    }

    @Test
    @DisplayName("A message that always fails is attempted 1 + maxRetries times and then dead-lettered")
    void retriesThenDeadLetters() {
        ContractDefinition contract = OrderContracts.retrying(prefix, RetryPolicy.of(2, BackoffPolicy.fixed(100)));
        AtomicInteger attempts = new AtomicInteger();
        List<Integer> seenRetryCounts = new CopyOnWriteArrayList<>();

        try (ContractClient client = ContractClient.create(contract, registry.acquire(brokerUrls()));
             ContractWorker worker = ContractWorker.builder()
                     .contract(contract)
                     .connection(registry.acquire(brokerUrls()))
                     .handler("processOrder", (ConsumedMessage<OrderCreated> m) -> {
                         attempts.incrementAndGet();
                         seenRetryCounts.add(m.retryCount());
                         throw new IllegalStateException("payment service unavailable");
                     })
                     .build()
                     .start()) {

            client.publish("orderCreated", ORDER).join();

            Message deadLetter = awaitDeadLetter();

            assertThat(attempts).hasValue(3);
            assertThat(seenRetryCounts).containsExactly(0, 1, 2);
            assertThat(((Number) deadLetter.getMessageProperties().getHeader(RetryHeaders.RETRY_COUNT)).intValue())
                    .isEqualTo(2);
            assertThat((String) deadLetter.getMessageProperties().getHeader(RetryHeaders.LAST_ERROR))
                    .isEqualTo("payment service unavailable");
            assertThat(worker.isRunning()).isTrue();
        }

        assertThat(registry.size()).isZero();
    }

    @Test
    @DisplayName("Without a dead letter key a message that keeps failing ends in the dead letter queue exactly once")
    void giveUpWithoutDeadLetterKey() {
        ContractDefinition contract = OrderContracts.retryingWithoutDeadLetterKey(prefix,
                RetryPolicy.of(2, BackoffPolicy.fixed(100)));
        AtomicInteger attempts = new AtomicInteger();

        try (ContractClient client = ContractClient.create(contract, registry.acquire(brokerUrls()));
             ContractWorker ignored = ContractWorker.builder()
                     .contract(contract)
                     .connection(registry.acquire(brokerUrls()))
                     .handler("processOrder", (ConsumedMessage<OrderCreated> m) -> {
                         attempts.incrementAndGet();
                         throw new IllegalStateException("payment service unavailable");
                     })
                     .build()
                     .start()) {

            client.publish("orderCreated", ORDER).join();

            Message deadLetter = awaitDeadLetter();

            assertThat(deadLetter.getMessageProperties().getReceivedRoutingKey()).isEqualTo("order.created");
            await().during(Duration.ofSeconds(1)).atMost(Duration.ofSeconds(5))
                    .untilAsserted(() -> assertThat(attempts).hasValue(3));
            assertThat(inspection.receive(OrderContracts.deadLetterQueue(prefix).getName())).isNull();
        }
    }

    @Test
    @DisplayName("A batch consumer receives waiting messages together and acks them all")
    void batchConsumption() {
        ContractDefinition contract = OrderContracts.retrying(prefix, RetryPolicy.of(1));
        List<Integer> batchSizes = new CopyOnWriteArrayList<>();
        List<String> orderIds = new CopyOnWriteArrayList<>();

        try (ContractClient client = ContractClient.create(contract, registry.acquire(brokerUrls()))) {
            for (int i = 1; i <= 5; i++) {
                client.publish("orderCreated", new OrderCreated("ORD-" + i, BigDecimal.TEN)).join();
            }

            try (ContractWorker ignored = ContractWorker.builder()
                    .contract(contract)
                    .connection(registry.acquire(brokerUrls()))
                    .batchHandler("processOrder", (List<ConsumedMessage<OrderCreated>> batch) -> {
                        batchSizes.add(batch.size());
                        batch.forEach(m -> orderIds.add(m.payload().getOrderId()));
                    }, ConsumerOptions.builder().batchSize(5).batchTimeout(Duration.ofMillis(500)).build())
                    .build()
                    .start()) {

                await().atMost(Duration.ofSeconds(20)).untilAsserted(() -> assertThat(orderIds).hasSize(5));
                assertThat(orderIds).containsExactlyInAnyOrder("ORD-1", "ORD-2", "ORD-3", "ORD-4", "ORD-5");
                assertThat(batchSizes).allMatch(size -> size <= 5);
                assertThat(batchSizes.stream().mapToInt(Integer::intValue).sum()).isEqualTo(5);
            }
        }

        assertThat(inspection.receive(prefix + "-order-processing")).isNull();
    }

    @Test
    @DisplayName("A partial batch is handed over once the batch timeout passes")
    void partialBatchAfterTimeout() {
        ContractDefinition contract = OrderContracts.retrying(prefix, RetryPolicy.of(1));
        List<Integer> batchSizes = new CopyOnWriteArrayList<>();

        try (ContractClient client = ContractClient.create(contract, registry.acquire(brokerUrls()));
             ContractWorker ignored = ContractWorker.builder()
                     .contract(contract)
                     .connection(registry.acquire(brokerUrls()))
                     .batchHandler("processOrder", (List<ConsumedMessage<OrderCreated>> batch) -> batchSizes.add(batch.size()),
                             ConsumerOptions.builder().batchSize(10).batchTimeout(Duration.ofMillis(300)).build())
                     .build()
                     .start()) {

            client.publish("orderCreated", new OrderCreated("ORD-1", BigDecimal.TEN)).join();
            client.publish("orderCreated", new OrderCreated("ORD-2", BigDecimal.TEN)).join();

            await().atMost(Duration.ofSeconds(20)).untilAsserted(() ->
                    assertThat(batchSizes.stream().mapToInt(Integer::intValue).sum()).isEqualTo(2));
            assertThat(batchSizes).allMatch(size -> size < 10);
        }
    }

    @Test
    @DisplayName("A handler that recovers on the second attempt acknowledges the message")
    void recoversOnRetry() {
        ContractDefinition contract = OrderContracts.retrying(prefix, RetryPolicy.of(3, BackoffPolicy.fixed(100)));
        List<OrderCreated> processed = new CopyOnWriteArrayList<>();
        AtomicInteger attempts = new AtomicInteger();

        try (ContractClient client = ContractClient.create(contract, registry.acquire(brokerUrls()));
             ContractWorker ignored = ContractWorker.builder()
                     .contract(contract)
                     .connection(registry.acquire(brokerUrls()))
                     .handler("processOrder", (ConsumedMessage<OrderCreated> m) -> {
                         if (attempts.incrementAndGet() == 1) {
                             throw new IllegalStateException("transient");
                         }
                         processed.add(m.payload());
                     })
                     .build()
                     .start()) {

            client.publish("orderCreated", ORDER).join();

            await().atMost(Duration.ofSeconds(20)).untilAsserted(() -> assertThat(processed).containsExactly(ORDER));
            assertThat(inspection.receive(OrderContracts.deadLetterQueue(prefix).getName())).isNull();
        }
    }

    @Test
    @DisplayName("A gzip-compressed publish is consumed as the original payload")
    void compressedRoundTrip() {
        ContractDefinition contract = OrderContracts.retrying(prefix, RetryPolicy.of(1));
        List<ConsumedMessage<OrderCreated>> received = new CopyOnWriteArrayList<>();

        try (ContractClient client = ContractClient.create(contract, registry.acquire(brokerUrls()),
                new ObjectMapper(), null,
                ClientOptions.builder().defaultCompression(CompressionAlgorithm.GZIP).build());
             ContractWorker ignored = ContractWorker.builder()
                     .contract(contract)
                     .connection(registry.acquire(brokerUrls()))
                     .handler("processOrder", (ConsumedMessage<OrderCreated> m) -> received.add(m))
                     .build()
                     .start()) {

            client.publish("orderCreated", ORDER, PublishOptions.builder().header("tenant", "acme").build()).join();

            await().atMost(Duration.ofSeconds(20)).until(() -> !received.isEmpty());
            ConsumedMessage<OrderCreated> message = received.get(0);
            assertThat(message.payload()).isEqualTo(ORDER);
            assertThat(message.message().getMessageProperties().getContentEncoding()).isEqualTo("gzip");
            assertThat(message.rawHeaders()).containsEntry("tenant", "acme");
        }
    }

    @Test
    @DisplayName("A message with an unsupported content-encoding goes to the dead letter queue unhandled")
    void unsupportedEncodingIsDeadLettered() {
        ContractDefinition contract = OrderContracts.retrying(prefix, RetryPolicy.of(3));
        AtomicInteger calls = new AtomicInteger();

        try (ContractWorker ignored = ContractWorker.builder()
                .contract(contract)
                .connection(registry.acquire(brokerUrls()))
                .handler("processOrder", m -> calls.incrementAndGet())
                .build()
                .start()) {

            MessageProperties properties = new MessageProperties();
            properties.setContentType(MessageProperties.CONTENT_TYPE_JSON);
            properties.setContentEncoding("br");
            inspection.send(prefix + "-orders", "order.created",
                    new Message("{\"orderId\":\"ORD-1\",\"amount\":1}".getBytes(StandardCharsets.UTF_8), properties));

            Message deadLetter = awaitDeadLetter();

            assertThat(deadLetter.getMessageProperties().getContentEncoding()).isEqualTo("br");
            assertThat(calls).hasValue(0);
        }
    }

    @Test
    @DisplayName("An invalid payload is rejected before anything is sent")
    void invalidPayloadIsNotSent() {
        ContractDefinition contract = OrderContracts.retrying(prefix, RetryPolicy.of(1));

        try (ContractClient client = ContractClient.create(contract, registry.acquire(brokerUrls()))) {
            assertThatThrownBy(() -> client.publish("orderCreated", new OrderCreated("", BigDecimal.ONE)).get())
                    .isInstanceOf(ExecutionException.class)
                    .hasCauseInstanceOf(MessageValidationException.class);
        }

        assertThat(inspection.receive(prefix + "-order-processing")).isNull();
    }

    @Test
    @DisplayName("Messages waiting in a priority queue are consumed highest priority first")
    void priorityOrder() {
        ExchangeDefinition jobs = ExchangeDefinition.direct(prefix + "-jobs");
        QueueDefinition queue = QueueDefinition.builder()
                .name(prefix + "-jobs")
                .type(QueueType.CLASSIC)
                .maxPriority(10)
                .build();
        MessageDefinition anything = MessageDefinition.of(MessageSchema.any());
        ContractDefinition contract = ContractDefinition.builder()
                .exchange("jobs", jobs)
                .queue("jobs", queue)
                .publisher("submitJob", PublisherDefinition.of(jobs, "job", anything))
                .consumer("runJob", ConsumerDefinition.of(queue, anything), QueueBindingDefinition.of(queue, jobs, "job"))
                .build();
        List<Integer> order = new CopyOnWriteArrayList<>();

        try (ContractClient client = ContractClient.create(contract, registry.acquire(brokerUrls()))) {
            for (int priority : new int[]{1, 10, 5}) {
                client.publish("submitJob", Map.of("priority", priority),
                        PublishOptions.builder().priority(priority).build()).join();
            }

            try (ContractWorker ignored = ContractWorker.builder()
                    .contract(contract)
                    .connection(registry.acquire(brokerUrls()))
                    .handler("runJob", m -> order.add(m.message().getMessageProperties().getPriority()),
                            ConsumerOptions.builder().prefetch(1).build())
                    .build()
                    .start()) {

                await().atMost(Duration.ofSeconds(20)).untilAsserted(() -> assertThat(order).hasSize(3));
                assertThat(order).containsExactly(10, 5, 1);
            }
        }
    }
}
