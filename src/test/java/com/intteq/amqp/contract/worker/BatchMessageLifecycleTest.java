package com.intteq.amqp.contract.worker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.intteq.amqp.contract.exception.NonRetryableException;
import com.intteq.amqp.contract.retry.RetryHeaders;
import com.intteq.amqp.contract.testsupport.OrderContracts;
import com.intteq.amqp.contract.testsupport.OrderCreated;
import com.intteq.amqp.contract.topology.ConsumerDefinition;
import com.intteq.amqp.contract.topology.RetryPolicy;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageProperties;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("[Worker] Batch lifecycle and per-message settlement")
class BatchMessageLifecycleTest {

    private static final String VALID_ORDER = "{\"orderId\":\"ORD-%d\",\"amount\":10}";
    private static final String INVALID_ORDER = "{\"orderId\":\"\",\"amount\":-1}";

    @Mock
    Channel channel;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();

    private static ConsumerDefinition consumer(RetryPolicy retry) {
        return OrderContracts.retrying("t", retry).findConsumer("processOrder").orElseThrow();
    }

    private BatchMessageLifecycle lifecycle(RetryPolicy retry, BatchConsumerHandler<Object> handler) {
        return new BatchMessageLifecycle("processOrder", consumer(retry), handler, objectMapper, meterRegistry);
    }

    private static Message message(long tag, String json) {
        return message(tag, json, 0);
    }

    private static Message message(long tag, String json, int retryCount) {
        MessageProperties properties = new MessageProperties();
        properties.setDeliveryTag(tag);
        properties.setContentType(MessageProperties.CONTENT_TYPE_JSON);
        if (retryCount > 0) {
            properties.setHeader(RetryHeaders.RETRY_COUNT, retryCount);
        }
        return new Message(json.getBytes(StandardCharsets.UTF_8), properties);
    }

    private static String order(int n) {
        return String.format(VALID_ORDER, n);
    }

    @Test
    @DisplayName("A successful batch hands over every validated payload and acks each message")
    void successAcksEveryMessage() throws Exception {
        List<String> orderIds = new ArrayList<>();

        List<DeliveryState> states = lifecycle(RetryPolicy.of(2), batch ->
                batch.forEach(m -> orderIds.add(((OrderCreated) m.payload()).getOrderId())))
                .process(List.of(message(1, order(1)), message(2, order(2)), message(3, order(3))), channel);

        assertThat(states).containsOnly(DeliveryState.ACKED).hasSize(3);
        assertThat(orderIds).containsExactly("ORD-1", "ORD-2", "ORD-3");
        verify(channel).basicAck(1, false);
        verify(channel).basicAck(2, false);
        verify(channel).basicAck(3, false);
    }

    @Test
    @DisplayName("Invalid messages are dead-lettered and left out of the batch")
    void invalidMessagesLeftOut() throws Exception {
        List<Integer> sizes = new ArrayList<>();

        List<DeliveryState> states = lifecycle(RetryPolicy.of(2), batch -> sizes.add(batch.size()))
                .process(List.of(message(1, order(1)), message(2, INVALID_ORDER)), channel);

        assertThat(states).containsExactly(DeliveryState.ACKED, DeliveryState.DEAD_LETTERED);
        assertThat(sizes).containsExactly(1);
        verify(channel).basicAck(1, false);
        verify(channel).basicNack(2, false, false);
    }

    @Test
    @DisplayName("The handler is not called when no message of the batch is valid")
    void allInvalid() throws Exception {
        AtomicInteger calls = new AtomicInteger();

        List<DeliveryState> states = lifecycle(RetryPolicy.of(2), batch -> calls.incrementAndGet())
                .process(List.of(message(1, INVALID_ORDER), message(2, "{not json")), channel);

        assertThat(states).containsOnly(DeliveryState.DEAD_LETTERED);
        assertThat(calls).hasValue(0);
    }

    @Test
    @DisplayName("A non-retryable batch failure dead-letters every message")
    void nonRetryableDeadLettersAll() throws Exception {
        List<DeliveryState> states = lifecycle(RetryPolicy.of(5), batch -> {
            throw new NonRetryableException("batch rejected");
        }).process(List.of(message(1, order(1)), message(2, order(2))), channel);

        assertThat(states).containsOnly(DeliveryState.DEAD_LETTERED);
        verify(channel).basicNack(1, false, false);
        verify(channel).basicNack(2, false, false);
        verify(channel, never()).basicPublish(anyString(), anyString(), anyBoolean(), any(), any());
    }

    @Test
    @DisplayName("A retryable batch failure settles each message by its own retry count")
    void retryableSettlesPerMessage() throws Exception {
        when(channel.waitForConfirms(anyLong())).thenReturn(true);

        List<DeliveryState> states = lifecycle(RetryPolicy.of(2), batch -> {
            throw new IllegalStateException("warehouse offline");
        }).process(List.of(message(1, order(1)), message(2, order(2), 2)), channel);

        assertThat(states).containsExactly(DeliveryState.RETRIED_VIA_WAIT_QUEUE, DeliveryState.DEAD_LETTERED);

        ArgumentCaptor<AMQP.BasicProperties> props = ArgumentCaptor.forClass(AMQP.BasicProperties.class);
        verify(channel).basicPublish(eq("t-orders-dlx"), eq("t-order-processing-wait"), eq(true),
                props.capture(), any(byte[].class));
        assertThat(props.getValue().getHeaders()).containsEntry(RetryHeaders.RETRY_COUNT, 1);
        verify(channel).basicAck(1, false);
        verify(channel).basicNack(2, false, false);
        assertThat(meterRegistry.counter("amqp.contract.consume",
                "consumer", "processOrder",
                "queue", "t-order-processing",
                "outcome", "dead_lettered",
                "reason", "max_retries").count()).isEqualTo(1.0);
    }
}
