package com.intteq.amqp.contract.topology;

import com.intteq.amqp.contract.exception.ContractConfigurationException;
import com.intteq.amqp.contract.exception.ContractConfigurationException.Code;
import com.intteq.amqp.contract.schema.MessageSchema;
import com.intteq.amqp.contract.testsupport.OrderContracts;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("[Topology] Contract definitions")
class ContractDefinitionTest {

    @Test
    @DisplayName("A queue with a retry budget is expanded with its wait queue and bindings")
    void retryQueueIsExpanded() {
        ContractDefinition contract = OrderContracts.retrying("t", RetryPolicy.of(3));

        assertThat(contract.getQueues()).containsKeys(
                "orderProcessing", "orderProcessingWait", "orderProcessingDlq");
        assertThat(contract.getQueues().get("orderProcessingWait").getName()).isEqualTo("t-order-processing-wait");
        assertThat(contract.getBindings()).containsKeys(
                "orderProcessingWaitBinding", "orderProcessingRetryBinding", "processOrderBinding");
    }

    @Test
    @DisplayName("Queues without a retry budget are not expanded")
    void plainQueueIsNotExpanded() {
        ContractDefinition contract = OrderContracts.retrying("t", RetryPolicy.failFast());

        assertThat(contract.getQueues()).doesNotContainKey("orderProcessingWait");
        assertThat(contract.getBindings()).doesNotContainKey("orderProcessingRetryBinding");
    }

    @Test
    @DisplayName("Explicitly wrapped queues keep their key and are expanded once")
    void explicitWrap() {
        ExchangeDefinition dlx = ExchangeDefinition.direct("dlx");
        QueueDefinition queue = QueueDefinition.builder()
                .name("jobs")
                .deadLetter(DeadLetterConfig.of(dlx))
                .retry(RetryPolicy.of(2))
                .build();

        ContractDefinition contract = ContractDefinition.builder()
                .exchange("dlx", dlx)
                .queue("jobs", TtlBackoffInfrastructure.wrap(queue, false))
                .build();

        assertThat(contract.getQueues()).containsOnlyKeys("jobs", "jobsWait");
        assertThat(contract.getQueues().get("jobsWait").isDurable()).isFalse();
    }

    @Test
    @DisplayName("A retry budget without a dead letter exchange fails the build")
    void retryWithoutDeadLetter() {
        ContractDefinition.Builder builder = ContractDefinition.builder()
                .queue("jobs", QueueDefinition.builder().name("jobs").retry(RetryPolicy.of(2)).build());

        assertThatThrownBy(builder::build)
                .isInstanceOf(ContractConfigurationException.class)
                .hasMessageContaining("jobs")
                .extracting("code")
                .isEqualTo(Code.RETRY_REQUIRES_DEAD_LETTER);
    }

    @Test
    @DisplayName("Lookups by name return empty for unknown entries")
    void lookups() {
        ContractDefinition contract = OrderContracts.retrying("t", RetryPolicy.of(1));

        assertThat(contract.findPublisher("orderCreated")).isPresent();
        assertThat(contract.findConsumer("processOrder")).isPresent();
        assertThat(contract.findPublisher("missing")).isEmpty();
        assertThat(contract.findConsumer("missing")).isEmpty();
    }

    @Test
    @DisplayName("Merged contracts combine entries and the later one wins on collisions")
    void merge() {
        ExchangeDefinition audit = ExchangeDefinition.fanout("audit");
        ContractDefinition first = OrderContracts.retrying("t", RetryPolicy.of(1));
        ContractDefinition second = ContractDefinition.builder()
                .exchange("audit", audit)
                .publisher("auditEvent", PublisherDefinition.of(audit, MessageDefinition.of(MessageSchema.any())))
                .exchange("orders", ExchangeDefinition.topic("t-orders").toBuilder().autoDelete(true).build())
                .build();

        ContractDefinition merged = ContractDefinition.merge(first, second);

        assertThat(merged.getPublishers()).containsKeys("orderCreated", "auditEvent");
        assertThat(merged.getExchanges().get("orders").isAutoDelete()).isTrue();
        assertThat(merged.getQueues()).containsKey("orderProcessingWait");
    }

    @Test
    @DisplayName("Contract collections are read-only")
    void immutable() {
        ContractDefinition contract = OrderContracts.retrying("t", RetryPolicy.of(1));

        assertThatThrownBy(() -> contract.getExchanges().clear())
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
