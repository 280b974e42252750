package com.intteq.amqp.contract;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.intteq.amqp.contract.client.ContractClient;
import com.intteq.amqp.contract.internal.ContractListenerRegistrar;
import com.intteq.amqp.contract.rabbitmq.SharedConnectionRegistry;
import com.intteq.amqp.contract.topology.ContractDefinition;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.lang.Nullable;

/**
 * Auto-configuration for contract-first messaging.
 *
 * <p>Activates when the application defines at least one {@link ContractDefinition}
 * bean. Several contract beans are merged in bean order. It can be disabled by setting:
 *
 * <pre>
 *   amqp-contract.enabled = false
 * </pre>
 *
 * <p>Listener discovery alone can be disabled with {@code amqp-contract.worker.enabled=false}.
 */
@AutoConfiguration
@ConditionalOnClass(RabbitTemplate.class)
@ConditionalOnBean(ContractDefinition.class)
@EnableConfigurationProperties(AmqpContractProperties.class)
@ConditionalOnProperty(prefix = "amqp-contract", name = "enabled", havingValue = "true", matchIfMissing = true)
public class AmqpContractAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public SharedConnectionRegistry sharedConnectionRegistry() {
        return new SharedConnectionRegistry();
    }

    /**
     * Creates the {@link ContractClient}. Topology is asserted here, so the application
     * fails to start when the broker rejects the contract.
     */
    @Bean
    @ConditionalOnMissingBean
    public ContractClient contractClient(
            ObjectProvider<ContractDefinition> contracts,
            SharedConnectionRegistry connectionRegistry,
            AmqpContractProperties props,
            @Nullable ObjectMapper objectMapper,
            @Nullable MeterRegistry meterRegistry) {

        return ContractClient.create(
                mergedContract(contracts),
                connectionRegistry.acquire(props.getUrls(), props.getConnection().toOptions()),
                mapperOrDefault(objectMapper),
                meterRegistry,
                props.getClient().toOptions()
        );
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "amqp-contract.worker", name = "enabled", havingValue = "true", matchIfMissing = true)
    public ContractListenerRegistrar contractListenerRegistrar(
            ObjectProvider<ContractDefinition> contracts,
            SharedConnectionRegistry connectionRegistry,
            AmqpContractProperties props,
            ApplicationContext ctx,
            @Nullable ObjectMapper objectMapper,
            @Nullable MeterRegistry meterRegistry) {

        return new ContractListenerRegistrar(
                mergedContract(contracts),
                connectionRegistry,
                props,
                ctx,
                mapperOrDefault(objectMapper),
                meterRegistry
        );
    }

    static ContractDefinition mergedContract(ObjectProvider<ContractDefinition> contracts) {
        ContractDefinition[] all = contracts.orderedStream().toArray(ContractDefinition[]::new);
        return all.length == 1 ? all[0] : ContractDefinition.merge(all);
    }

    private static ObjectMapper mapperOrDefault(@Nullable ObjectMapper objectMapper) {
        return objectMapper != null ? objectMapper : new ObjectMapper().findAndRegisterModules();
    }
}
