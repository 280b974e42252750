package com.intteq.amqp.contract.topology;

import com.intteq.amqp.contract.exception.ContractConfigurationException;
import com.intteq.amqp.contract.exception.ContractConfigurationException.Code;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Closed-graph checks over a {@link ContractDefinition}: every exchange and queue
 * referenced anywhere in the contract must be declared in it.
 */
public final class ContractValidator {

    private ContractValidator() {
    }

    /**
     * @return every violation found, in declaration order; empty when the contract is valid
     */
    public static List<ContractConfigurationException> validate(ContractDefinition contract) {
        Set<String> exchangeNames = contract.getExchanges().values().stream()
                .map(ExchangeDefinition::getName)
                .collect(Collectors.toSet());
        Set<String> queueNames = contract.getQueues().values().stream()
                .map(QueueDefinition::getName)
                .collect(Collectors.toSet());

        List<ContractConfigurationException> errors = new ArrayList<>();

        contract.getQueues().forEach((key, queue) -> {
            if (queue.hasDeadLetter() && !exchangeNames.contains(queue.getDeadLetter().getExchange().getName())) {
                errors.add(new ContractConfigurationException(Code.QUEUE_REFERENCES_UNDEFINED_DEAD_LETTER_EXCHANGE,
                        "Queue \"" + key + "\" dead-letters to exchange \""
                                + queue.getDeadLetter().getExchange().getName() + "\" which is not declared in the contract",
                        Map.of("queue", key, "exchange", queue.getDeadLetter().getExchange().getName())));
            }
        });

        contract.getBindings().forEach((key, binding) -> {
            if (!exchangeNames.contains(binding.getExchange().getName())) {
                errors.add(new ContractConfigurationException(Code.BINDING_REFERENCES_UNDEFINED_EXCHANGE,
                        "Binding \"" + key + "\" references exchange \"" + binding.getExchange().getName()
                                + "\" which is not declared in the contract",
                        Map.of("binding", key, "exchange", binding.getExchange().getName())));
            }
            if (binding instanceof QueueBindingDefinition) {
                String queue = ((QueueBindingDefinition) binding).getQueue().getName();
                if (!queueNames.contains(queue)) {
                    errors.add(new ContractConfigurationException(Code.BINDING_REFERENCES_UNDEFINED_QUEUE,
                            "Binding \"" + key + "\" references queue \"" + queue
                                    + "\" which is not declared in the contract",
                            Map.of("binding", key, "queue", queue)));
                }
            } else if (binding instanceof ExchangeBindingDefinition) {
                String destination = ((ExchangeBindingDefinition) binding).getDestination().getName();
                if (!exchangeNames.contains(destination)) {
                    errors.add(new ContractConfigurationException(Code.BINDING_REFERENCES_UNDEFINED_EXCHANGE,
                            "Binding \"" + key + "\" references destination exchange \"" + destination
                                    + "\" which is not declared in the contract",
                            Map.of("binding", key, "exchange", destination)));
                }
            }
        });

        contract.getPublishers().forEach((key, publisher) -> {
            if (!exchangeNames.contains(publisher.getExchange().getName())) {
                errors.add(new ContractConfigurationException(Code.PUBLISHER_REFERENCES_UNDEFINED_EXCHANGE,
                        "Publisher \"" + key + "\" references exchange \"" + publisher.getExchange().getName()
                                + "\" which is not declared in the contract",
                        Map.of("publisher", key, "exchange", publisher.getExchange().getName())));
            }
        });

        contract.getConsumers().forEach((key, consumer) -> {
            if (!queueNames.contains(consumer.getQueue().getName())) {
                errors.add(new ContractConfigurationException(Code.CONSUMER_REFERENCES_UNDEFINED_QUEUE,
                        "Consumer \"" + key + "\" references queue \"" + consumer.getQueue().getName()
                                + "\" which is not declared in the contract",
                        Map.of("consumer", key, "queue", consumer.getQueue().getName())));
            }
        });

        return errors;
    }

    /**
     * @throws ContractConfigurationException the first violation, with the others suppressed
     */
    public static void assertValid(ContractDefinition contract) {
        throwIfAny(validate(contract));
    }

    /**
     * Checks that handlers and consumers pair up one to one.
     *
     * @throws ContractConfigurationException for a handler naming an unknown consumer, or a
     *                                        consumer left without a handler
     */
    public static void assertHandlersMatchConsumers(ContractDefinition contract, Collection<String> handlerNames) {
        List<ContractConfigurationException> errors = new ArrayList<>();
        Set<String> consumerNames = contract.getConsumers().keySet();

        for (String handler : handlerNames) {
            if (!consumerNames.contains(handler)) {
                errors.add(new ContractConfigurationException(Code.CONSUMER_NOT_FOUND,
                        "Consumer \"" + handler + "\" not found in contract. Available consumers: "
                                + String.join(", ", consumerNames),
                        Map.of("consumer", handler)));
            }
        }
        for (String consumer : consumerNames) {
            if (!handlerNames.contains(consumer)) {
                errors.add(new ContractConfigurationException(Code.HANDLER_NOT_PROVIDED,
                        "Handler for consumer \"" + consumer + "\" not provided",
                        Map.of("consumer", consumer)));
            }
        }
        throwIfAny(errors);
    }

    private static void throwIfAny(List<ContractConfigurationException> errors) {
        if (errors.isEmpty()) {
            return;
        }
        ContractConfigurationException first = errors.get(0);
        errors.subList(1, errors.size()).forEach(first::addSuppressed);
        throw first;
    }
}
