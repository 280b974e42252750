package com.intteq.amqp.contract.engine;

import com.intteq.amqp.contract.exception.TechnicalException;
import com.intteq.amqp.contract.topology.BindingDefinition;
import com.intteq.amqp.contract.topology.ContractDefinition;
import com.intteq.amqp.contract.topology.ExchangeBindingDefinition;
import com.intteq.amqp.contract.topology.ExchangeDefinition;
import com.intteq.amqp.contract.topology.QueueBindingDefinition;
import com.intteq.amqp.contract.topology.QueueDefinition;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.function.Consumer;

/**
 * Idempotent create-or-verify operations on broker topology.
 *
 * <p>Declaring an entity that already exists with the same parameters is a no-op.
 * Diverging parameters for an existing name are reported by the broker and
 * surface as a {@link TechnicalException}.</p>
 */
public interface TopologyEngine {

    void assertExchange(ExchangeDefinition exchange);

    void assertQueue(QueueDefinition queue);

    void bindQueue(QueueBindingDefinition binding);

    void bindExchange(ExchangeBindingDefinition binding);

    /**
     * Asserts all exchanges, then all queues, then all bindings of the contract.
     * Within a phase every entity is attempted; failures are reported together
     * once the phase completes.
     *
     * @throws TechnicalException if any declaration of a phase failed
     */
    default void assertTopology(ContractDefinition contract) {
        assertAll("exchange", contract.getExchanges().values(), this::assertExchange);
        assertAll("queue", contract.getQueues().values(), this::assertQueue);
        assertAll("binding", contract.getBindings().values(), this::bind);
    }

    private void bind(BindingDefinition binding) {
        switch (binding.getType()) {
            case QUEUE -> bindQueue((QueueBindingDefinition) binding);
            case EXCHANGE -> bindExchange((ExchangeBindingDefinition) binding);
        }
    }

    private static <T> void assertAll(String kind, Collection<T> entities, Consumer<T> action) {
        List<RuntimeException> failures = new ArrayList<>();
        for (T entity : entities) {
            try {
                action.accept(entity);
            } catch (RuntimeException e) {
                failures.add(e);
            }
        }
        if (failures.isEmpty()) {
            return;
        }
        TechnicalException error = new TechnicalException(
                "Failed to assert " + failures.size() + " " + kind + "(s): " + failures.get(0).getMessage(),
                failures.get(0));
        failures.subList(1, failures.size()).forEach(error::addSuppressed);
        throw error;
    }
}
