package com.intteq.amqp.contract.rabbitmq;

import com.intteq.amqp.contract.engine.TopologyEngine;
import com.intteq.amqp.contract.exception.TechnicalException;
import com.intteq.amqp.contract.topology.ExchangeBindingDefinition;
import com.intteq.amqp.contract.topology.ExchangeDefinition;
import com.intteq.amqp.contract.topology.QueueBindingDefinition;
import com.intteq.amqp.contract.topology.QueueDefinition;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.core.AbstractExchange;
import org.springframework.amqp.core.AmqpAdmin;
import org.springframework.amqp.core.Binding;
import org.springframework.amqp.core.DirectExchange;
import org.springframework.amqp.core.FanoutExchange;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.TopicExchange;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.core.RabbitAdmin;

import java.util.HashMap;

/**
 * {@link TopologyEngine} backed by Spring AMQP's {@link AmqpAdmin}.
 *
 * <p>Contract definitions are mapped onto {@code Exchange}, {@code Queue} and
 * {@code Binding} declarables. Queue arguments come from
 * {@link QueueDefinition#toArguments()}.</p>
 */
@Slf4j
@RequiredArgsConstructor
public class RabbitTopologyEngine implements TopologyEngine {

    private final AmqpAdmin admin;

    public static RabbitTopologyEngine forConnectionFactory(ConnectionFactory connectionFactory) {
        return new RabbitTopologyEngine(new RabbitAdmin(connectionFactory));
    }

    // =====================================================================
    // EXCHANGES
    // =====================================================================

    @Override
    public void assertExchange(ExchangeDefinition definition) {
        AbstractExchange exchange = toExchange(definition);
        declare("exchange " + definition.getName(), () -> admin.declareExchange(exchange));
        log.debug("Exchange asserted → name={} type={}", definition.getName(), definition.getType());
    }

    static AbstractExchange toExchange(ExchangeDefinition definition) {
        var args = new HashMap<>(definition.getArguments());
        AbstractExchange exchange = switch (definition.getType()) {
            case FANOUT -> new FanoutExchange(definition.getName(), definition.isDurable(), definition.isAutoDelete(), args);
            case DIRECT -> new DirectExchange(definition.getName(), definition.isDurable(), definition.isAutoDelete(), args);
            case TOPIC -> new TopicExchange(definition.getName(), definition.isDurable(), definition.isAutoDelete(), args);
        };
        exchange.setInternal(definition.isInternal());
        return exchange;
    }

    // =====================================================================
    // QUEUES
    // =====================================================================

    @Override
    public void assertQueue(QueueDefinition definition) {
        Queue queue = toQueue(definition);
        declare("queue " + definition.getName(), () -> admin.declareQueue(queue));
        log.debug("Queue asserted → name={} type={}", definition.getName(), definition.getType());
    }

    static Queue toQueue(QueueDefinition definition) {
        return new Queue(
                definition.getName(),
                definition.isDurable(),
                definition.isExclusive(),
                definition.isAutoDelete(),
                definition.toArguments()
        );
    }

    // =====================================================================
    // BINDINGS
    // =====================================================================

    @Override
    public void bindQueue(QueueBindingDefinition definition) {
        Binding binding = new Binding(
                definition.getQueue().getName(),
                Binding.DestinationType.QUEUE,
                definition.getExchange().getName(),
                definition.getRoutingKey(),
                new HashMap<>(definition.getArguments())
        );
        declare("binding " + definition.getExchange().getName() + " → " + definition.getQueue().getName(),
                () -> admin.declareBinding(binding));
        log.debug("Queue binding asserted → exchange={} queue={} routingKey={}",
                definition.getExchange().getName(), definition.getQueue().getName(), definition.getRoutingKey());
    }

    @Override
    public void bindExchange(ExchangeBindingDefinition definition) {
        Binding binding = new Binding(
                definition.getDestination().getName(),
                Binding.DestinationType.EXCHANGE,
                definition.getExchange().getName(),
                definition.getRoutingKey(),
                new HashMap<>(definition.getArguments())
        );
        declare("binding " + definition.getExchange().getName() + " → " + definition.getDestination().getName(),
                () -> admin.declareBinding(binding));
        log.debug("Exchange binding asserted → source={} destination={} routingKey={}",
                definition.getExchange().getName(), definition.getDestination().getName(), definition.getRoutingKey());
    }

    private void declare(String what, Runnable declaration) {
        try {
            declaration.run();
        } catch (AmqpException e) {
            throw new TechnicalException("Failed to assert " + what, e);
        }
    }
}
