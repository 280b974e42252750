package com.intteq.amqp.contract.topology;

import java.util.Map;

/**
 * A routing rule from an exchange to a queue or to another exchange.
 * Implementations are tagged by {@link #getType()}.
 */
public interface BindingDefinition {

    BindingType getType();

    /**
     * @return the source exchange
     */
    ExchangeDefinition getExchange();

    /**
     * @return the routing key or pattern; empty for fanout exchanges
     */
    String getRoutingKey();

    Map<String, Object> getArguments();

    enum BindingType {
        QUEUE,
        EXCHANGE
    }
}
