package com.intteq.amqp.contract.topology;

/**
 * Broker queue implementation. Quorum queues replicate but cannot order by priority.
 */
public enum QueueType {

    CLASSIC("classic"),
    QUORUM("quorum");

    private final String argumentValue;

    QueueType(String argumentValue) {
        this.argumentValue = argumentValue;
    }

    /**
     * @return value of the {@code x-queue-type} argument
     */
    public String argumentValue() {
        return argumentValue;
    }
}
