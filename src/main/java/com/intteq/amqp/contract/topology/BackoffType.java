package com.intteq.amqp.contract.topology;

public enum BackoffType {
    FIXED,
    EXPONENTIAL
}
