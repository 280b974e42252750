package com.intteq.amqp.contract.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a method of a {@link ContractListener} bean as the handler of a contract consumer.
 *
 * <p>Accepted signatures:
 * <ul>
 *   <li>{@code (Payload payload, ConsumedMessage<Payload> message)}</li>
 *   <li>{@code (ConsumedMessage<Payload> message)}</li>
 *   <li>{@code (List<ConsumedMessage<Payload>> messages)} when {@link #batchSize()} is set</li>
 * </ul>
 *
 * <p>The payload parameter receives the validated payload, converted to the parameter
 * type when the schema produces a different one. Batch handlers get each payload
 * converted to the type argument of their {@code ConsumedMessage} elements.
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface ContractHandler {

    /**
     * Name of the consumer in the contract.
     */
    String value();

    /**
     * Per-handler prefetch override, or 0 to use the consumer definition or the worker default.
     */
    int prefetch() default 0;

    /**
     * Number of concurrent consumers, or 0 for one.
     */
    int concurrency() default 0;

    /**
     * Maximum messages per batch, or 0 for one message per call.
     */
    int batchSize() default 0;

    /**
     * Milliseconds a partial batch waits for further messages, or 0 for the default of one second.
     */
    long batchTimeoutMs() default 0;
}
