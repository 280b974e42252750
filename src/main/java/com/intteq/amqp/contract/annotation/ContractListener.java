package com.intteq.amqp.contract.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a bean whose {@link ContractHandler} methods consume contract consumers.
 *
 * <p>Example:
 * <pre>
 * {@code
 * @Component
 * @ContractListener
 * public class OrderListener {
 *
 *     @ContractHandler("processOrder")
 *     public void onOrder(OrderCreated payload, ConsumedMessage<OrderCreated> message) {
 *         // business logic...
 *     }
 * }
 * }
 * </pre>
 *
 * <p>All handlers of all listener beans are served by a single worker, so together
 * they must cover every consumer of the contract.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface ContractListener {

    /**
     * Optional human-readable documentation for developers or monitoring systems.
     */
    String description() default "";
}
