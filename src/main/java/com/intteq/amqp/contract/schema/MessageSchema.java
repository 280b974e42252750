package com.intteq.amqp.contract.schema;

/**
 * Validates an untyped value (a decoded JSON tree, a header map, or an
 * application object) and produces a typed one.
 *
 * <p>Implementations must be thread-safe; a single instance is shared by every
 * publish and every delivery that references its message definition.</p>
 *
 * @param <T> validated value type
 */
@FunctionalInterface
public interface MessageSchema<T> {

    SchemaValidationResult<T> validate(Object input);

    /**
     * Schema that accepts anything and returns the input unchanged.
     */
    static MessageSchema<Object> any() {
        return SchemaValidationResult::success;
    }
}
