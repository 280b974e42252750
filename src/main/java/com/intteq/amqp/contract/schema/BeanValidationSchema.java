package com.intteq.amqp.contract.schema;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * {@link MessageSchema} backed by a Java type annotated with Jakarta Bean Validation
 * constraints.
 *
 * <p>Input that is not already an instance of the target type is converted with
 * Jackson first. Unknown properties are ignored, so a header map carrying broker
 * headers such as {@code x-retry-count} still maps onto a narrow header type.</p>
 *
 * <pre>
 * public record OrderCreated(@NotBlank String orderId, @Positive double amount) {}
 *
 * MessageSchema&lt;OrderCreated&gt; schema = BeanValidationSchema.of(OrderCreated.class);
 * </pre>
 *
 * @param <T> target type
 */
public final class BeanValidationSchema<T> implements MessageSchema<T> {

    private static final ValidatorFactory DEFAULT_FACTORY = Validation.buildDefaultValidatorFactory();

    private final Class<T> type;
    private final ObjectMapper objectMapper;
    private final Validator validator;

    private BeanValidationSchema(Class<T> type, ObjectMapper objectMapper, Validator validator) {
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.objectMapper = objectMapper.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
    }

    public static <T> BeanValidationSchema<T> of(Class<T> type) {
        return new BeanValidationSchema<>(type, new ObjectMapper().findAndRegisterModules(),
                DEFAULT_FACTORY.getValidator());
    }

    public static <T> BeanValidationSchema<T> of(Class<T> type, ObjectMapper objectMapper, Validator validator) {
        return new BeanValidationSchema<>(type, objectMapper, validator);
    }

    public Class<T> type() {
        return type;
    }

    @Override
    public SchemaValidationResult<T> validate(Object input) {
        if (input == null) {
            return SchemaValidationResult.failure(List.of(
                    ValidationIssue.of("", "value is required")));
        }

        T candidate;
        if (type.isInstance(input)) {
            candidate = type.cast(input);
        } else {
            try {
                candidate = objectMapper.convertValue(input, type);
            } catch (IllegalArgumentException e) {
                return SchemaValidationResult.failure(List.of(
                        ValidationIssue.of("", "cannot be read as " + type.getSimpleName()
                                + ": " + rootMessage(e))));
            }
        }

        Set<ConstraintViolation<T>> violations = validator.validate(candidate);
        if (violations.isEmpty()) {
            return SchemaValidationResult.success(candidate);
        }

        List<ValidationIssue> issues = violations.stream()
                .map(v -> ValidationIssue.of(v.getPropertyPath().toString(), v.getMessage()))
                .sorted(Comparator.comparing(ValidationIssue::path).thenComparing(ValidationIssue::message))
                .collect(Collectors.toList());
        return SchemaValidationResult.failure(issues);
    }

    private static String rootMessage(Throwable e) {
        Throwable current = e;
        while (current.getCause() != null) {
            current = current.getCause();
        }
        String message = current.getMessage();
        if (message == null) {
            return current.getClass().getSimpleName();
        }
        int newline = message.indexOf('\n');
        return newline > 0 ? message.substring(0, newline) : message;
    }
}
