package com.intteq.amqp.contract.schema;

import java.util.List;
import java.util.NoSuchElementException;

/**
 * Outcome of {@link MessageSchema#validate(Object)}: either a typed value or
 * a non-empty list of issues.
 *
 * @param <T> validated value type
 */
public final class SchemaValidationResult<T> {

    private final T value;
    private final List<ValidationIssue> issues;

    private SchemaValidationResult(T value, List<ValidationIssue> issues) {
        this.value = value;
        this.issues = issues;
    }

    public static <T> SchemaValidationResult<T> success(T value) {
        return new SchemaValidationResult<>(value, List.of());
    }

    public static <T> SchemaValidationResult<T> failure(List<ValidationIssue> issues) {
        if (issues == null || issues.isEmpty()) {
            throw new IllegalArgumentException("A failed validation must carry at least one issue");
        }
        return new SchemaValidationResult<>(null, List.copyOf(issues));
    }

    public boolean isValid() {
        return issues.isEmpty();
    }

    public T value() {
        if (!isValid()) {
            throw new NoSuchElementException("Validation failed: " + issues);
        }
        return value;
    }

    public List<ValidationIssue> issues() {
        return issues;
    }
}
