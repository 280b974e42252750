package com.intteq.amqp.contract.schema;

import java.util.Objects;

/**
 * One schema violation. {@code path} is a dotted property path, empty for the root value.
 */
public final class ValidationIssue {

    private final String path;
    private final String message;

    private ValidationIssue(String path, String message) {
        this.path = path == null ? "" : path;
        this.message = Objects.requireNonNull(message, "message must not be null");
    }

    public static ValidationIssue of(String path, String message) {
        return new ValidationIssue(path, message);
    }

    public String path() {
        return path;
    }

    public String message() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ValidationIssue)) return false;
        ValidationIssue that = (ValidationIssue) o;
        return path.equals(that.path) && message.equals(that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(path, message);
    }

    @Override
    public String toString() {
        return path.isEmpty() ? message : path + ": " + message;
    }
}
