package com.intteq.amqp.contract.exception;

import com.intteq.amqp.contract.schema.ValidationIssue;
import lombok.Getter;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A payload or header map failed its schema.
 *
 * <p>{@link #getSource()} is the publisher name on the publish side and the
 * consumer name on the consume side.</p>
 */
@Getter
public class MessageValidationException extends AmqpContractException {

    private final String source;
    private final List<ValidationIssue> issues;

    public MessageValidationException(String source, List<ValidationIssue> issues) {
        super("Message validation failed for \"" + source + "\": " + describe(issues));
        this.source = source;
        this.issues = List.copyOf(issues);
    }

    private static String describe(List<ValidationIssue> issues) {
        return issues.stream()
                .map(ValidationIssue::toString)
                .collect(Collectors.joining("; "));
    }
}
