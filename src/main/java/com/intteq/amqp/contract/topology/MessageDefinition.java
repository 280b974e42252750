package com.intteq.amqp.contract.topology;

import com.intteq.amqp.contract.schema.MessageSchema;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.Objects;

/**
 * Payload schema plus optional header schema, with documentation metadata.
 */
@Getter
@ToString
public final class MessageDefinition {

    private final MessageSchema<?> payload;
    private final MessageSchema<?> headers;
    private final String summary;
    private final String description;

    @Builder
    private MessageDefinition(MessageSchema<?> payload,
                              MessageSchema<?> headers,
                              String summary,
                              String description) {
        this.payload = Objects.requireNonNull(payload, "payload schema must not be null");
        this.headers = headers;
        this.summary = summary;
        this.description = description;
    }

    public static MessageDefinition of(MessageSchema<?> payload) {
        return new MessageDefinition(payload, null, null, null);
    }

    public static MessageDefinition of(MessageSchema<?> payload, MessageSchema<?> headers) {
        return new MessageDefinition(payload, headers, null, null);
    }

    public boolean hasHeaderSchema() {
        return headers != null;
    }
}
