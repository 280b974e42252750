package com.intteq.amqp.contract.worker;

import com.intteq.amqp.contract.retry.RetryHeaders;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;
import org.springframework.amqp.core.Message;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A validated delivery handed to a {@link ConsumerHandler}.
 *
 * <ul>
 *     <li>{@link #payload()}: the payload after schema validation</li>
 *     <li>{@link #headers()}: the validated header value when the message declares a
 *         header schema, otherwise {@code null}</li>
 *     <li>{@link #rawHeaders()}: every AMQP header, including retry bookkeeping</li>
 *     <li>{@link #message()}: the raw Spring AMQP message</li>
 * </ul>
 *
 * @param <P> payload type
 */
@Getter
@Accessors(fluent = true)
@ToString(exclude = "message")
public final class ConsumedMessage<P> {

    private final String consumerName;
    private final P payload;
    private final Object headers;
    private final Map<String, Object> rawHeaders;
    private final Message message;

    public ConsumedMessage(String consumerName, P payload, Object headers, Message message) {
        this.consumerName = Objects.requireNonNull(consumerName, "consumerName must not be null");
        this.payload = payload;
        this.headers = headers;
        this.message = Objects.requireNonNull(message, "message must not be null");
        this.rawHeaders = Map.copyOf(nonNullValues(message.getMessageProperties().getHeaders()));
    }

    /**
     * @return number of retries already performed for this message
     */
    public int retryCount() {
        return RetryHeaders.retryCount(rawHeaders);
    }

    public <H> H headersAs(Class<H> type) {
        return type.cast(headers);
    }

    private static Map<String, Object> nonNullValues(Map<String, Object> headers) {
        Map<String, Object> copy = new LinkedHashMap<>();
        headers.forEach((k, v) -> {
            if (v != null) {
                copy.put(k, v);
            }
        });
        return copy;
    }
}
