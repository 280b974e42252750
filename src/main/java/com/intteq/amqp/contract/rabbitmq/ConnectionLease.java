package com.intteq.amqp.contract.rabbitmq;

import com.intteq.amqp.contract.exception.TechnicalException;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A handle on a (possibly shared) connection factory. Closing the lease
 * releases this holder's reference; the connection itself closes only when
 * the last lease on it is released.
 *
 * <p>Closing twice is a no-op.</p>
 */
public final class ConnectionLease implements AutoCloseable {

    private final ConnectionFactory connectionFactory;
    private final Runnable release;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    ConnectionLease(ConnectionFactory connectionFactory, Runnable release) {
        this.connectionFactory = Objects.requireNonNull(connectionFactory, "connectionFactory must not be null");
        this.release = release;
    }

    /**
     * Wraps a factory owned by someone else, e.g. a Spring bean. Closing the lease
     * leaves the factory open.
     */
    public static ConnectionLease unmanaged(ConnectionFactory connectionFactory) {
        return new ConnectionLease(connectionFactory, () -> { });
    }

    /**
     * @throws TechnicalException if the lease was already released
     */
    public ConnectionFactory connectionFactory() {
        if (closed.get()) {
            throw new TechnicalException("Connection lease has been released");
        }
        return connectionFactory;
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            release.run();
        }
    }
}
