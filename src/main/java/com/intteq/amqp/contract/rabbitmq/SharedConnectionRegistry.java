package com.intteq.amqp.contract.rabbitmq;

import com.intteq.amqp.contract.exception.TechnicalException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.rabbit.connection.CachingConnectionFactory;
import org.springframework.amqp.rabbit.connection.CachingConnectionFactory.CacheMode;
import org.springframework.beans.factory.DisposableBean;

import java.net.URI;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Reference-counted connection factories keyed by broker URLs and options.
 *
 * <p>Every client and worker acquires a {@link ConnectionLease}. Leases for the
 * same URLs and options share one {@link CachingConnectionFactory}; it is
 * destroyed when its last lease is closed.</p>
 *
 * <p>Factories are configured for channel caching, correlated publisher confirms
 * and returns.</p>
 *
 * <p>Thread-safe.</p>
 */
@Slf4j
public class SharedConnectionRegistry implements DisposableBean {

    private final Map<String, Entry> entries = new HashMap<>();

    public ConnectionLease acquire(List<URI> urls) {
        return acquire(urls, ConnectionOptions.defaults());
    }

    public synchronized ConnectionLease acquire(List<URI> urls, ConnectionOptions options) {
        if (urls == null || urls.isEmpty()) {
            throw new TechnicalException("At least one broker URL is required");
        }
        String key = key(urls, options);

        Entry entry = entries.computeIfAbsent(key, k -> new Entry(createConnectionFactory(urls, options)));
        entry.refCount++;
        log.debug("Connection lease acquired → urls={} refCount={}", redact(urls), entry.refCount);

        return new ConnectionLease(entry.factory, () -> release(key));
    }

    public synchronized int referenceCount(List<URI> urls, ConnectionOptions options) {
        Entry entry = entries.get(key(urls, options));
        return entry == null ? 0 : entry.refCount;
    }

    public synchronized int size() {
        return entries.size();
    }

    private synchronized void release(String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return;
        }
        entry.refCount--;
        if (entry.refCount <= 0) {
            entries.remove(key);
            entry.factory.destroy();
            log.info("RabbitMQ connection closed, last lease released");
        }
    }

    @Override
    public synchronized void destroy() {
        entries.values().forEach(e -> e.factory.destroy());
        entries.clear();
    }

    // =====================================================================
    // FACTORY CREATION
    // =====================================================================

    static CachingConnectionFactory createConnectionFactory(List<URI> urls, ConnectionOptions options) {
        CachingConnectionFactory factory = new CachingConnectionFactory();

        try {
            factory.setUri(urls.get(0));
        } catch (IllegalArgumentException e) {
            throw new TechnicalException("Invalid broker URL: " + redact(urls.subList(0, 1)), e);
        }
        if (urls.size() > 1) {
            factory.setAddresses(urls.stream()
                    .map(SharedConnectionRegistry::address)
                    .collect(Collectors.joining(",")));
        }

        factory.setConnectionTimeout((int) options.getConnectionTimeout().toMillis());
        factory.setRequestedHeartBeat((int) options.getRequestedHeartbeat().getSeconds());

        factory.setCacheMode(CacheMode.CHANNEL);
        factory.setChannelCacheSize(options.getChannelCacheSize());
        factory.setChannelCheckoutTimeout(options.getChannelCheckoutTimeout().toMillis());

        factory.setPublisherConfirmType(CachingConnectionFactory.ConfirmType.CORRELATED);
        factory.setPublisherReturns(true);

        log.info("RabbitMQ ConnectionFactory initialized: urls={}", redact(urls));
        return factory;
    }

    private static String address(URI uri) {
        int port = uri.getPort();
        if (port < 0) {
            port = "amqps".equalsIgnoreCase(uri.getScheme()) ? 5671 : 5672;
        }
        return uri.getHost() + ":" + port;
    }

    private static String key(List<URI> urls, ConnectionOptions options) {
        return urls.stream().map(URI::toString).collect(Collectors.joining("|")) + "#" + options;
    }

    private static String redact(List<URI> urls) {
        return urls.stream()
                .map(u -> u.getScheme() + "://" + u.getHost() + (u.getPort() > 0 ? ":" + u.getPort() : ""))
                .collect(Collectors.joining(","));
    }

    private static final class Entry {
        private final CachingConnectionFactory factory;
        private int refCount;

        private Entry(CachingConnectionFactory factory) {
            this.factory = factory;
        }
    }
}
