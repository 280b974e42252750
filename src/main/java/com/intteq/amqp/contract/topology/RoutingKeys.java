package com.intteq.amqp.contract.topology;

import com.intteq.amqp.contract.exception.ContractConfigurationException;
import com.intteq.amqp.contract.exception.ContractConfigurationException.Code;

import java.util.Map;

/**
 * Routing-key rules shared by bindings and publishers.
 */
public final class RoutingKeys {

    private RoutingKeys() {
    }

    public static boolean containsWildcards(String routingKey) {
        return routingKey != null && (routingKey.contains("*") || routingKey.contains("#"));
    }

    /**
     * Topic-exchange match: words are dot-separated, {@code *} matches exactly one
     * word and {@code #} matches zero or more words.
     */
    public static boolean matches(String pattern, String routingKey) {
        String[] patternWords = pattern.isEmpty() ? new String[0] : pattern.split("\\.", -1);
        String[] keyWords = routingKey.isEmpty() ? new String[0] : routingKey.split("\\.", -1);
        return matches(patternWords, 0, keyWords, 0);
    }

    private static boolean matches(String[] pattern, int p, String[] key, int k) {
        if (p == pattern.length) {
            return k == key.length;
        }
        String word = pattern[p];
        if ("#".equals(word)) {
            for (int skip = k; skip <= key.length; skip++) {
                if (matches(pattern, p + 1, key, skip)) {
                    return true;
                }
            }
            return false;
        }
        if (k == key.length) {
            return false;
        }
        if ("*".equals(word) || word.equals(key[k])) {
            return matches(pattern, p + 1, key, k + 1);
        }
        return false;
    }

    /**
     * Normalizes the routing key for the given exchange: fanout ignores it,
     * direct and topic require one.
     */
    static String resolve(ExchangeDefinition exchange, String routingKey, String owner) {
        if (!exchange.getType().requiresRoutingKey()) {
            return routingKey == null ? "" : routingKey;
        }
        if (routingKey == null || routingKey.isEmpty()) {
            throw new ContractConfigurationException(Code.MISSING_ROUTING_KEY,
                    owner + " on " + exchange.getType().amqpType() + " exchange \""
                            + exchange.getName() + "\" requires a routing key",
                    Map.of("exchange", exchange.getName()));
        }
        return routingKey;
    }
}
