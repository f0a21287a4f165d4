package org.burrow.rabbit.routing;

import java.util.Objects;

/**
 * Stock {@link RoutingKeyGenerator}s.
 */
public final class RoutingKeys {

    /** Matches everything on a topic exchange. */
    public static final String WILDCARD = "#";

    private RoutingKeys() {
    }

    public static <T> RoutingKeyGenerator<T> wildcard() {
        return constant(WILDCARD);
    }

    public static <T> RoutingKeyGenerator<T> constant(String routingKey) {
        Objects.requireNonNull(routingKey, "routingKey");
        return payload -> routingKey;
    }
}
