package org.burrow.rabbit.routing;

/**
 * Chooses the routing key for a payload.
 */
@FunctionalInterface
public interface RoutingKeyGenerator<T> {

    String routingKey(T payload);
}
