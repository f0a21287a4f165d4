package org.burrow.rabbit.config;

import java.util.Map;

/**
 * How an exchange is declared on connect.
 *
 * @param passive    only assert that the exchange exists
 * @param type       exchange type: topic, direct, fanout or headers
 * @param durable    survive broker restarts
 * @param autoDelete delete when the last binding is removed
 * @param arguments  extra declaration arguments, may be empty
 */
public record ExchangeDeclaration(
        boolean passive,
        String type,
        boolean durable,
        boolean autoDelete,
        Map<String, Object> arguments
) {
    public ExchangeDeclaration {
        type = type == null ? "topic" : type;
        arguments = arguments == null ? Map.of() : Map.copyOf(arguments);
    }

    public static ExchangeDeclaration passiveTopic() {
        return new ExchangeDeclaration(true, "topic", true, false, null);
    }

    public static ExchangeDeclaration topic() {
        return new ExchangeDeclaration(false, "topic", true, false, null);
    }
}
