package org.burrow.rabbit.config;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * How a queue is declared on connect.
 *
 * @param passive    only assert that the queue exists
 * @param exclusive  restrict the queue to the declaring connection
 * @param type       queue type sent as {@code x-queue-type} ("classic", "quorum", "stream"), may be null
 * @param durable    survive broker restarts
 * @param autoDelete delete when the last consumer unsubscribes
 * @param arguments  extra declaration arguments, may be empty
 */
public record QueueDeclaration(
        boolean passive,
        boolean exclusive,
        String type,
        boolean durable,
        boolean autoDelete,
        Map<String, Object> arguments
) {
    public static final String QUEUE_TYPE_ARGUMENT = "x-queue-type";

    public QueueDeclaration {
        arguments = arguments == null ? Map.of() : Map.copyOf(arguments);
    }

    public static QueueDeclaration defaults() {
        return new QueueDeclaration(false, true, "classic", true, false, null);
    }

    public static QueueDeclaration shared() {
        return new QueueDeclaration(false, false, "classic", true, false, null);
    }

    /**
     * Arguments passed to {@code queue.declare}, including the queue type when set.
     */
    public Map<String, Object> declarationArguments() {
        Map<String, Object> args = new LinkedHashMap<>(arguments);
        if (type != null && !type.isBlank()) {
            args.putIfAbsent(QUEUE_TYPE_ARGUMENT, type);
        }
        return args;
    }
}
