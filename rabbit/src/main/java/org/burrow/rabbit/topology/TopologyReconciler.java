package org.burrow.rabbit.topology;

import com.rabbitmq.client.Channel;
import org.burrow.rabbit.config.ExchangeDeclaration;
import org.burrow.rabbit.config.QueueDeclaration;
import org.burrow.rabbit.lifecycle.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Best-effort topology setup on a live channel.
 *
 * <p>Every declaration is attempted independently. A failure is logged and the remaining
 * declarations still run: a passive declaration fails whenever the resource has not been
 * created yet, which is routine.</p>
 */
public class TopologyReconciler {

    private static final Logger log = LoggerFactory.getLogger(TopologyReconciler.class);

    public static final Duration MANAGEMENT_RETRY_DELAY = Duration.ofMillis(500);

    private final Duration managementRetryDelay;

    public TopologyReconciler() {
        this(MANAGEMENT_RETRY_DELAY);
    }

    public TopologyReconciler(Duration managementRetryDelay) {
        this.managementRetryDelay = managementRetryDelay;
    }

    /**
     * @return true if the exchange was declared (or asserted) successfully
     */
    public boolean declareExchange(Channel channel, String exchange, ExchangeDeclaration declaration) {
        try {
            if (declaration.passive()) {
                channel.exchangeDeclarePassive(exchange);
            } else {
                channel.exchangeDeclare(exchange, declaration.type(), declaration.durable(),
                        declaration.autoDelete(), declaration.arguments());
            }
            log.debug("Declared exchange {} (passive={})", exchange, declaration.passive());
            return true;
        } catch (Exception e) {
            log.warn("{} declaration of exchange {} failed: {}",
                    declaration.passive() ? "Passive" : "Active", exchange, e.getMessage());
            return false;
        }
    }

    /**
     * @return true if the queue was declared (or asserted) successfully
     */
    public boolean declareQueue(Channel channel, String queue, QueueDeclaration declaration) {
        try {
            if (declaration.passive()) {
                channel.queueDeclarePassive(queue);
            } else {
                channel.queueDeclare(queue, declaration.durable(), declaration.exclusive(),
                        declaration.autoDelete(), declaration.declarationArguments());
            }
            log.debug("Declared queue {} (passive={})", queue, declaration.passive());
            return true;
        } catch (Exception e) {
            log.warn("{} declaration of queue {} failed: {}",
                    declaration.passive() ? "Passive" : "Active", queue, e.getMessage());
            return false;
        }
    }

    /**
     * Bind {@code queue} to {@code exchange} once per routing key.
     *
     * @return number of bindings that succeeded
     */
    public int bind(Channel channel, String queue, String exchange, Collection<String> routingKeys) {
        int bound = 0;
        for (String routingKey : routingKeys) {
            try {
                channel.queueBind(queue, exchange, routingKey);
                bound++;
            } catch (Exception e) {
                log.warn("Binding {} -> {} [{}] failed: {}", exchange, queue, routingKey, e.getMessage());
            }
        }
        return bound;
    }

    /**
     * Remove bindings of {@code queue} whose routing key is not one of {@code routingKeys}
     * (case-insensitive). Bindings without a source exchange are never touched.
     *
     * <p>Each HTTP call is retried with a fixed delay until it succeeds or
     * {@code cancellation} fires.</p>
     *
     * @return the bindings removed, or null if cancelled before completion
     */
    public List<Binding> reconcileBindings(ManagementClient client, String vhost, String queue,
                                           Collection<String> routingKeys, CancellationToken cancellation) {
        List<Binding> current = null;
        while (current == null) {
            try {
                log.info("Listing bindings for queue {}", queue);
                current = client.listQueueBindings(vhost, queue);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return null;
            } catch (Exception e) {
                log.error("Error listing bindings of queue {} via {}: {}", queue, client.baseUrl(), e.getMessage());
                if (pause(cancellation)) return null;
            }
        }

        List<Binding> unexpected = unexpectedBindings(current, routingKeys);
        List<Binding> removed = new ArrayList<>();
        for (Binding binding : unexpected) {
            log.debug("Removing unused binding {} -> {} [{}]", binding.source(), queue, binding.routingKey());
            boolean deleted = false;
            while (!deleted) {
                try {
                    client.deleteBinding(vhost, binding);
                    deleted = true;
                    removed.add(binding);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return null;
                } catch (Exception e) {
                    log.error("Error deleting binding {} of queue {}: {}", binding.propertiesKey(), queue, e.getMessage());
                    if (pause(cancellation)) return null;
                }
            }
        }
        if (!removed.isEmpty()) {
            log.info("Removed {} unexpected binding(s) from queue {}", removed.size(), queue);
        }
        return removed;
    }

    static List<Binding> unexpectedBindings(List<Binding> bindings, Collection<String> routingKeys) {
        Set<String> expected = routingKeys.stream()
                .map(k -> k.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
        return bindings.stream()
                .filter(Binding::hasSource)
                .filter(b -> b.routingKey() == null || !expected.contains(b.routingKey().toLowerCase(Locale.ROOT)))
                .collect(Collectors.toList());
    }

    private boolean pause(CancellationToken cancellation) {
        try {
            return cancellation.await(managementRetryDelay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
    }
}
