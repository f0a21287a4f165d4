package org.burrow.rabbit.lifecycle;

import com.rabbitmq.client.Channel;

import java.io.IOException;

/**
 * Runs on a freshly opened channel before the connection is reported as usable:
 * QoS, topology declarations, confirm mode.
 */
@FunctionalInterface
public interface ConnectionSetup {

    ConnectionSetup NONE = (channel, cancellation) -> { };

    void configure(Channel channel, CancellationToken cancellation) throws IOException;
}
