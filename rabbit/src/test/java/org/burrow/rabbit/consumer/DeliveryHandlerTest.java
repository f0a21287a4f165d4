package org.burrow.rabbit.consumer;

import com.rabbitmq.client.Channel;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class DeliveryHandlerTest {

    private static final long TAG = 42L;
    private static final byte[] BODY = "payload".getBytes(StandardCharsets.UTF_8);

    private final Channel channel = mock(Channel.class);

    private static DeliveryHandler<String> handler(MessageCallback<String> callback,
                                                   boolean autoAck, boolean nackOnFalse, boolean requeueOnNack) {
        return new DeliveryHandler<>("test", body -> new String(body, StandardCharsets.UTF_8), callback,
                autoAck, nackOnFalse, requeueOnNack);
    }

    @ParameterizedTest(name = "callback={0} nackOnFalse={1} requeueOnNack={2} -> {3}")
    @CsvSource({
            "true,  false, false, ACKED",
            "true,  true,  false, ACKED",
            "true,  true,  true,  ACKED",
            "false, false, false, LEFT_UNACKED",
            "false, false, true,  LEFT_UNACKED",
            "false, true,  false, NACKED",
            "false, true,  true,  NACKED_REQUEUED"
    })
    void settlesAccordingToCallbackResult(boolean result, boolean nackOnFalse, boolean requeueOnNack,
                                          AckOutcome expected) throws Exception {
        var handler = handler(m -> result, false, nackOnFalse, requeueOnNack);

        assertEquals(expected, handler.handle(channel, TAG, BODY));

        switch (expected) {
            case ACKED -> {
                verify(channel).basicAck(TAG, false);
                verify(channel, never()).basicNack(anyLong(), anyBoolean(), anyBoolean());
            }
            case LEFT_UNACKED -> verifyNoInteractions(channel);
            case NACKED, NACKED_REQUEUED -> {
                verify(channel).basicNack(TAG, false, requeueOnNack);
                verify(channel, never()).basicAck(anyLong(), anyBoolean());
            }
            default -> fail("unexpected outcome " + expected);
        }
    }

    @Test
    void throwingCallbackCountsAsFalse() throws Exception {
        var handler = handler(m -> {
            throw new IllegalStateException("boom");
        }, false, true, true);

        assertEquals(AckOutcome.NACKED_REQUEUED, handler.handle(channel, TAG, BODY));
        verify(channel).basicNack(TAG, false, true);
    }

    @Test
    void autoAckNeverSettles() {
        assertEquals(AckOutcome.AUTO_ACKED, handler(m -> true, true, true, true).handle(channel, TAG, BODY));
        assertEquals(AckOutcome.AUTO_ACKED_FAILED, handler(m -> false, true, true, true).handle(channel, TAG, BODY));
        verifyNoInteractions(channel);
    }

    @Test
    void nullDeserializationLeavesDeliveryUnacked() {
        var calls = new int[1];
        var handler = new DeliveryHandler<String>("test", body -> null, m -> {
            calls[0]++;
            return true;
        }, false, true, true);

        assertEquals(AckOutcome.NOT_DESERIALIZED, handler.handle(channel, TAG, BODY));
        assertEquals(0, calls[0]);
        verifyNoInteractions(channel);
    }

    @Test
    void deserializerExceptionLeavesDeliveryUnacked() {
        var handler = new DeliveryHandler<String>("test", body -> {
            throw new IOException("not json");
        }, m -> true, false, true, false);

        assertEquals(AckOutcome.NOT_DESERIALIZED, handler.handle(channel, TAG, BODY));
        verifyNoInteractions(channel);
    }

    @Test
    void ackFailureIsReported() throws Exception {
        doThrow(new IOException("channel closed")).when(channel).basicAck(anyLong(), anyBoolean());

        var outcome = handler(m -> true, false, false, false).handle(channel, TAG, BODY);

        assertEquals(AckOutcome.ACK_FAILED, outcome);
        assertFalse(outcome.isSuccess());
    }
}
