package org.burrow.rabbit.lifecycle;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * One-shot cancellation signal. Waits on a token wake up as soon as it is cancelled,
 * so retry and poll delays never have to run to completion.
 */
public final class CancellationToken {

    private final CompletableFuture<Void> signal = new CompletableFuture<>();

    /**
     * A fresh token that nobody else holds, so it is never cancelled.
     */
    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        signal.complete(null);
    }

    public boolean isCancelled() {
        return signal.isDone();
    }

    /**
     * Wait up to {@code timeout} for cancellation.
     *
     * @return true if the token was cancelled before the timeout elapsed
     */
    public boolean await(Duration timeout) throws InterruptedException {
        if (isCancelled()) {
            return true;
        }
        if (timeout.isZero() || timeout.isNegative()) {
            return false;
        }
        try {
            signal.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (ExecutionException e) {
            return true;
        }
    }

    @Override
    public String toString() {
        return isCancelled() ? "CancellationToken[cancelled]" : "CancellationToken[active]";
    }
}
