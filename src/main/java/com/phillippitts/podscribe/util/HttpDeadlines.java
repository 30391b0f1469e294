package com.phillippitts.podscribe.util;

import java.io.IOException;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Puts a wall-clock limit on a whole HTTP exchange, body included.
 *
 * <p>{@code HttpRequest.timeout} only covers the wait for response headers; a server that stalls
 * mid-body would otherwise hold the caller indefinitely.
 */
public final class HttpDeadlines {

    private HttpDeadlines() {
    }

    /**
     * Waits for {@code exchange} to finish, body included, within {@code deadline}.
     *
     * <p>On timeout or interrupt the exchange is cancelled, which aborts the underlying connection.
     *
     * @throws HttpTimeoutException if the deadline passes first
     * @throws IOException          the transport failure reported by the client
     */
    public static <T> HttpResponse<T> await(CompletableFuture<HttpResponse<T>> exchange, Duration deadline)
            throws IOException, InterruptedException {
        try {
            return exchange.get(deadline.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            exchange.cancel(true);
            HttpTimeoutException timeout = new HttpTimeoutException(
                    "Exchange did not complete within " + deadline.toMillis() + "ms");
            timeout.initCause(e);
            throw timeout;
        } catch (InterruptedException e) {
            exchange.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException io) {
                throw io;
            }
            throw new IOException(cause == null ? e.getMessage() : cause.getMessage(), cause);
        }
    }
}
