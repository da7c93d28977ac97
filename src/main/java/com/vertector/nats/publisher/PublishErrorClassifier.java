package com.vertector.nats.publisher;

import io.nats.client.AuthenticationException;
import io.nats.client.JetStreamApiException;

import java.io.IOException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Decides whether a failed publish attempt is worth repeating.
 *
 * <h2>Rules</h2>
 * <ul>
 *   <li>{@link EventValidationException}, {@link AuthenticationException},
 *       {@link IllegalArgumentException} and {@link IllegalStateException} are permanent.</li>
 *   <li>{@link JetStreamApiException} is transient for server-side codes 408, 429 and
 *       5xx, and permanent for other 4xx codes (for example no stream matching the subject
 *       or a wrong expected sequence).</li>
 *   <li>{@link IOException} and {@link TimeoutException} are transient.</li>
 *   <li>Anything else is treated as transient.</li>
 * </ul>
 *
 * <p>{@link ExecutionException} and {@link CompletionException} are unwrapped first.</p>
 */
public class PublishErrorClassifier {

    public boolean isRetryable(Throwable error) {
        Throwable t = unwrap(error);
        if (t instanceof EventValidationException
                || t instanceof AuthenticationException
                || t instanceof IllegalArgumentException
                || t instanceof IllegalStateException) {
            return false;
        }
        if (t instanceof JetStreamApiException jsae) {
            return isRetryableStatus(jsae.getErrorCode());
        }
        return true;
    }

    static boolean isRetryableStatus(int status) {
        if (status == 408 || status == 429 || status >= 500) {
            return true;
        }
        return status < 400;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable t = error;
        while ((t instanceof ExecutionException || t instanceof CompletionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }
}
