package com.resonanceloop.engine.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.resonanceloop.common.model.TransportErrorKind;
import io.netty.handler.timeout.ReadTimeoutException;
import org.springframework.web.reactive.function.client.WebClientRequestException;

import java.io.IOException;
import java.net.ConnectException;
import java.net.UnknownHostException;
import java.util.concurrent.TimeoutException;

/**
 * Maps raw exchanges and client-side exceptions onto {@link TransportErrorKind}.
 *
 * <pre>
 *   429, 529            → RATE_LIMITED
 *   408, 504            → TIMEOUT
 *   other 4xx           → MALFORMED_REQUEST
 *   other non-2xx       → UPSTREAM_ERROR
 *   2xx, blank content  → EMPTY_CONTENT
 * </pre>
 */
public final class FailureClassifier {

    private static final int MAX_CAUSE_DEPTH = 8;

    private FailureClassifier() {}

    /**
     * @return the failure class, or {@code null} when the exchange carries usable content
     */
    public static TransportErrorKind classify(RawExchange exchange) {
        int status = exchange.statusCode();
        if (status >= 200 && status < 300) {
            return exchange.content() == null || exchange.content().isBlank()
                ? TransportErrorKind.EMPTY_CONTENT
                : null;
        }
        if (status == 429 || status == 529) return TransportErrorKind.RATE_LIMITED;
        if (status == 408 || status == 504) return TransportErrorKind.TIMEOUT;
        if (status >= 400 && status < 500) return TransportErrorKind.MALFORMED_REQUEST;
        return TransportErrorKind.UPSTREAM_ERROR;
    }

    public static TransportErrorKind classify(Throwable error) {
        if (hasCause(error, TimeoutException.class) || hasCause(error, ReadTimeoutException.class)) {
            return TransportErrorKind.TIMEOUT;
        }
        if (error instanceof WebClientRequestException
                || hasCause(error, ConnectException.class)
                || hasCause(error, UnknownHostException.class)) {
            return TransportErrorKind.CONNECTION_ERROR;
        }
        if (error instanceof JsonProcessingException
                || error instanceof IllegalArgumentException
                || error instanceof IllegalStateException) {
            return TransportErrorKind.MALFORMED_REQUEST;
        }
        if (hasCause(error, IOException.class)) {
            return TransportErrorKind.CONNECTION_ERROR;
        }
        return TransportErrorKind.UPSTREAM_ERROR;
    }

    private static boolean hasCause(Throwable error, Class<? extends Throwable> type) {
        Throwable current = error;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (type.isInstance(current)) return true;
            current = current.getCause();
        }
        return false;
    }
}
