package com.homelab.ops.backend;

import com.fasterxml.jackson.core.JsonProcessingException;
import jakarta.ws.rs.ProcessingException;
import jakarta.ws.rs.WebApplicationException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs a REST client call and turns whatever the client throws into a {@link BackendException}.
 *
 * <p>The REST client wraps transport errors in {@link ProcessingException} and reports
 * non-2xx responses as {@link WebApplicationException}; the cause chain tells which is which.
 */
public final class BackendFailures {

    private static final int MAX_CAUSE_DEPTH = 16;

    private BackendFailures() {
    }

    public static <T> T call(String backend, String endpoint, int timeoutSeconds, Supplier<T> request) {
        try {
            return request.get();
        } catch (WebApplicationException | ProcessingException e) {
            throw classify(backend, endpoint, timeoutSeconds, e);
        }
    }

    public static BackendException classify(String backend, String endpoint, int timeoutSeconds, RuntimeException e) {
        Throwable current = e;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (current instanceof BackendException) {
                return (BackendException) current;
            }
            if (current instanceof WebApplicationException) {
                int status = ((WebApplicationException) current).getResponse().getStatus();
                return BackendException.httpStatus(backend, endpoint, status, e);
            }
            if (isTimeout(current)) {
                return BackendException.timeout(backend, endpoint, timeoutSeconds, e);
            }
            if (current instanceof ConnectException
                || current instanceof UnknownHostException
                || current instanceof NoRouteToHostException) {
                return BackendException.connect(backend, endpoint, current);
            }
            if (current instanceof JsonProcessingException) {
                return BackendException.invalidResponse(backend, endpoint, current.getMessage(), e);
            }
            current = current.getCause();
        }
        return BackendException.connect(backend, endpoint, e);
    }

    // Netty and Vert.x report timeouts with their own exception types, some of them ConnectException subclasses.
    private static boolean isTimeout(Throwable t) {
        return t instanceof SocketTimeoutException
            || t instanceof TimeoutException
            || t.getClass().getSimpleName().contains("Timeout");
    }
}
