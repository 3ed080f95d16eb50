package com.homelab.ops.backend;

/**
 * A call to Prometheus or TrueNAS failed. {@link #getMessage()} is written for the end user.
 */
public class BackendException extends RuntimeException {

    public enum Kind {
        CONNECT,
        TIMEOUT,
        HTTP_STATUS,
        INVALID_RESPONSE
    }

    private final String backend;
    private final String endpoint;
    private final Kind kind;
    private final int statusCode;

    public BackendException(String backend, String endpoint, Kind kind, int statusCode,
                            String message, Throwable cause) {
        super(message, cause);
        this.backend = backend;
        this.endpoint = endpoint;
        this.kind = kind;
        this.statusCode = statusCode;
    }

    public static BackendException connect(String backend, String endpoint, Throwable cause) {
        return new BackendException(backend, endpoint, Kind.CONNECT, 0,
            String.format("Cannot connect to %s at %s: %s", backend, endpoint, describe(cause)), cause);
    }

    public static BackendException timeout(String backend, String endpoint, int timeoutSeconds, Throwable cause) {
        return new BackendException(backend, endpoint, Kind.TIMEOUT, 0,
            String.format("%s query timed out after %ds (%s)", backend, timeoutSeconds, endpoint), cause);
    }

    public static BackendException httpStatus(String backend, String endpoint, int statusCode, Throwable cause) {
        return new BackendException(backend, endpoint, Kind.HTTP_STATUS, statusCode,
            String.format("%s API error: HTTP %d (%s)", backend, statusCode, endpoint), cause);
    }

    public static BackendException invalidResponse(String backend, String endpoint, String detail, Throwable cause) {
        return new BackendException(backend, endpoint, Kind.INVALID_RESPONSE, 0,
            String.format("%s returned an invalid response (%s): %s", backend, endpoint, detail), cause);
    }

    public String getBackend() {
        return backend;
    }

    public String getEndpoint() {
        return endpoint;
    }

    public Kind getKind() {
        return kind;
    }

    public int getStatusCode() {
        return statusCode;
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown error";
        }
        String message = cause.getMessage();
        return message != null ? message : cause.getClass().getSimpleName();
    }
}
