package com.homelab.ops.backend;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.core.JsonParseException;
import jakarta.ws.rs.ProcessingException;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Response;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import org.junit.jupiter.api.Test;

class BackendFailuresTest {

    private static final String URL = "http://prometheus:9090";

    @Test
    void connectionRefusedIsConnect() {
        BackendException e = classify(new ProcessingException(new ConnectException("Connection refused")));

        assertThat(e.getKind()).isEqualTo(BackendException.Kind.CONNECT);
        assertThat(e.getMessage()).isEqualTo("Cannot connect to Prometheus at http://prometheus:9090: Connection refused");
        assertThat(e.getEndpoint()).isEqualTo(URL);
    }

    @Test
    void unknownHostIsConnect() {
        BackendException e = classify(new ProcessingException(new UnknownHostException("prometheus")));

        assertThat(e.getKind()).isEqualTo(BackendException.Kind.CONNECT);
    }

    @Test
    void readTimeoutIsTimeout() {
        BackendException e = classify(new ProcessingException(
            new RuntimeException(new SocketTimeoutException("Read timed out"))));

        assertThat(e.getKind()).isEqualTo(BackendException.Kind.TIMEOUT);
        assertThat(e.getMessage()).startsWith("Prometheus query timed out after 15s");
    }

    @Test
    void timeoutSubclassOfConnectExceptionIsTimeout() {
        BackendException e = classify(new ProcessingException(new ConnectTimeoutException("connection timed out")));

        assertThat(e.getKind()).isEqualTo(BackendException.Kind.TIMEOUT);
    }

    @Test
    void errorStatusIsHttpStatus() {
        Response response = mock(Response.class);
        when(response.getStatus()).thenReturn(503);

        BackendException e = classify(new WebApplicationException("Service Unavailable", null, response));

        assertThat(e.getKind()).isEqualTo(BackendException.Kind.HTTP_STATUS);
        assertThat(e.getStatusCode()).isEqualTo(503);
        assertThat(e.getMessage()).startsWith("Prometheus API error: HTTP 503");
    }

    @Test
    void undecodableBodyIsInvalidResponse() {
        BackendException e = classify(new ProcessingException(new JsonParseException(null, "Unexpected character '<'")));

        assertThat(e.getKind()).isEqualTo(BackendException.Kind.INVALID_RESPONSE);
    }

    @Test
    void callPassesResultThrough() {
        assertThat(BackendFailures.call("Prometheus", URL, 15, () -> "ok")).isEqualTo("ok");
    }

    @Test
    void callLeavesProgrammingErrorsAlone() {
        assertThatThrownBy(() -> BackendFailures.call("Prometheus", URL, 15, () -> {
            throw new IllegalStateException("bug");
        })).isExactlyInstanceOf(IllegalStateException.class);
    }

    @Test
    void callTranslatesClientFailures() {
        assertThatThrownBy(() -> BackendFailures.call("TrueNAS", "https://truenas.lan", 15, () -> {
            throw new ProcessingException(new ConnectException("Connection refused"));
        }))
            .isInstanceOf(BackendException.class)
            .hasMessageStartingWith("Cannot connect to TrueNAS at https://truenas.lan");
    }

    private static BackendException classify(RuntimeException e) {
        return BackendFailures.classify("Prometheus", URL, 15, e);
    }

    /** Stands in for Netty's connect timeout, which is a ConnectException. */
    private static class ConnectTimeoutException extends ConnectException {
        ConnectTimeoutException(String message) {
            super(message);
        }
    }
}
