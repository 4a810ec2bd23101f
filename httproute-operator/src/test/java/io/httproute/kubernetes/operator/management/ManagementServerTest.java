/*
 * Copyright httproute-operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.httproute.kubernetes.operator.management;

import java.io.IOException;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.sun.net.httpserver.Headers;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ManagementServerTest {

    @Mock
    HttpExchange exchange;

    @Mock
    HttpHandler delegate;

    @Mock
    HttpServer httpServer;

    @Test
    void shouldDelegateGet() throws IOException {
        // given
        when(exchange.getRequestMethod()).thenReturn("GET");

        // when
        ManagementServer.getOnly(delegate).handle(exchange);

        // then
        verify(delegate).handle(exchange);
        verify(exchange).close();
    }

    @ParameterizedTest
    @ValueSource(strings = { "POST", "PUT", "DELETE", "HEAD", "OPTIONS", "PATCH", "TRACE", "CONNECT" })
    void shouldRejectOtherMethods(String method) throws IOException {
        // given
        Headers responseHeaders = new Headers();
        when(exchange.getRequestMethod()).thenReturn(method);
        when(exchange.getResponseHeaders()).thenReturn(responseHeaders);

        // when
        ManagementServer.getOnly(delegate).handle(exchange);

        // then
        verify(delegate, never()).handle(any());
        verify(exchange).sendResponseHeaders(405, -1);
        assertThat(responseHeaders.getFirst("Allow")).isEqualTo("GET");
        verify(exchange).close();
    }

    @Test
    void shouldServeStatusFromSupplier() throws IOException {
        // given
        ArgumentCaptor<HttpHandler> captor = ArgumentCaptor.forClass(HttpHandler.class);
        ManagementServer server = new ManagementServer(httpServer);
        server.addStatusEndpoint("/livez", () -> 503);
        verify(httpServer).createContext(eq("/livez"), captor.capture());
        when(exchange.getRequestMethod()).thenReturn("GET");

        // when
        captor.getValue().handle(exchange);

        // then
        verify(exchange).sendResponseHeaders(503, -1);
    }

    @Test
    void shouldGuardEndpointHandler() throws IOException {
        // given
        ArgumentCaptor<HttpHandler> captor = ArgumentCaptor.forClass(HttpHandler.class);
        ManagementServer server = new ManagementServer(httpServer);
        server.addEndpoint("/metrics", delegate);
        verify(httpServer).createContext(eq("/metrics"), captor.capture());
        when(exchange.getRequestMethod()).thenReturn("GET");

        // when
        captor.getValue().handle(exchange);

        // then
        verify(delegate).handle(exchange);
    }

    @Test
    void shouldRejectPostToEndpointHandler() throws IOException {
        // given
        ArgumentCaptor<HttpHandler> captor = ArgumentCaptor.forClass(HttpHandler.class);
        ManagementServer server = new ManagementServer(httpServer);
        server.addEndpoint("/metrics", delegate);
        verify(httpServer).createContext(eq("/metrics"), captor.capture());
        when(exchange.getRequestMethod()).thenReturn("POST");
        when(exchange.getResponseHeaders()).thenReturn(new Headers());

        // when
        captor.getValue().handle(exchange);

        // then
        verify(delegate, never()).handle(any());
        verify(exchange).sendResponseHeaders(405, -1);
    }

    @Test
    void shouldAnswerUnknownPathsWithNotFound() throws IOException {
        // given
        ArgumentCaptor<HttpHandler> captor = ArgumentCaptor.forClass(HttpHandler.class);
        new ManagementServer(httpServer);
        verify(httpServer).createContext(eq("/"), captor.capture());
        when(exchange.getRequestMethod()).thenReturn("GET");

        // when
        captor.getValue().handle(exchange);

        // then
        verify(exchange).sendResponseHeaders(404, -1);
    }

    @Test
    void shouldStartAndStopServer() {
        ManagementServer server = new ManagementServer(httpServer);
        server.start();
        server.stop();
        verify(httpServer).start();
        verify(httpServer).stop(0);
    }
}
