/*
 * Copyright httproute-operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.httproute.kubernetes.operator.management;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.Properties;
import java.util.function.IntSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;

import io.httproute.tag.VisibleForTesting;

/**
 * Serves the operator's GET-only management endpoints. Any other HTTP method is answered with
 * <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Status/405">405 Method Not Allowed</a>,
 * and paths without an endpoint with 404.
 */
public class ManagementServer {

    private static final Logger LOGGER = LoggerFactory.getLogger(ManagementServer.class);

    public static final String HTTP_PATH_LIVEZ = "/livez";
    public static final String HTTP_PATH_METRICS = "/metrics";

    private final HttpServer httpServer;

    public ManagementServer(HttpServer httpServer) {
        this.httpServer = Objects.requireNonNull(httpServer);
        this.httpServer.createContext("/", getOnly(exchange -> exchange.sendResponseHeaders(404, -1)));
    }

    /**
     * Binds a new server to the given address. The JDK server's request and response time limits are
     * tightened unless already set as system properties.
     * @param bindAddress where to listen
     * @return the unstarted server
     * @throws IOException if the address cannot be bound
     */
    public static HttpServer createHttpServer(InetSocketAddress bindAddress) throws IOException {
        final Properties systemProps = System.getProperties();
        if (!systemProps.containsKey("sun.net.httpserver.maxReqTime")) {
            System.setProperty("sun.net.httpserver.maxReqTime", "60");
        }
        if (!systemProps.containsKey("sun.net.httpserver.maxRspTime")) {
            System.setProperty("sun.net.httpserver.maxRspTime", "120");
        }
        LOGGER.info("Starting management server on: {}:{}", bindAddress.getHostString(), bindAddress.getPort());
        return HttpServer.create(bindAddress, 0);
    }

    /**
     * Adds an endpoint responding with an empty body and the supplied status code, e.g. a liveness check.
     * @param path the context path
     * @param statusCode supplies the status code for each request
     */
    public void addStatusEndpoint(String path, IntSupplier statusCode) {
        httpServer.createContext(path, getOnly(exchange -> exchange.sendResponseHeaders(statusCode.getAsInt(), -1)));
    }

    /**
     * Adds an endpoint served by the given handler, behind the GET-only guard.
     * @param path the context path
     * @param handler handles GET requests
     */
    public void addEndpoint(String path, HttpHandler handler) {
        httpServer.createContext(path, getOnly(handler));
    }

    public void start() {
        httpServer.start();
    }

    public void stop() {
        httpServer.stop(0);
    }

    @VisibleForTesting
    static HttpHandler getOnly(HttpHandler delegate) {
        return exchange -> {
            try (HttpExchange ex = exchange) {
                // the request body is deliberately not read: GET requests have none, and we won't buffer anything else
                if ("GET".equalsIgnoreCase(ex.getRequestMethod())) {
                    delegate.handle(ex);
                }
                else {
                    ex.getResponseHeaders().add("Allow", "GET");
                    ex.sendResponseHeaders(405, -1);
                }
            }
        };
    }
}
