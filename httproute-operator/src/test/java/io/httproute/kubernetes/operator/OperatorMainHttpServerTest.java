/*
 * Copyright httproute-operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.httproute.kubernetes.operator;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.sun.net.httpserver.HttpServer;

import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.server.mock.EnableKubernetesMockClient;

import io.httproute.kubernetes.operator.management.ManagementServer;

import static org.assertj.core.api.Assertions.assertThat;

@EnableKubernetesMockClient(crud = true)
class OperatorMainHttpServerTest {

    private static final OperatorConfig CONFIG = new OperatorConfig(
            new GatewayDefaults("shared-gateway", "gateway-system", "https"),
            1,
            Duration.ofSeconds(30),
            Duration.ofMinutes(10),
            new InetSocketAddress("127.0.0.1", 0));

    KubernetesClient kubeClient;

    private OperatorMain operatorMain;
    private URI baseUri;
    private final HttpClient httpClient = HttpClient.newHttpClient();

    @BeforeEach
    void setUp() throws IOException {
        HttpServer httpServer = ManagementServer.createHttpServer(CONFIG.bindAddress());
        baseUri = URI.create("http://127.0.0.1:" + httpServer.getAddress().getPort());
        operatorMain = new OperatorMain(CONFIG, kubeClient, httpServer);
        operatorMain.start();
    }

    @AfterEach
    void tearDown() {
        operatorMain.stop();
    }

    @Test
    void shouldServePrometheusTextFormat() throws Exception {
        // Given
        HttpRequest request = HttpRequest.newBuilder(baseUri.resolve(ManagementServer.HTTP_PATH_METRICS)).GET().build();

        // When
        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

        // Then
        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.headers().firstValue("Content-Type")).hasValueSatisfying(contentType -> assertThat(contentType).startsWith("text/plain"));
        assertThat(response.body()).contains("httproute_operator_queue_depth");
    }

    @Test
    void shouldNegotiateOpenMetricsFormat() throws Exception {
        // Given
        HttpRequest request = HttpRequest.newBuilder(baseUri.resolve(ManagementServer.HTTP_PATH_METRICS))
                .header("Accept", "application/openmetrics-text; version=1.0.0")
                .GET()
                .build();

        // When
        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

        // Then
        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.headers().firstValue("Content-Type"))
                .hasValueSatisfying(contentType -> assertThat(contentType).startsWith("application/openmetrics-text"));
        assertThat(response.body()).contains("# EOF");
    }

    @Test
    void shouldRejectPostToMetrics() throws Exception {
        // Given
        HttpRequest request = HttpRequest.newBuilder(baseUri.resolve(ManagementServer.HTTP_PATH_METRICS))
                .POST(HttpRequest.BodyPublishers.noBody())
                .build();

        // When
        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

        // Then
        assertThat(response.statusCode()).isEqualTo(405);
        assertThat(response.headers().firstValue("Allow")).contains("GET");
    }

    @Test
    void shouldServeLivez() throws Exception {
        // Given
        HttpRequest request = HttpRequest.newBuilder(baseUri.resolve(ManagementServer.HTTP_PATH_LIVEZ)).GET().build();

        // When
        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

        // Then
        assertThat(response.statusCode()).isEqualTo(200);
    }

    @Test
    void shouldLimitRequestAndResponseTime() {
        assertThat(System.getProperty("sun.net.httpserver.maxReqTime")).isNotNull();
        assertThat(System.getProperty("sun.net.httpserver.maxRspTime")).isNotNull();
    }
}
