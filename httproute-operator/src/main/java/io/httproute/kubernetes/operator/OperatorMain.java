/*
 * Copyright httproute-operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.httproute.kubernetes.operator;

import java.io.IOException;
import java.time.Clock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.sun.net.httpserver.HttpServer;

import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.ConfigBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import io.prometheus.metrics.exporter.httpserver.MetricsHandler;

import io.httproute.kubernetes.operator.controller.ServiceRouteController;
import io.httproute.kubernetes.operator.management.ManagementServer;
import io.httproute.tag.VisibleForTesting;

/**
 * The {@code main} method entrypoint for the operator
 */
public class OperatorMain {

    private static final Logger LOGGER = LoggerFactory.getLogger(OperatorMain.class);

    private final OperatorConfig config;
    private final KubernetesClient kubeClient;
    private final ServiceRouteController controller;
    private final ManagementServer managementServer;

    public OperatorMain(OperatorConfig config) throws IOException {
        this(config, newKubernetesClient(config), ManagementServer.createHttpServer(config.bindAddress()));
    }

    @VisibleForTesting
    OperatorMain(OperatorConfig config, KubernetesClient kubeClient, HttpServer httpServer) {
        this.config = config;
        this.kubeClient = kubeClient;
        this.managementServer = new ManagementServer(httpServer);
        PrometheusMeterRegistry prometheusMeterRegistry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        Metrics.globalRegistry.add(prometheusMeterRegistry);
        managementServer.addEndpoint(ManagementServer.HTTP_PATH_METRICS, new MetricsHandler(prometheusMeterRegistry.getPrometheusRegistry()));
        KubernetesEventReporter reporter = new KubernetesEventReporter(kubeClient, Clock.systemUTC());
        ServiceReconciler reconciler = new ServiceReconciler(kubeClient, config.gatewayDefaults(), reporter);
        this.controller = new ServiceRouteController(kubeClient, reconciler, config.workerCount(), config.resyncPeriod(), Metrics.globalRegistry);
    }

    public static void main(String[] args) {
        try {
            OperatorMain operatorMain = new OperatorMain(OperatorConfig.fromEnvironment(System.getenv()));
            Runtime.getRuntime().addShutdownHook(new Thread(operatorMain::stop, "shutdown"));
            operatorMain.start();
        }
        catch (Exception e) {
            LOGGER.error("Operator has thrown exception during startup. Will now exit.", e);
            System.exit(1);
        }
    }

    /**
     * Starts the operator instance and returns once that has completed successfully.
     */
    void start() {
        managementServer.start();
        managementServer.addStatusEndpoint(ManagementServer.HTTP_PATH_LIVEZ, this::livezStatusCode);
        controller.start();
        LOGGER.atInfo().setMessage("Operator started (default gateway: {}/{}, section: {}, workers: {})")
                .addArgument(() -> config.gatewayDefaults().gatewayNamespace())
                .addArgument(() -> config.gatewayDefaults().gatewayName())
                .addArgument(() -> config.gatewayDefaults().sectionName())
                .addArgument(config::workerCount)
                .log();
    }

    @VisibleForTesting
    int livezStatusCode() {
        int sc;
        try {
            sc = controller.isHealthy() ? 200 : 400;
        }
        catch (Exception e) {
            sc = 400;
            LOGGER.error("Ignoring exception caught while getting operator health info", e);
        }
        (sc != 200 ? LOGGER.atWarn() : LOGGER.atDebug()).log("Responding {} to GET {}", sc, ManagementServer.HTTP_PATH_LIVEZ);
        return sc;
    }

    void stop() {
        controller.close();
        managementServer.stop();
        kubeClient.close();
        LOGGER.info("Operator stopped.");
    }

    private static KubernetesClient newKubernetesClient(OperatorConfig config) {
        // every API request made while reconciling is bounded by the reconcile timeout
        Config kubeConfig = new ConfigBuilder(Config.autoConfigure(null))
                .withRequestTimeout(Math.toIntExact(config.reconcileTimeout().toMillis()))
                .build();
        return new KubernetesClientBuilder().withConfig(kubeConfig).build();
    }
}
