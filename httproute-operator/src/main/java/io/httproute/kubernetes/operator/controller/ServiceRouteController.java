/*
 * Copyright httproute-operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.httproute.kubernetes.operator.controller;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.api.model.gatewayapi.v1.HTTPRoute;
import io.fabric8.kubernetes.api.model.gatewayapi.v1beta1.ReferenceGrant;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.informers.SharedIndexInformer;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;

import io.httproute.kubernetes.operator.HttpRoutes;
import io.httproute.kubernetes.operator.ReconcileState;
import io.httproute.kubernetes.operator.ResourcesUtil;
import io.httproute.kubernetes.operator.ServiceReconciler;
import io.httproute.kubernetes.operator.StandardLabels;
import io.httproute.tag.VisibleForTesting;

/**
 * Wires informers on {@code Service}s and on the managed {@link HTTPRoute}s and {@link ReferenceGrant}s
 * to a {@link ReconcileQueue} whose workers invoke the {@link ServiceReconciler}.
 * <p>
 * Events on derived resources are mapped back to their {@code Service}, so that a derived resource that is
 * edited or deleted by someone else gets repaired. Periodic informer resyncs re-reconcile every service.
 * </p>
 */
public class ServiceRouteController implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(ServiceRouteController.class);

    static final String RECONCILIATIONS_METRIC = "httproute.operator.reconciliations";
    static final String FAILURES_METRIC = "httproute.operator.reconciliation.failures";
    static final String QUEUE_DEPTH_METRIC = "httproute.operator.queue.depth";

    private static final Duration RETRY_BASE_DELAY = Duration.ofMillis(5);
    private static final Duration RETRY_MAX_DELAY = Duration.ofSeconds(1000);

    private final KubernetesClient client;
    private final ServiceReconciler reconciler;
    private final Duration resyncPeriod;
    private final MeterRegistry meterRegistry;
    private final ReconcileQueue<ResourceKey> queue;
    private final Counter failures;
    private final List<SharedIndexInformer<?>> informers = new ArrayList<>();

    public ServiceRouteController(KubernetesClient client,
                                  ServiceReconciler reconciler,
                                  int workerCount,
                                  Duration resyncPeriod,
                                  MeterRegistry meterRegistry) {
        this(client, reconciler, workerCount, resyncPeriod, meterRegistry, RETRY_BASE_DELAY, RETRY_MAX_DELAY);
    }

    @VisibleForTesting
    ServiceRouteController(KubernetesClient client,
                           ServiceReconciler reconciler,
                           int workerCount,
                           Duration resyncPeriod,
                           MeterRegistry meterRegistry,
                           Duration retryBaseDelay,
                           Duration retryMaxDelay) {
        this.client = Objects.requireNonNull(client);
        this.reconciler = Objects.requireNonNull(reconciler);
        this.resyncPeriod = Objects.requireNonNull(resyncPeriod);
        this.meterRegistry = Objects.requireNonNull(meterRegistry);
        this.queue = new ReconcileQueue<>("service-reconciler", workerCount, retryBaseDelay, retryMaxDelay, this::reconcile);
        this.failures = Counter.builder(FAILURES_METRIC)
                .description("Reconciliations that failed and will be retried")
                .register(meterRegistry);
        Gauge.builder(QUEUE_DEPTH_METRIC, queue, ReconcileQueue::depth)
                .description("Services waiting to be reconciled")
                .register(meterRegistry);
    }

    /**
     * Starts the workers, then the informers. Returns once every informer has completed its initial list.
     */
    public void start() {
        queue.start();
        long resyncMillis = resyncPeriod.toMillis();
        informers.add(client.services()
                .inAnyNamespace()
                .inform(new EnqueueingEventHandler<>(service -> Optional.of(ResourceKey.of(service)), queue::add), resyncMillis));
        informers.add(client.resources(HTTPRoute.class)
                .inAnyNamespace()
                .withLabel(StandardLabels.MANAGED_BY_LABEL, StandardLabels.MANAGED_BY_VALUE)
                .inform(new EnqueueingEventHandler<>(StandardLabels::sourceServiceOf, queue::add), resyncMillis));
        informers.add(client.resources(ReferenceGrant.class)
                .inAnyNamespace()
                .withLabel(StandardLabels.MANAGED_BY_LABEL, StandardLabels.MANAGED_BY_VALUE)
                .inform(new EnqueueingEventHandler<>(ServiceRouteController::owningService, queue::add), resyncMillis));
        LOGGER.info("Watching services, HTTPRoutes and ReferenceGrants in all namespaces (resync every {})", resyncPeriod);
    }

    /**
     * @return true if every informer is running
     */
    public boolean isHealthy() {
        return !informers.isEmpty() && informers.stream().allMatch(SharedIndexInformer::isRunning);
    }

    @VisibleForTesting
    ReconcileQueue<ResourceKey> queue() {
        return queue;
    }

    @VisibleForTesting
    static Optional<ResourceKey> owningService(ReferenceGrant grant) {
        return ResourcesUtil.controllerOwnerName(grant, HttpRoutes.SERVICE_KIND)
                .map(serviceName -> new ResourceKey(ResourcesUtil.namespace(grant), serviceName));
    }

    private void reconcile(ResourceKey key) {
        try {
            ReconcileState state = reconciler.reconcile(key);
            meterRegistry.counter(RECONCILIATIONS_METRIC, "state", state.name()).increment();
        }
        catch (RuntimeException e) {
            failures.increment();
            throw e;
        }
    }

    @Override
    public void close() {
        informers.forEach(SharedIndexInformer::stop);
        informers.clear();
        queue.close();
    }
}
