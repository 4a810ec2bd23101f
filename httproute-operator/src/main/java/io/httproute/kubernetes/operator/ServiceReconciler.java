/*
 * Copyright httproute-operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.httproute.kubernetes.operator;

import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.api.model.ServiceBuilder;
import io.fabric8.kubernetes.api.model.gatewayapi.v1.HTTPRoute;
import io.fabric8.kubernetes.api.model.gatewayapi.v1beta1.ReferenceGrant;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.dsl.Resource;

import io.httproute.kubernetes.operator.controller.ResourceKey;
import io.httproute.tag.RunsOnThread;

import static io.httproute.kubernetes.operator.Annotations.HTTPROUTE_FINALIZER;
import static io.httproute.kubernetes.operator.ResourcesUtil.hasFinalizer;
import static io.httproute.kubernetes.operator.ResourcesUtil.isBeingDeleted;
import static io.httproute.kubernetes.operator.ResourcesUtil.name;
import static io.httproute.kubernetes.operator.ResourcesUtil.namespace;

/**
 * <p>Reconciles a {@code Service} by deriving an {@link HTTPRoute} (in the gateway namespace) and a
 * {@link ReferenceGrant} (in the service namespace) from its {@code httproute.controller/*} annotations.</p>
 *
 * <p>Each invocation re-reads the service and evaluates, in order: deletion requested, not exposed,
 * invalid annotations, exposed. Nothing is cached between invocations.</p>
 *
 * <p>The HTTPRoute cannot be owned by the service across namespaces, so its lifecycle hangs off the
 * {@link Annotations#HTTPROUTE_FINALIZER} finalizer. That finalizer is added only after both derived
 * resources have been written; an interrupted invocation is completed by the next one because every
 * write is an idempotent upsert. Should the service disappear before the finalizer is in place, the next
invocation finds it missing and deletes any route still labelled as derived from it.</p>
 *
 * <p>The reconciler never retries. Any {@link KubernetesClientException} (conflict, timeout, unavailability)
 * propagates to the caller, which is expected to re-invoke it for the same key later.
 * Callers must not run two reconciliations of the same key concurrently.</p>
 */
public class ServiceReconciler {

    private static final Logger LOGGER = LoggerFactory.getLogger(ServiceReconciler.class);

    private final KubernetesClient client;
    private final GatewayDefaults defaults;
    private final EventReporter reporter;
    private final DerivedResourceCleaner cleaner;

    public ServiceReconciler(KubernetesClient client, GatewayDefaults defaults, EventReporter reporter) {
        this.client = Objects.requireNonNull(client);
        this.defaults = Objects.requireNonNull(defaults);
        this.reporter = Objects.requireNonNull(reporter);
        this.cleaner = new DerivedResourceCleaner(client, defaults, reporter);
    }

    /**
     * Brings the resources derived from the identified service in line with its annotations.
     * @param key identifies the service
     * @return the state the service was found in
     * @throws KubernetesClientException if the API server could not be read or written; the caller should retry
     */
    @RunsOnThread("reconciliation worker")
    public ReconcileState reconcile(ResourceKey key) {
        Service service = serviceResource(key).get();
        if (service == null) {
            LOGGER.debug("Service {} no longer exists", key);
            cleaner.deleteOrphanedHttpRoutes(key);
            return ReconcileState.SOURCE_NOT_FOUND;
        }

        if (isBeingDeleted(service)) {
            if (hasFinalizer(service, HTTPROUTE_FINALIZER)) {
                cleaner.cleanup(service);
                removeFinalizer(key);
                LOGGER.info("Cleaned up derived resources of deleted service {}", key);
            }
            return ReconcileState.DELETING;
        }

        Optional<ExposureIntent> intent;
        try {
            intent = Annotations.readExposureIntentFrom(service, defaults);
        }
        catch (InvalidResourceException e) {
            LOGGER.warn("Service {} has invalid exposure annotations: {}", key, e.getMessage());
            reporter.report(service, EventReason.HTTP_ROUTE_FAILED, e.getMessage());
            return ReconcileState.INVALID_CONFIG;
        }

        if (intent.isEmpty()) {
            cleaner.cleanup(service);
            if (hasFinalizer(service, HTTPROUTE_FINALIZER)) {
                removeFinalizer(key);
                LOGGER.info("Service {} is no longer exposed", key);
            }
            return ReconcileState.INACTIVE;
        }

        reconcileExposed(service, intent.get());
        if (!hasFinalizer(service, HTTPROUTE_FINALIZER)) {
            addFinalizer(key);
        }
        if (LOGGER.isInfoEnabled()) {
            LOGGER.info("Completed reconciliation of {}/{} (hostname: {})", namespace(service), name(service), intent.get().hostname());
        }
        return ReconcileState.ACTIVE;
    }

    private void reconcileExposed(Service service, ExposureIntent intent) {
        HTTPRoute desiredRoute = HttpRoutes.desiredHttpRoute(service, intent);
        boolean routeWritten;
        try {
            routeWritten = upsertHttpRoute(desiredRoute);
            cleaner.deleteStaleHttpRoutes(service, intent.gatewayNamespace());
        }
        catch (KubernetesClientException e) {
            reporter.report(service, EventReason.HTTP_ROUTE_FAILED, e.getMessage());
            throw e;
        }
        if (routeWritten) {
            reporter.report(service, EventReason.HTTP_ROUTE_RECONCILED,
                    "HTTPRoute " + name(desiredRoute) + " in " + intent.gatewayNamespace());
        }

        if (intent.skipReferenceGrant()) {
            if (routeWritten) {
                reporter.report(service, EventReason.REFERENCE_GRANT_SKIPPED,
                        "ReferenceGrant management disabled by " + Annotations.SKIP_REFERENCE_GRANT_ANNOTATION_KEY);
            }
            return;
        }

        ReferenceGrant desiredGrant = ReferenceGrants.desiredReferenceGrant(service, intent);
        try {
            if (upsertReferenceGrant(desiredGrant)) {
                reporter.report(service, EventReason.REFERENCE_GRANT_RECONCILED,
                        "ReferenceGrant " + name(desiredGrant) + " allows HTTPRoutes from " + intent.gatewayNamespace());
            }
        }
        catch (KubernetesClientException e) {
            reporter.report(service, EventReason.REFERENCE_GRANT_FAILED, e.getMessage());
            throw e;
        }
    }

    /**
     * Creates the route, or replaces the whole spec of the existing one when a field this operator sets differs.
     * Metadata of an existing route is left alone.
     * @return true if anything was written
     */
    private boolean upsertHttpRoute(HTTPRoute desired) {
        HTTPRoute existing = client.resources(HTTPRoute.class)
                .inNamespace(namespace(desired))
                .withName(name(desired))
                .get();
        if (existing == null) {
            client.resource(desired).create();
            LOGGER.debug("Created HTTPRoute {}/{}", namespace(desired), name(desired));
            return true;
        }
        if (HttpRoutes.hasDesiredSpec(existing, desired)) {
            return false;
        }
        existing.setSpec(desired.getSpec());
        client.resource(existing).update();
        LOGGER.debug("Updated HTTPRoute {}/{}", namespace(desired), name(desired));
        return true;
    }

    /**
     * Creates the grant, or replaces the spec and owner references of the existing one.
     * @return true if anything was written
     */
    private boolean upsertReferenceGrant(ReferenceGrant desired) {
        ReferenceGrant existing = client.resources(ReferenceGrant.class)
                .inNamespace(namespace(desired))
                .withName(name(desired))
                .get();
        if (existing == null) {
            client.resource(desired).create();
            LOGGER.debug("Created ReferenceGrant {}/{}", namespace(desired), name(desired));
            return true;
        }
        if (Objects.equals(existing.getSpec(), desired.getSpec())
                && Objects.equals(existing.getMetadata().getOwnerReferences(), desired.getMetadata().getOwnerReferences())) {
            return false;
        }
        existing.setSpec(desired.getSpec());
        existing.getMetadata().setOwnerReferences(desired.getMetadata().getOwnerReferences());
        client.resource(existing).update();
        LOGGER.debug("Updated ReferenceGrant {}/{}", namespace(desired), name(desired));
        return true;
    }

    // edit() re-reads the service and patches only the difference, so concurrent changes by others survive
    private void addFinalizer(ResourceKey key) {
        serviceResource(key).edit(fresh -> hasFinalizer(fresh, HTTPROUTE_FINALIZER) ? fresh
                : new ServiceBuilder(fresh).editMetadata().addToFinalizers(HTTPROUTE_FINALIZER).endMetadata().build());
    }

    private void removeFinalizer(ResourceKey key) {
        serviceResource(key).edit(fresh -> new ServiceBuilder(fresh).editMetadata().removeFromFinalizers(HTTPROUTE_FINALIZER).endMetadata().build());
    }

    private Resource<Service> serviceResource(ResourceKey key) {
        return client.services().inNamespace(key.namespace()).withName(key.name());
    }
}
