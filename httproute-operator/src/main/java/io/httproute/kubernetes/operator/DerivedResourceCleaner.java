/*
 * Copyright httproute-operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.httproute.kubernetes.operator;

import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.api.model.gatewayapi.v1.HTTPRoute;
import io.fabric8.kubernetes.api.model.gatewayapi.v1beta1.ReferenceGrant;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.dsl.Resource;

import io.httproute.kubernetes.operator.controller.ResourceKey;

import static io.httproute.kubernetes.operator.ResourcesUtil.name;
import static io.httproute.kubernetes.operator.ResourcesUtil.namespace;

/**
 * Removes the resources derived from a {@code Service} once it is no longer exposed or is being deleted.
 * <p>
 * The HTTPRoute lives in the gateway namespace, where the service's owner reference would not be honoured,
 * so it has to be deleted explicitly. It is looked up in the namespace the annotations currently resolve to,
 * and then by its source labels in every namespace, which also finds routes left in a gateway namespace the
 * annotations no longer name. Resources that are already gone count as cleaned up.
 * </p>
 */
public class DerivedResourceCleaner {

    private static final Logger LOGGER = LoggerFactory.getLogger(DerivedResourceCleaner.class);

    private final KubernetesClient client;
    private final GatewayDefaults defaults;
    private final EventReporter reporter;

    public DerivedResourceCleaner(KubernetesClient client, GatewayDefaults defaults, EventReporter reporter) {
        this.client = Objects.requireNonNull(client);
        this.defaults = Objects.requireNonNull(defaults);
        this.reporter = Objects.requireNonNull(reporter);
    }

    /**
     * Deletes every HTTPRoute and then the ReferenceGrant derived from the given service, if they exist.
     * @param service the service
     * @throws io.fabric8.kubernetes.client.KubernetesClientException if an existing resource could not be deleted
     */
    public void cleanup(Service service) {
        String gatewayNamespace = Annotations.readGatewayNamespaceFrom(service, defaults);
        String routeName = HttpRoutes.routeName(service);
        if (deleteIfPresent(client.resources(HTTPRoute.class).inNamespace(gatewayNamespace).withName(routeName))) {
            reporter.report(service, EventReason.HTTP_ROUTE_DELETED, "Deleted HTTPRoute " + gatewayNamespace + "/" + routeName);
        }
        for (HTTPRoute route : labelledHttpRoutes(ResourceKey.of(service))) {
            deleteLabelled(route, service);
        }

        String grantName = ReferenceGrants.grantName(service);
        if (deleteIfPresent(client.resources(ReferenceGrant.class).inNamespace(namespace(service)).withName(grantName))) {
            reporter.report(service, EventReason.REFERENCE_GRANT_DELETED, "Deleted ReferenceGrant " + namespace(service) + "/" + grantName);
        }
    }

    /**
     * Deletes HTTPRoutes derived from the given service that live outside its current gateway namespace.
     * @param service the exposed service
     * @param gatewayNamespace the namespace holding the route that is kept
     * @throws io.fabric8.kubernetes.client.KubernetesClientException if a route could not be listed or deleted
     */
    public void deleteStaleHttpRoutes(Service service, String gatewayNamespace) {
        for (HTTPRoute route : labelledHttpRoutes(ResourceKey.of(service))) {
            if (!gatewayNamespace.equals(namespace(route))) {
                deleteLabelled(route, service);
            }
        }
    }

    /**
     * Deletes HTTPRoutes derived from a service that no longer exists.
     * This happens when the service went away before the finalizer was added.
     * The ReferenceGrant is left to garbage collection through its owner reference.
     * @param serviceKey identifies the deleted service
     * @throws io.fabric8.kubernetes.client.KubernetesClientException if a route could not be listed or deleted
     */
    public void deleteOrphanedHttpRoutes(ResourceKey serviceKey) {
        for (HTTPRoute route : labelledHttpRoutes(serviceKey)) {
            client.resource(route).delete();
            LOGGER.atInfo()
                    .setMessage("Deleted orphaned HTTPRoute {}/{} of deleted service {}")
                    .addArgument(() -> namespace(route))
                    .addArgument(() -> name(route))
                    .addArgument(serviceKey)
                    .log();
        }
    }

    private List<HTTPRoute> labelledHttpRoutes(ResourceKey serviceKey) {
        return client.resources(HTTPRoute.class)
                .inAnyNamespace()
                .withLabels(StandardLabels.derivedFrom(serviceKey))
                .list()
                .getItems();
    }

    private void deleteLabelled(HTTPRoute route, Service service) {
        client.resource(route).delete();
        LOGGER.atInfo()
                .setMessage("Deleted HTTPRoute {}/{} of service {}/{}")
                .addArgument(() -> namespace(route))
                .addArgument(() -> name(route))
                .addArgument(() -> namespace(service))
                .addArgument(() -> name(service))
                .log();
        reporter.report(service, EventReason.HTTP_ROUTE_DELETED, "Deleted HTTPRoute " + namespace(route) + "/" + name(route));
    }

    private static <T extends HasMetadata> boolean deleteIfPresent(Resource<T> resource) {
        T existing = resource.get();
        if (existing == null) {
            return false;
        }
        resource.delete();
        LOGGER.atInfo()
                .setMessage("Deleted {} {}/{}")
                .addArgument(existing::getKind)
                .addArgument(() -> namespace(existing))
                .addArgument(() -> name(existing))
                .log();
        return true;
    }
}
