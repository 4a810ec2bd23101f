/*
 * Copyright httproute-operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.httproute.kubernetes.operator;

import java.util.List;
import java.util.Objects;

import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.api.model.gatewayapi.v1.HTTPBackendRefBuilder;
import io.fabric8.kubernetes.api.model.gatewayapi.v1.HTTPRoute;
import io.fabric8.kubernetes.api.model.gatewayapi.v1.HTTPRouteBuilder;
import io.fabric8.kubernetes.api.model.gatewayapi.v1.HTTPRouteRuleBuilder;
import io.fabric8.kubernetes.api.model.gatewayapi.v1.HTTPRouteSpec;
import io.fabric8.kubernetes.api.model.gatewayapi.v1.HTTPRouteSpecBuilder;
import io.fabric8.kubernetes.api.model.gatewayapi.v1.ParentReferenceBuilder;

import edu.umd.cs.findbugs.annotations.Nullable;

import static io.httproute.kubernetes.operator.ResourcesUtil.name;
import static io.httproute.kubernetes.operator.ResourcesUtil.namespace;

/**
 * Computes the desired {@link HTTPRoute} for an exposed {@code Service}.
 */
public class HttpRoutes {

    public static final String GATEWAY_API_GROUP = "gateway.networking.k8s.io";
    public static final String GATEWAY_KIND = "Gateway";
    public static final String SERVICE_KIND = "Service";
    public static final String CORE_GROUP = "";

    private HttpRoutes() {
    }

    /**
     * The name of the HTTPRoute derived from the given service. It includes the service namespace
     * because routes from many namespaces share the gateway namespace.
     * @param service the service
     * @return {@code <namespace>-<name>}
     */
    public static String routeName(Service service) {
        return namespace(service) + "-" + name(service);
    }

    /**
     * Builds the desired route. Every reference carries an explicit namespace, even when it equals the route's own.
     * @param service the exposed service
     * @param intent the resolved exposure intent
     * @return the desired route, placed in the gateway namespace
     */
    public static HTTPRoute desiredHttpRoute(Service service, ExposureIntent intent) {
        // @formatter:off
        return new HTTPRouteBuilder()
                .withNewMetadata()
                    .withName(routeName(service))
                    .withNamespace(intent.gatewayNamespace())
                    .withLabels(StandardLabels.derivedFrom(service))
                .endMetadata()
                .withNewSpec()
                    .addNewParentRef()
                        .withGroup(GATEWAY_API_GROUP)
                        .withKind(GATEWAY_KIND)
                        .withName(intent.gatewayName())
                        .withNamespace(intent.gatewayNamespace())
                        .withSectionName(intent.sectionName())
                    .endParentRef()
                    .addToHostnames(intent.hostname())
                    .addNewRule()
                        .addNewBackendRef()
                            .withGroup(CORE_GROUP)
                            .withKind(SERVICE_KIND)
                            .withName(name(service))
                            .withNamespace(namespace(service))
                            .withPort(intent.port())
                        .endBackendRef()
                    .endRule()
                .endSpec()
                .build();
        // @formatter:on
    }

    /**
     * Whether an existing route already carries every field of the desired one.
     * Only the fields this operator sets are compared; values the API server fills in by default,
     * such as a {@code PathPrefix /} match or a backend weight, do not count as a difference.
     * @param existing the route read from the API server
     * @param desired the desired route
     * @return true if no write is needed
     */
    public static boolean hasDesiredSpec(HTTPRoute existing, HTTPRoute desired) {
        return existing.getSpec() != null && Objects.equals(ownedFields(existing.getSpec()), ownedFields(desired.getSpec()));
    }

    private static HTTPRouteSpec ownedFields(HTTPRouteSpec spec) {
        return new HTTPRouteSpecBuilder()
                .withParentRefs(nullToEmpty(spec.getParentRefs()).stream()
                        .map(ref -> new ParentReferenceBuilder()
                                .withGroup(ref.getGroup())
                                .withKind(ref.getKind())
                                .withName(ref.getName())
                                .withNamespace(ref.getNamespace())
                                .withSectionName(ref.getSectionName())
                                .build())
                        .toList())
                .withHostnames(nullToEmpty(spec.getHostnames()))
                .withRules(nullToEmpty(spec.getRules()).stream()
                        .map(rule -> new HTTPRouteRuleBuilder()
                                .withBackendRefs(nullToEmpty(rule.getBackendRefs()).stream()
                                        .map(ref -> new HTTPBackendRefBuilder()
                                                .withGroup(ref.getGroup())
                                                .withKind(ref.getKind())
                                                .withName(ref.getName())
                                                .withNamespace(ref.getNamespace())
                                                .withPort(ref.getPort())
                                                .build())
                                        .toList())
                                .build())
                        .toList())
                .build();
    }

    private static <T> List<T> nullToEmpty(@Nullable List<T> list) {
        return list == null ? List.of() : list;
    }
}
