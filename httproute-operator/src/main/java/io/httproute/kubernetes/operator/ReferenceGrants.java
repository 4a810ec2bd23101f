/*
 * Copyright httproute-operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.httproute.kubernetes.operator;

import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.api.model.gatewayapi.v1beta1.ReferenceGrant;
import io.fabric8.kubernetes.api.model.gatewayapi.v1beta1.ReferenceGrantBuilder;

import static io.httproute.kubernetes.operator.HttpRoutes.CORE_GROUP;
import static io.httproute.kubernetes.operator.HttpRoutes.GATEWAY_API_GROUP;
import static io.httproute.kubernetes.operator.HttpRoutes.SERVICE_KIND;
import static io.httproute.kubernetes.operator.ResourcesUtil.name;
import static io.httproute.kubernetes.operator.ResourcesUtil.namespace;

/**
 * Computes the desired {@link ReferenceGrant} allowing the HTTPRoute in the gateway namespace
 * to reference a {@code Service} in its own namespace.
 */
public class ReferenceGrants {

    public static final String HTTP_ROUTE_KIND = "HTTPRoute";

    private ReferenceGrants() {
    }

    public static String grantName(Service service) {
        return name(service) + "-backend";
    }

    /**
     * Builds the desired grant, including a controller owner reference to the service so that
     * it is garbage collected with it.
     * @param service the exposed service
     * @param intent the resolved exposure intent
     * @return the desired grant, placed in the service namespace
     */
    public static ReferenceGrant desiredReferenceGrant(Service service, ExposureIntent intent) {
        // @formatter:off
        return new ReferenceGrantBuilder()
                .withNewMetadata()
                    .withName(grantName(service))
                    .withNamespace(namespace(service))
                    .withLabels(StandardLabels.derivedFrom(service))
                    .addToOwnerReferences(ResourcesUtil.newControllerOwnerReferenceTo(service))
                .endMetadata()
                .withNewSpec()
                    .addNewFrom()
                        .withGroup(GATEWAY_API_GROUP)
                        .withKind(HTTP_ROUTE_KIND)
                        .withNamespace(intent.gatewayNamespace())
                    .endFrom()
                    .addNewTo()
                        .withGroup(CORE_GROUP)
                        .withKind(SERVICE_KIND)
                        .withName(name(service))
                    .endTo()
                .endSpec()
                .build();
        // @formatter:on
    }
}
