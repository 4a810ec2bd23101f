/*
 * Copyright httproute-operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.httproute.kubernetes.operator;

import java.util.Map;
import java.util.Optional;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.ObjectMeta;
import io.fabric8.kubernetes.api.model.Service;

import io.httproute.kubernetes.operator.controller.ResourceKey;

/**
 * Labels placed on every resource the operator creates. Besides marking the resource as managed they
 * record which {@code Service} the resource was derived from, because an owner reference cannot cross namespaces.
 */
public class StandardLabels {

    public static final String MANAGED_BY_LABEL = "app.kubernetes.io/managed-by";
    public static final String MANAGED_BY_VALUE = "httproute-operator";
    public static final String SERVICE_NAME_LABEL = Annotations.ANNOTATION_PREFIX + "/service-name";
    public static final String SERVICE_NAMESPACE_LABEL = Annotations.ANNOTATION_PREFIX + "/service-namespace";

    private StandardLabels() {
    }

    /**
     * Label selector matching every resource derived from the given service.
     * @param service the service
     * @return the selector labels
     */
    public static Map<String, String> derivedFrom(Service service) {
        return derivedFrom(ResourceKey.of(service));
    }

    /**
     * Label selector matching every resource derived from the identified service, usable once the service is gone.
     * @param serviceKey identifies the service
     * @return the selector labels
     */
    public static Map<String, String> derivedFrom(ResourceKey serviceKey) {
        return Map.of(MANAGED_BY_LABEL, MANAGED_BY_VALUE,
                SERVICE_NAME_LABEL, serviceKey.name(),
                SERVICE_NAMESPACE_LABEL, serviceKey.namespace());
    }

    /**
     * Recovers the key of the {@code Service} a managed resource was derived from.
     * @param resource a resource carrying the standard labels
     * @return the service key, or empty if the labels are missing
     */
    public static Optional<ResourceKey> sourceServiceOf(HasMetadata resource) {
        Map<String, String> labels = Optional.ofNullable(resource.getMetadata())
                .map(ObjectMeta::getLabels)
                .orElse(Map.of());
        String name = labels.get(SERVICE_NAME_LABEL);
        String namespace = labels.get(SERVICE_NAMESPACE_LABEL);
        if (name == null || namespace == null) {
            return Optional.empty();
        }
        return Optional.of(new ResourceKey(namespace, name));
    }
}
