/*
 * Copyright httproute-operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.httproute.kubernetes.operator.controller;

import java.util.Objects;

import io.fabric8.kubernetes.api.model.HasMetadata;

/**
 * Identifies a namespaced resource independently of any particular version of it.
 *
 * @param namespace the namespace
 * @param name the name
 */
public record ResourceKey(String namespace, String name) {

    public ResourceKey {
        Objects.requireNonNull(namespace);
        Objects.requireNonNull(name);
    }

    public static ResourceKey of(HasMetadata resource) {
        return new ResourceKey(resource.getMetadata().getNamespace(), resource.getMetadata().getName());
    }

    @Override
    public String toString() {
        return namespace + "/" + name;
    }
}
