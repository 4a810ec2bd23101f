/*
 * Copyright httproute-operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.httproute.kubernetes.operator.controller;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.client.informers.ResourceEventHandler;

import io.httproute.tag.RunsOnThread;

/**
 * Informer handler that maps every add, update and delete of a resource to the key of the
 * {@code Service} it concerns, and enqueues that key. Resources that map to no service are ignored.
 *
 * @param <T> the informed resource type
 */
class EnqueueingEventHandler<T extends HasMetadata> implements ResourceEventHandler<T> {

    private final Function<T, Optional<ResourceKey>> toServiceKey;
    private final Consumer<ResourceKey> enqueue;

    EnqueueingEventHandler(Function<T, Optional<ResourceKey>> toServiceKey, Consumer<ResourceKey> enqueue) {
        this.toServiceKey = Objects.requireNonNull(toServiceKey);
        this.enqueue = Objects.requireNonNull(enqueue);
    }

    @Override
    @RunsOnThread("informer callback")
    public void onAdd(T resource) {
        toServiceKey.apply(resource).ifPresent(enqueue);
    }

    @Override
    @RunsOnThread("informer callback")
    public void onUpdate(T oldResource, T newResource) {
        toServiceKey.apply(newResource).ifPresent(enqueue);
    }

    @Override
    @RunsOnThread("informer callback")
    public void onDelete(T resource, boolean deletedFinalStateUnknown) {
        toServiceKey.apply(resource).ifPresent(enqueue);
    }
}
