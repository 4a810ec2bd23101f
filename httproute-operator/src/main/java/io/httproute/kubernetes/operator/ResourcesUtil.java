/*
 * Copyright httproute-operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.httproute.kubernetes.operator;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.ObjectMeta;
import io.fabric8.kubernetes.api.model.OwnerReference;
import io.fabric8.kubernetes.api.model.OwnerReferenceBuilder;

public class ResourcesUtil {

    private ResourcesUtil() {
    }

    /**
     * Builds a controller owner reference to the given owner. Kubernetes only honours owner references
     * within a namespace, so the owned resource must live in the owner's namespace.
     *
     * @param owner the owning resource
     * @return an owner reference with {@code controller} and {@code blockOwnerDeletion} set
     * @param <O> the type of the owner
     */
    public static <O extends HasMetadata> OwnerReference newControllerOwnerReferenceTo(O owner) {
        return new OwnerReferenceBuilder()
                .withKind(owner.getKind())
                .withApiVersion(owner.getApiVersion())
                .withName(name(owner))
                .withUid(uid(owner))
                .withController(true)
                .withBlockOwnerDeletion(true)
                .build();
    }

    /**
     * Finds the name of the controller owner of the given kind, if any.
     * @param resource the owned resource
     * @param ownerKind kind of owner to look for
     * @return the owner's name, or empty
     */
    public static Optional<String> controllerOwnerName(HasMetadata resource, String ownerKind) {
        Objects.requireNonNull(ownerKind);
        return Optional.ofNullable(resource.getMetadata())
                .map(ObjectMeta::getOwnerReferences)
                .orElse(List.of())
                .stream()
                .filter(ref -> Boolean.TRUE.equals(ref.getController()) && ownerKind.equals(ref.getKind()))
                .map(OwnerReference::getName)
                .findFirst();
    }

    public static String name(HasMetadata resource) {
        return resource.getMetadata().getName();
    }

    public static String namespace(HasMetadata resource) {
        return resource.getMetadata().getNamespace();
    }

    public static String uid(HasMetadata resource) {
        return resource.getMetadata().getUid();
    }

    public static boolean isBeingDeleted(HasMetadata resource) {
        return resource.getMetadata().getDeletionTimestamp() != null;
    }

    public static boolean hasFinalizer(HasMetadata resource, String finalizer) {
        return Optional.ofNullable(resource.getMetadata().getFinalizers())
                .orElse(List.of())
                .contains(finalizer);
    }
}
