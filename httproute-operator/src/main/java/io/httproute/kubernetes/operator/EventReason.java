/*
 * Copyright httproute-operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.httproute.kubernetes.operator;

/**
 * Reasons of the Kubernetes events recorded against a {@code Service}.
 */
public enum EventReason {

    HTTP_ROUTE_RECONCILED("HTTPRouteReconciled", "Normal"),
    HTTP_ROUTE_FAILED("HTTPRouteFailed", "Warning"),
    HTTP_ROUTE_DELETED("HTTPRouteDeleted", "Normal"),
    REFERENCE_GRANT_RECONCILED("ReferenceGrantReconciled", "Normal"),
    REFERENCE_GRANT_FAILED("ReferenceGrantFailed", "Warning"),
    REFERENCE_GRANT_DELETED("ReferenceGrantDeleted", "Normal"),
    REFERENCE_GRANT_SKIPPED("ReferenceGrantSkipped", "Normal");

    private final String reason;
    private final String type;

    EventReason(String reason, String type) {
        this.reason = reason;
        this.type = type;
    }

    /**
     * @return the CamelCase reason as it appears on the event
     */
    public String reason() {
        return reason;
    }

    /**
     * @return {@code Normal} or {@code Warning}
     */
    public String type() {
        return type;
    }
}
