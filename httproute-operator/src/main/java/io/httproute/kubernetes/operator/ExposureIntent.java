/*
 * Copyright httproute-operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.httproute.kubernetes.operator;

import java.util.Objects;

/**
 * What should exist for an exposed {@code Service}, as resolved from its annotations and the {@link GatewayDefaults}.
 * Recomputed on every reconciliation and never persisted.
 *
 * @param hostname hostname bound to the HTTPRoute
 * @param gatewayName parent gateway name
 * @param gatewayNamespace namespace of the parent gateway and of the HTTPRoute
 * @param sectionName listener section of the parent gateway
 * @param port backend port on the service
 * @param skipReferenceGrant whether ReferenceGrant management is suppressed
 */
public record ExposureIntent(String hostname,
                             String gatewayName,
                             String gatewayNamespace,
                             String sectionName,
                             int port,
                             boolean skipReferenceGrant) {

    public ExposureIntent {
        Objects.requireNonNull(hostname);
        Objects.requireNonNull(gatewayName);
        Objects.requireNonNull(gatewayNamespace);
        Objects.requireNonNull(sectionName);
        if (hostname.isEmpty()) {
            throw new IllegalArgumentException("hostname cannot be empty");
        }
        if (port <= 0) {
            throw new IllegalArgumentException("port must be positive");
        }
    }
}
