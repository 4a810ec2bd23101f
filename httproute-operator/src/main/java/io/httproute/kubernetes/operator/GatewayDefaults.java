/*
 * Copyright httproute-operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.httproute.kubernetes.operator;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * The gateway coordinates used when a {@code Service} does not name them itself.
 * All three are mandatory; there are no built-in fallback values.
 *
 * @param gatewayName name of the parent {@code Gateway}
 * @param gatewayNamespace namespace of the parent {@code Gateway}, which is also where {@code HTTPRoute}s are placed
 * @param sectionName name of the listener section on the parent {@code Gateway}
 */
public record GatewayDefaults(String gatewayName, String gatewayNamespace, String sectionName) {

    public GatewayDefaults {
        gatewayName = requireConfigured(gatewayName, "default gateway name");
        gatewayNamespace = requireConfigured(gatewayNamespace, "default gateway namespace");
        sectionName = requireConfigured(sectionName, "default section name");
    }

    private static String requireConfigured(@Nullable String value, String description) {
        if (value == null || value.isBlank()) {
            throw new OperatorConfigurationException(description + " must be configured");
        }
        return value;
    }
}
