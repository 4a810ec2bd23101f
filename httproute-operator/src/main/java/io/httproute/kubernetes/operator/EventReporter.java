/*
 * Copyright httproute-operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.httproute.kubernetes.operator;

import io.fabric8.kubernetes.api.model.Service;

/**
 * Records the outcome of reconciliation steps against the {@code Service} they concern.
 * Reporting is best-effort: implementations must not throw.
 */
@FunctionalInterface
public interface EventReporter {

    EventReporter NOOP = (service, reason, message) -> {
    };

    void report(Service service, EventReason reason, String message);
}
