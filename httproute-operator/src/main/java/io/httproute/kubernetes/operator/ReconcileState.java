/*
 * Copyright httproute-operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.httproute.kubernetes.operator;

/**
 * The state a {@code Service} was found in by a successful reconciliation.
 * Failed reconciliations throw instead of returning a state.
 */
public enum ReconcileState {
    /** The service no longer exists; nothing to do. */
    SOURCE_NOT_FOUND,
    /** Deletion was requested; derived resources were removed and the finalizer released. */
    DELETING,
    /** The service is not exposed; derived resources were removed and the finalizer released. */
    INACTIVE,
    /** The service is exposed but its annotations are invalid; nothing was changed. */
    INVALID_CONFIG,
    /** The service is exposed; derived resources match its annotations and the finalizer is present. */
    ACTIVE
}
