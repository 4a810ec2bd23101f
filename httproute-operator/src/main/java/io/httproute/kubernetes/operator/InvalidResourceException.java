/*
 * Copyright httproute-operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.httproute.kubernetes.operator;

/**
 * A {@code Service} whose exposure annotations are incomplete or malformed.
 * The API server cannot validate annotation values, so the operator has to.
 * Such a resource is not retried: it is reconciled again once its annotations change.
 */
public class InvalidResourceException extends RuntimeException {

    public InvalidResourceException(String message) {
        super(message);
    }

}
