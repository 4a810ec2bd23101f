/*
 * Copyright httproute-operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.httproute.kubernetes.operator;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.httproute.tag.VisibleForTesting;

/**
 * Operator settings, read from environment variables.
 *
 * @param gatewayDefaults defaults applied to services that do not name their gateway
 * @param workerCount number of services reconciled concurrently
 * @param reconcileTimeout bound on each API server request made while reconciling
 * @param resyncPeriod how often every service is reconciled even without changes
 * @param bindAddress address of the management HTTP server
 */
public record OperatorConfig(GatewayDefaults gatewayDefaults,
                             int workerCount,
                             Duration reconcileTimeout,
                             Duration resyncPeriod,
                             InetSocketAddress bindAddress) {

    private static final Logger LOGGER = LoggerFactory.getLogger(OperatorConfig.class);

    static final String DEFAULT_GATEWAY_VAR_NAME = "DEFAULT_GATEWAY";
    static final String DEFAULT_GATEWAY_NAMESPACE_VAR_NAME = "DEFAULT_GATEWAY_NAMESPACE";
    static final String DEFAULT_SECTION_NAME_VAR_NAME = "DEFAULT_SECTION_NAME";
    static final String WORKER_COUNT_VAR_NAME = "WORKER_COUNT";
    static final String RECONCILE_TIMEOUT_VAR_NAME = "RECONCILE_TIMEOUT_SECONDS";
    static final String RESYNC_PERIOD_VAR_NAME = "RESYNC_PERIOD_SECONDS";
    static final String BIND_ADDRESS_VAR_NAME = "BIND_ADDRESS";

    private static final int DEFAULT_WORKER_COUNT = 1;
    private static final long DEFAULT_RECONCILE_TIMEOUT_SECONDS = 30;
    private static final long DEFAULT_RESYNC_PERIOD_SECONDS = 600;
    private static final int DEFAULT_MANAGEMENT_PORT = 8080;

    public OperatorConfig {
        Objects.requireNonNull(gatewayDefaults);
        Objects.requireNonNull(reconcileTimeout);
        Objects.requireNonNull(resyncPeriod);
        Objects.requireNonNull(bindAddress);
        if (workerCount < 1) {
            throw new OperatorConfigurationException(WORKER_COUNT_VAR_NAME + " must be at least 1, was " + workerCount);
        }
    }

    /**
     * Reads the configuration.
     * @param env the environment, typically {@link System#getenv()}
     * @return the configuration
     * @throws OperatorConfigurationException if a mandatory variable is missing or a value is malformed
     */
    public static OperatorConfig fromEnvironment(Map<String, String> env) {
        GatewayDefaults defaults = new GatewayDefaults(
                required(env, DEFAULT_GATEWAY_VAR_NAME),
                required(env, DEFAULT_GATEWAY_NAMESPACE_VAR_NAME),
                required(env, DEFAULT_SECTION_NAME_VAR_NAME));
        return new OperatorConfig(defaults,
                (int) positiveNumber(env, WORKER_COUNT_VAR_NAME, DEFAULT_WORKER_COUNT),
                Duration.ofSeconds(positiveNumber(env, RECONCILE_TIMEOUT_VAR_NAME, DEFAULT_RECONCILE_TIMEOUT_SECONDS)),
                Duration.ofSeconds(positiveNumber(env, RESYNC_PERIOD_VAR_NAME, DEFAULT_RESYNC_PERIOD_SECONDS)),
                bindAddress(env.getOrDefault(BIND_ADDRESS_VAR_NAME, "0.0.0.0:" + DEFAULT_MANAGEMENT_PORT)));
    }

    private static String required(Map<String, String> env, String name) {
        String value = env.get(name);
        if (value == null || value.isBlank()) {
            throw new OperatorConfigurationException("Environment variable " + name + " is required");
        }
        return value;
    }

    private static long positiveNumber(Map<String, String> env, String name, long defaultValue) {
        String value = env.get(name);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            long parsed = Long.parseLong(value.trim());
            if (parsed < 1 || parsed > Integer.MAX_VALUE) {
                throw new OperatorConfigurationException("Environment variable " + name + " must be a positive integer, was " + value);
            }
            return parsed;
        }
        catch (NumberFormatException e) {
            throw new OperatorConfigurationException("Environment variable " + name + " must be a positive integer, was " + value, e);
        }
    }

    @VisibleForTesting
    static InetSocketAddress bindAddress(String bindAddress) {
        String bindToInterface;
        int bindToPort;
        int colon = bindAddress.lastIndexOf(':');
        if (colon >= 0) {
            bindToInterface = bindAddress.substring(0, colon);
            try {
                bindToPort = Integer.parseInt(bindAddress.substring(colon + 1));
            }
            catch (NumberFormatException e) {
                throw new OperatorConfigurationException(BIND_ADDRESS_VAR_NAME + " has a malformed port: " + bindAddress, e);
            }
        }
        else if (!bindAddress.isEmpty()) {
            LOGGER.warn("{} env var is set but does not contain `:` assuming hostname only and binding to default port ({})",
                    BIND_ADDRESS_VAR_NAME,
                    DEFAULT_MANAGEMENT_PORT);
            bindToInterface = bindAddress;
            bindToPort = DEFAULT_MANAGEMENT_PORT;
        }
        else {
            bindToInterface = "0.0.0.0";
            bindToPort = DEFAULT_MANAGEMENT_PORT;
        }
        return new InetSocketAddress(bindToInterface, bindToPort);
    }
}
