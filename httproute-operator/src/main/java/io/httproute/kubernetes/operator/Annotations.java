/*
 * Copyright httproute-operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.httproute.kubernetes.operator;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.ObjectMeta;
import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.api.model.ServicePort;
import io.fabric8.kubernetes.api.model.ServiceSpec;

import io.httproute.tag.VisibleForTesting;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Reads the exposure annotations from a {@code Service}. This class encapsulates the annotation keys
 * and their parsing rules so that the rest of the operator only deals with {@link ExposureIntent}s.
 */
public class Annotations {

    public static final String ANNOTATION_PREFIX = "httproute.controller";
    public static final String EXPOSE_ANNOTATION_KEY = ANNOTATION_PREFIX + "/expose";
    public static final String HOSTNAME_ANNOTATION_KEY = ANNOTATION_PREFIX + "/hostname";
    public static final String GATEWAY_ANNOTATION_KEY = ANNOTATION_PREFIX + "/gateway";
    public static final String GATEWAY_NAMESPACE_ANNOTATION_KEY = ANNOTATION_PREFIX + "/gateway-namespace";
    public static final String SECTION_NAME_ANNOTATION_KEY = ANNOTATION_PREFIX + "/section-name";
    public static final String PORT_ANNOTATION_KEY = ANNOTATION_PREFIX + "/port";
    public static final String SKIP_REFERENCE_GRANT_ANNOTATION_KEY = ANNOTATION_PREFIX + "/skip-reference-grant";

    /**
     * Finalizer placed on a {@code Service} while derived resources may exist for it.
     */
    public static final String HTTPROUTE_FINALIZER = ANNOTATION_PREFIX + "/httproute-finalizer";

    @VisibleForTesting
    static final String TRUE = "true";

    private Annotations() {
    }

    /**
     * Whether the resource asks to be exposed. Only the literal {@code "true"} counts.
     * @param hasMetadata the resource to inspect
     * @return true if the expose annotation is exactly {@code "true"}
     */
    public static boolean isExposed(HasMetadata hasMetadata) {
        return TRUE.equals(annotations(hasMetadata).get(EXPOSE_ANNOTATION_KEY));
    }

    /**
     * Resolves the namespace in which the HTTPRoute for the given resource lives (or would live).
     * @param hasMetadata the annotated resource
     * @param defaults the operator's gateway defaults
     * @return the annotated gateway namespace, or the default when absent or empty
     */
    public static String readGatewayNamespaceFrom(HasMetadata hasMetadata, GatewayDefaults defaults) {
        return valueOrDefault(annotations(hasMetadata), GATEWAY_NAMESPACE_ANNOTATION_KEY, defaults.gatewayNamespace());
    }

    /**
     * Extracts the exposure intent of a {@code Service}.
     * @param service the service
     * @param defaults the operator's gateway defaults
     * @return the intent, or empty if the service is not exposed
     * @throws InvalidResourceException if the service is exposed but its hostname is missing or no port can be resolved
     */
    public static Optional<ExposureIntent> readExposureIntentFrom(Service service, GatewayDefaults defaults) {
        Objects.requireNonNull(service);
        Objects.requireNonNull(defaults);
        if (!isExposed(service)) {
            return Optional.empty();
        }
        Map<String, String> annotations = annotations(service);
        String hostname = annotations.get(HOSTNAME_ANNOTATION_KEY);
        if (hostname == null || hostname.isEmpty()) {
            throw new InvalidResourceException("hostname missing: annotation " + HOSTNAME_ANNOTATION_KEY + " is required when exposed");
        }
        int port = resolvePort(annotations.get(PORT_ANNOTATION_KEY), declaredPorts(service));
        if (port == 0) {
            throw new InvalidResourceException("no port resolvable: set annotation " + PORT_ANNOTATION_KEY + " or declare a port on the service");
        }
        return Optional.of(new ExposureIntent(
                hostname,
                valueOrDefault(annotations, GATEWAY_ANNOTATION_KEY, defaults.gatewayName()),
                valueOrDefault(annotations, GATEWAY_NAMESPACE_ANNOTATION_KEY, defaults.gatewayNamespace()),
                valueOrDefault(annotations, SECTION_NAME_ANNOTATION_KEY, defaults.sectionName()),
                port,
                TRUE.equals(annotations.get(SKIP_REFERENCE_GRANT_ANNOTATION_KEY))));
    }

    /**
     * The annotated port wins when it is a valid port number, otherwise the first declared port is used.
     * @return the port, or 0 if none could be resolved
     */
    @VisibleForTesting
    static int resolvePort(@Nullable String annotatedPort, List<ServicePort> declaredPorts) {
        int port = parsePort(annotatedPort);
        if (port == 0 && !declaredPorts.isEmpty()) {
            Integer first = declaredPorts.get(0).getPort();
            port = first == null ? 0 : first;
        }
        return port;
    }

    private static int parsePort(@Nullable String annotatedPort) {
        if (annotatedPort == null || annotatedPort.isEmpty()) {
            return 0;
        }
        try {
            int port = Integer.parseInt(annotatedPort, 10);
            return port > 0 && port <= 65535 ? port : 0;
        }
        catch (NumberFormatException e) {
            return 0;
        }
    }

    private static List<ServicePort> declaredPorts(Service service) {
        return Optional.ofNullable(service.getSpec())
                .map(ServiceSpec::getPorts)
                .orElse(List.of());
    }

    private static String valueOrDefault(Map<String, String> annotations, String key, String defaultValue) {
        String value = annotations.get(key);
        return value == null || value.isEmpty() ? defaultValue : value;
    }

    @NonNull
    private static Map<String, String> annotations(HasMetadata hasMetadata) {
        return Optional.ofNullable(hasMetadata.getMetadata())
                .map(ObjectMeta::getAnnotations)
                .orElse(Map.of());
    }
}
