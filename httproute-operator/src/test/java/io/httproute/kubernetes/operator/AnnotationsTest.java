/*
 * Copyright httproute-operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.httproute.kubernetes.operator;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.api.model.ServiceBuilder;
import io.fabric8.kubernetes.api.model.ServicePort;
import io.fabric8.kubernetes.api.model.ServicePortBuilder;

import static io.httproute.kubernetes.operator.Annotations.EXPOSE_ANNOTATION_KEY;
import static io.httproute.kubernetes.operator.Annotations.GATEWAY_ANNOTATION_KEY;
import static io.httproute.kubernetes.operator.Annotations.GATEWAY_NAMESPACE_ANNOTATION_KEY;
import static io.httproute.kubernetes.operator.Annotations.HOSTNAME_ANNOTATION_KEY;
import static io.httproute.kubernetes.operator.Annotations.PORT_ANNOTATION_KEY;
import static io.httproute.kubernetes.operator.Annotations.SECTION_NAME_ANNOTATION_KEY;
import static io.httproute.kubernetes.operator.Annotations.SKIP_REFERENCE_GRANT_ANNOTATION_KEY;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AnnotationsTest {

    private static final GatewayDefaults DEFAULTS = new GatewayDefaults("shared-gateway", "gateway-system", "https");

    @ParameterizedTest
    @ValueSource(strings = { "false", "True", "TRUE", "yes", "1", "" })
    void shouldOnlyTreatLiteralTrueAsExposed(String value) {
        // given
        Service service = service(Map.of(EXPOSE_ANNOTATION_KEY, value, HOSTNAME_ANNOTATION_KEY, "a.example.org"), 80);

        // when
        Optional<ExposureIntent> intent = Annotations.readExposureIntentFrom(service, DEFAULTS);

        // then
        assertThat(intent).isEmpty();
    }

    @Test
    void shouldNotBeExposedWithoutAnnotations() {
        Service service = new ServiceBuilder().withNewMetadata().withName("myapp").withNamespace("default").endMetadata().build();
        assertThat(Annotations.isExposed(service)).isFalse();
        assertThat(Annotations.readExposureIntentFrom(service, DEFAULTS)).isEmpty();
    }

    @Test
    void shouldApplyDefaults() {
        // given
        Service service = service(Map.of(EXPOSE_ANNOTATION_KEY, "true", HOSTNAME_ANNOTATION_KEY, "myapp.example.org"), 80);

        // when
        Optional<ExposureIntent> intent = Annotations.readExposureIntentFrom(service, DEFAULTS);

        // then
        assertThat(intent).contains(new ExposureIntent("myapp.example.org", "shared-gateway", "gateway-system", "https", 80, false));
    }

    @Test
    void shouldPreferAnnotatedValues() {
        // given
        Service service = service(Map.of(EXPOSE_ANNOTATION_KEY, "true",
                HOSTNAME_ANNOTATION_KEY, "myapp.example.org",
                GATEWAY_ANNOTATION_KEY, "internal",
                GATEWAY_NAMESPACE_ANNOTATION_KEY, "edge",
                SECTION_NAME_ANNOTATION_KEY, "http",
                PORT_ANNOTATION_KEY, "9090",
                SKIP_REFERENCE_GRANT_ANNOTATION_KEY, "true"), 80);

        // when
        Optional<ExposureIntent> intent = Annotations.readExposureIntentFrom(service, DEFAULTS);

        // then
        assertThat(intent).contains(new ExposureIntent("myapp.example.org", "internal", "edge", "http", 9090, true));
    }

    @Test
    void shouldTreatEmptyAnnotationsAsAbsent() {
        // given
        Service service = service(Map.of(EXPOSE_ANNOTATION_KEY, "true",
                HOSTNAME_ANNOTATION_KEY, "myapp.example.org",
                GATEWAY_ANNOTATION_KEY, "",
                GATEWAY_NAMESPACE_ANNOTATION_KEY, "",
                SECTION_NAME_ANNOTATION_KEY, ""), 80);

        // when
        Optional<ExposureIntent> intent = Annotations.readExposureIntentFrom(service, DEFAULTS);

        // then
        assertThat(intent).hasValueSatisfying(i -> {
            assertThat(i.gatewayName()).isEqualTo("shared-gateway");
            assertThat(i.gatewayNamespace()).isEqualTo("gateway-system");
            assertThat(i.sectionName()).isEqualTo("https");
        });
    }

    @ParameterizedTest
    @ValueSource(strings = { "false", "yes", "TRUE" })
    void shouldOnlySkipReferenceGrantForLiteralTrue(String value) {
        Service service = service(Map.of(EXPOSE_ANNOTATION_KEY, "true",
                HOSTNAME_ANNOTATION_KEY, "myapp.example.org",
                SKIP_REFERENCE_GRANT_ANNOTATION_KEY, value), 80);
        assertThat(Annotations.readExposureIntentFrom(service, DEFAULTS))
                .hasValueSatisfying(i -> assertThat(i.skipReferenceGrant()).isFalse());
    }

    @Test
    void shouldRejectMissingHostname() {
        Map<String, String> withEmptyHostname = Map.of(EXPOSE_ANNOTATION_KEY, "true", HOSTNAME_ANNOTATION_KEY, "");
        Map<String, String> withoutHostname = Map.of(EXPOSE_ANNOTATION_KEY, "true");

        assertThatThrownBy(() -> Annotations.readExposureIntentFrom(service(withEmptyHostname, 80), DEFAULTS))
                .isInstanceOf(InvalidResourceException.class)
                .hasMessageContaining("hostname missing");
        assertThatThrownBy(() -> Annotations.readExposureIntentFrom(service(withoutHostname, 80), DEFAULTS))
                .isInstanceOf(InvalidResourceException.class)
                .hasMessageContaining("hostname missing");
    }

    @Test
    void shouldRejectServiceWithoutResolvablePort() {
        // given
        Service service = service(Map.of(EXPOSE_ANNOTATION_KEY, "true", HOSTNAME_ANNOTATION_KEY, "myapp.example.org", PORT_ANNOTATION_KEY, "abc"), null);

        // when / then
        assertThatThrownBy(() -> Annotations.readExposureIntentFrom(service, DEFAULTS))
                .isInstanceOf(InvalidResourceException.class)
                .hasMessageContaining("no port resolvable");
    }

    static Stream<Arguments> portResolution() {
        List<ServicePort> declared = List.of(port(8080), port(9090));
        return Stream.of(
                Arguments.argumentSet("annotated port wins", "8443", declared, 8443),
                Arguments.argumentSet("absent annotation", null, declared, 8080),
                Arguments.argumentSet("empty annotation", "", declared, 8080),
                Arguments.argumentSet("non numeric annotation", "abc", declared, 8080),
                Arguments.argumentSet("zero", "0", declared, 8080),
                Arguments.argumentSet("negative", "-1", declared, 8080),
                Arguments.argumentSet("out of range", "70000", declared, 8080),
                Arguments.argumentSet("annotation without declared ports", "8443", List.of(), 8443),
                Arguments.argumentSet("nothing resolvable", "abc", List.of(), 0),
                Arguments.argumentSet("nothing at all", null, List.of(), 0));
    }

    @ParameterizedTest
    @MethodSource
    void portResolution(String annotatedPort, List<ServicePort> declaredPorts, int expected) {
        assertThat(Annotations.resolvePort(annotatedPort, declaredPorts)).isEqualTo(expected);
    }

    @Test
    void shouldResolveGatewayNamespaceForCleanup() {
        assertThat(Annotations.readGatewayNamespaceFrom(service(Map.of(GATEWAY_NAMESPACE_ANNOTATION_KEY, "edge"), 80), DEFAULTS))
                .isEqualTo("edge");
        assertThat(Annotations.readGatewayNamespaceFrom(service(Map.of(GATEWAY_NAMESPACE_ANNOTATION_KEY, ""), 80), DEFAULTS))
                .isEqualTo("gateway-system");
        assertThat(Annotations.readGatewayNamespaceFrom(service(Map.of(), 80), DEFAULTS))
                .isEqualTo("gateway-system");
    }

    private static Service service(Map<String, String> annotations, Integer port) {
        ServiceBuilder builder = new ServiceBuilder()
                .withNewMetadata()
                .withName("myapp")
                .withNamespace("default")
                .withAnnotations(new HashMap<>(annotations))
                .endMetadata();
        if (port != null) {
            builder.withNewSpec().addToPorts(port(port)).endSpec();
        }
        return builder.build();
    }

    private static ServicePort port(int port) {
        return new ServicePortBuilder().withPort(port).build();
    }
}
