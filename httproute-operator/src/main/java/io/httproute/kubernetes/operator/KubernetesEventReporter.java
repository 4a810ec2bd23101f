/*
 * Copyright httproute-operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.httproute.kubernetes.operator;

import java.time.Clock;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.fabric8.kubernetes.api.model.Event;
import io.fabric8.kubernetes.api.model.EventBuilder;
import io.fabric8.kubernetes.api.model.ObjectReferenceBuilder;
import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.client.KubernetesClient;

import io.httproute.tag.VisibleForTesting;

import static io.httproute.kubernetes.operator.ResourcesUtil.name;
import static io.httproute.kubernetes.operator.ResourcesUtil.namespace;

/**
 * Writes core/v1 {@link Event}s to the API server, in the namespace of the involved {@code Service}.
 */
public class KubernetesEventReporter implements EventReporter {

    private static final Logger LOGGER = LoggerFactory.getLogger(KubernetesEventReporter.class);

    @VisibleForTesting
    static final String REPORTING_COMPONENT = "httproute-operator";

    private final KubernetesClient client;
    private final Clock clock;
    private final AtomicInteger sequence = new AtomicInteger();

    public KubernetesEventReporter(KubernetesClient client, Clock clock) {
        this.client = Objects.requireNonNull(client);
        this.clock = Objects.requireNonNull(clock);
    }

    /**
     * Records the event. A failure to record it, whatever its cause, is logged and never reaches the caller.
     */
    @Override
    public void report(Service service, EventReason reason, String message) {
        try {
            client.v1().events().inNamespace(namespace(service)).resource(newEvent(service, reason, message)).create();
        }
        catch (RuntimeException e) {
            LOGGER.atWarn()
                    .setMessage("Failed to record {} event for service {}/{}: {}")
                    .addArgument(reason::reason)
                    .addArgument(() -> namespace(service))
                    .addArgument(() -> name(service))
                    .addArgument(e::getMessage)
                    .log();
        }
    }

    @VisibleForTesting
    Event newEvent(Service service, EventReason reason, String message) {
        String timestamp = clock.instant().truncatedTo(ChronoUnit.SECONDS).toString();
        // event names only need to be unique within the namespace
        String eventName = String.format("%s.%x%04x", name(service), clock.millis(), sequence.getAndIncrement() & 0xffff);
        // @formatter:off
        return new EventBuilder()
                .withNewMetadata()
                    .withName(eventName)
                    .withNamespace(namespace(service))
                .endMetadata()
                .withInvolvedObject(new ObjectReferenceBuilder()
                        .withApiVersion(service.getApiVersion())
                        .withKind(service.getKind())
                        .withName(name(service))
                        .withNamespace(namespace(service))
                        .withUid(service.getMetadata().getUid())
                        .withResourceVersion(service.getMetadata().getResourceVersion())
                        .build())
                .withType(reason.type())
                .withReason(reason.reason())
                .withMessage(message)
                .withFirstTimestamp(timestamp)
                .withLastTimestamp(timestamp)
                .withCount(1)
                .withNewSource()
                    .withComponent(REPORTING_COMPONENT)
                .endSource()
                .withReportingComponent(REPORTING_COMPONENT)
                .build();
        // @formatter:on
    }
}
