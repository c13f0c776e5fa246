package org.octofleet.orchestrator.service.events;

import java.time.Instant;

/**
 * A state change published on one topic.
 *
 * @param type       wire event name, e.g. {@code deployment_update}
 * @param entityKey  JSON field the payload is rendered under ({@code deployment}, {@code job}...)
 * @param payload    snapshot DTO, the same one the GET endpoints return
 */
public record FleetEvent(String topic, String type, String entityKey, Object payload, Instant at) {
}
