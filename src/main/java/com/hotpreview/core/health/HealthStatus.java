package com.hotpreview.core.health;

import java.util.Map;

/**
 * Health of one part of the preview service: the session registry or the broadcast hub.
 * A session whose watcher stopped makes the registry DEGRADED, not DOWN, since its port still serves.
 */
public record HealthStatus(
    String component,
    Status status,
    String detail,
    Map<String, String> metadata
) {
    public enum Status {
        UP, DEGRADED, DOWN;

        /** The more severe of the two; the service is only as healthy as its worst component. */
        public Status worse(Status other) {
            return other.ordinal() > ordinal() ? other : this;
        }
    }

    public static HealthStatus unavailable(String component, String detail) {
        return new HealthStatus(component, Status.DOWN, detail, Map.of());
    }
}
