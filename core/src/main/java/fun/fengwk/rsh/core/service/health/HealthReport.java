package fun.fengwk.rsh.core.service.health;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Health verdict with the liveness signals it was derived from.
 *
 * @author fengwk
 */
public record HealthReport(
    String status,
    boolean browserConnected,
    boolean valkeyConnected,
    boolean valkeyEnabled,
    double uptime
) {

    public static final String HEALTHY = "healthy";
    public static final String UNHEALTHY = "unhealthy";

    @JsonIgnore
    public boolean isHealthy() {
        return HEALTHY.equals(status);
    }

}
