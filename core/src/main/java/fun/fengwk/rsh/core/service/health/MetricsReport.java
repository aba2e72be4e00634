package fun.fengwk.rsh.core.service.health;

import java.util.Map;

/**
 * Runtime metrics of a connected engine.
 *
 * @param memoryUsage jvm memory figures in bytes
 * @param uptime process uptime in seconds
 * @author fengwk
 */
public record MetricsReport(
    boolean browserConnected,
    int activeContexts,
    Map<String, Long> memoryUsage,
    double uptime
) {
}
