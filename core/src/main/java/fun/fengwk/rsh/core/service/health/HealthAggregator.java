package fun.fengwk.rsh.core.service.health;

import fun.fengwk.rsh.core.service.browser.engine.RenderEngine;
import fun.fengwk.rsh.core.service.state.StateStorageProperties;
import fun.fengwk.rsh.core.service.state.StateStoreConnector;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.MemoryUsage;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Derives service health from engine and store liveness.
 *
 * <p>Store liveness is the cached handle state of {@link StateStoreConnector}, no round trip is made.
 *
 * @author fengwk
 */
@Component
@RequiredArgsConstructor
public class HealthAggregator {

    private final RenderEngine renderEngine;
    private final StateStoreConnector stateStoreConnector;
    private final StateStorageProperties stateStorageProperties;

    public HealthReport report() {
        boolean browserConnected = renderEngine.isConnected();
        boolean valkeyConnected = stateStoreConnector.isConnected();
        boolean valkeyEnabled = stateStorageProperties.isEnabled();
        boolean healthy = browserConnected && (!valkeyEnabled || valkeyConnected);
        return new HealthReport(
            healthy ? HealthReport.HEALTHY : HealthReport.UNHEALTHY,
            browserConnected,
            valkeyConnected,
            valkeyEnabled,
            uptimeSeconds()
        );
    }

    /**
     * @return metrics, or empty if the engine is not connected
     */
    public Optional<MetricsReport> metrics() {
        if (!renderEngine.isConnected()) {
            return Optional.empty();
        }
        return Optional.of(new MetricsReport(
            true,
            renderEngine.activeContexts(),
            memoryUsage(),
            uptimeSeconds()
        ));
    }

    private static double uptimeSeconds() {
        return ManagementFactory.getRuntimeMXBean().getUptime() / 1000.0;
    }

    private static Map<String, Long> memoryUsage() {
        MemoryMXBean memoryMXBean = ManagementFactory.getMemoryMXBean();
        MemoryUsage heap = memoryMXBean.getHeapMemoryUsage();
        MemoryUsage nonHeap = memoryMXBean.getNonHeapMemoryUsage();
        Map<String, Long> usage = new LinkedHashMap<>();
        usage.put("heapUsed", heap.getUsed());
        usage.put("heapTotal", heap.getCommitted());
        usage.put("heapMax", heap.getMax());
        usage.put("nonHeapUsed", nonHeap.getUsed());
        usage.put("nonHeapTotal", nonHeap.getCommitted());
        return usage;
    }

}
