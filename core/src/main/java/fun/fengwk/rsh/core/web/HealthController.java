package fun.fengwk.rsh.core.web;

import fun.fengwk.rsh.core.service.health.HealthAggregator;
import fun.fengwk.rsh.core.service.health.HealthReport;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Health and metrics endpoints.
 *
 * @author fengwk
 */
@RestController
@RequiredArgsConstructor
public class HealthController {

    private final HealthAggregator healthAggregator;

    @GetMapping("/health")
    public ResponseEntity<HealthReport> health() {
        HealthReport report = healthAggregator.report();
        HttpStatus status = report.isHealthy() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(status).body(report);
    }

    @GetMapping("/metrics")
    public ResponseEntity<?> metrics() {
        return healthAggregator.metrics()
            .<ResponseEntity<?>>map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(Map.of("error", "Browser not connected")));
    }

}
