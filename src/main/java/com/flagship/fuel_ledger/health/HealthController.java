package com.flagship.fuel_ledger.health;

import com.flagship.fuel_ledger.release.ReleaseNoticeService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness/readiness probe for the pod. Needs no authorization, unlike Actuator.
 * Reports the running version so a deploy can be verified from the probe.
 */
@RestController
@Slf4j
public class HealthController {

    private final DataSource dataSource;
    private final ReleaseNoticeService releaseNoticeService;

    public HealthController(DataSource dataSource, ReleaseNoticeService releaseNoticeService) {
        this.dataSource = dataSource;
        this.releaseNoticeService = releaseNoticeService;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now().toString());
        response.put("version", releaseNoticeService.currentVersion());

        boolean dbHealthy = checkDatabase();
        response.put("database", dbHealthy ? "UP" : "DOWN");

        if (!dbHealthy) {
            response.put("status", "DOWN");
            return ResponseEntity.status(503).body(response);
        }

        return ResponseEntity.ok(response);
    }

    private boolean checkDatabase() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(2);
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }
}
