package com.casework.engine.health;

import com.casework.core.repository.CaseRecordRepository;
import com.casework.engine.metrics.CaseMetrics;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.HashMap;
import java.util.Map;

/**
 * Health of the case engine.
 * Reports:
 * - database connectivity, when running on JDBC persistence
 * - open records whose SLA is breached
 */
public class CaseworkHealthIndicator implements HealthIndicator {

    static final long BREACH_WARNING_THRESHOLD = 50;

    private final JdbcTemplate jdbcTemplate;
    private final CaseRecordRepository recordRepository;
    private final CaseMetrics metrics;

    /**
     * @param jdbcTemplate the database to probe, or null for in-memory persistence
     */
    public CaseworkHealthIndicator(
            JdbcTemplate jdbcTemplate,
            CaseRecordRepository recordRepository,
            CaseMetrics metrics) {
        this.jdbcTemplate = jdbcTemplate;
        this.recordRepository = recordRepository;
        this.metrics = metrics;
    }

    @Override
    public Health health() {
        Map<String, Object> details = new HashMap<>();

        try {
            if (!checkDatabase(details)) {
                return Health.down()
                    .withDetails(details)
                    .build();
            }

            checkSlaHealth(details);

            return Health.up()
                .withDetails(details)
                .build();

        } catch (Exception e) {
            return Health.down()
                .withException(e)
                .withDetails(details)
                .build();
        }
    }

    private boolean checkDatabase(Map<String, Object> details) {
        if (jdbcTemplate == null) {
            details.put("persistence", "memory");
            return true;
        }
        details.put("persistence", "jdbc");
        try {
            Integer result = jdbcTemplate.queryForObject("SELECT 1", Integer.class);
            boolean healthy = result != null && result == 1;
            details.put("database", healthy ? "connected" : "unexpected probe result");
            return healthy;
        } catch (Exception e) {
            details.put("database", "disconnected");
            details.put("databaseError", e.getMessage());
            return false;
        }
    }

    private void checkSlaHealth(Map<String, Object> details) {
        try {
            long breached = recordRepository.countBreached();
            metrics.setBreachedOpen(breached);
            details.put("breachedOpenRecords", breached);
            if (breached > BREACH_WARNING_THRESHOLD) {
                details.put("slaWarning", "High number of open records past their SLA");
            }
        } catch (Exception e) {
            details.put("slaHealthError", e.getMessage());
        }
    }
}
