package com.taleforge.app.health;

import com.taleforge.app.config.TaleforgeProperties;
import com.taleforge.engine.lock.CampaignLockManager;
import com.taleforge.engine.metrics.TurnMetrics;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Custom health indicator for the turn engine.
 * Reports health status based on:
 * - Persistence mode and, for JDBC, database connectivity
 * - Campaign locks currently held and turns in flight
 */
@Component
public class TaleforgeHealthIndicator implements HealthIndicator {

    private final TaleforgeProperties properties;
    private final CampaignLockManager lockManager;
    private final TurnMetrics metrics;
    private final ObjectProvider<JdbcTemplate> jdbcTemplate;

    public TaleforgeHealthIndicator(
            TaleforgeProperties properties,
            CampaignLockManager lockManager,
            TurnMetrics metrics,
            ObjectProvider<JdbcTemplate> jdbcTemplate) {
        this.properties = properties;
        this.lockManager = lockManager;
        this.metrics = metrics;
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Health health() {
        Map<String, Object> details = new HashMap<>();
        details.put("persistence", properties.getPersistence().name().toLowerCase());
        details.put("lockedCampaigns", lockManager.heldCount());
        details.put("turnsInFlight", metrics.turnsInFlight());

        if (properties.getPersistence() == TaleforgeProperties.PersistenceMode.JDBC
                && !checkDatabase(details)) {
            return Health.down()
                .withDetails(details)
                .build();
        }
        return Health.up()
            .withDetails(details)
            .build();
    }

    private boolean checkDatabase(Map<String, Object> details) {
        JdbcTemplate jdbc = jdbcTemplate.getIfAvailable();
        if (jdbc == null) {
            details.put("database", "not configured");
            return false;
        }
        try {
            Integer result = jdbc.queryForObject("SELECT 1", Integer.class);
            details.put("database", "connected");
            return result != null && result == 1;
        } catch (RuntimeException e) {
            details.put("database", "disconnected");
            details.put("databaseError", e.getMessage());
            return false;
        }
    }
}
