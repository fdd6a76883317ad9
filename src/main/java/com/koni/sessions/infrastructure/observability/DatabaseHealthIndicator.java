package com.koni.sessions.infrastructure.observability;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Readiness check of the session store.
 *
 * Ingest needs all three tables: sessions, session_events and idempotency_records.
 * Each is probed with an empty read, so the check costs the same on a large store as on
 * an empty one. A reachable database with a missing or unreadable table reports DOWN.
 */
@Slf4j
@Component("sessionStore")
@RequiredArgsConstructor
public class DatabaseHealthIndicator implements HealthIndicator {

    static final List<String> SESSION_TABLES = List.of("sessions", "session_events", "idempotency_records");
    static final String REACHABLE = "reachable";

    private final DataSource dataSource;

    @Override
    public Health health() {
        try (Connection connection = dataSource.getConnection()) {
            String database = connection.getMetaData().getDatabaseProductName();

            Map<String, String> tables = new LinkedHashMap<>();
            for (String table : SESSION_TABLES) {
                tables.put(table, probe(connection, table));
            }

            if (tables.values().stream().allMatch(REACHABLE::equals)) {
                return Health.up()
                        .withDetail("database", database)
                        .withDetail("tables", tables)
                        .build();
            }

            log.error("Session store not ready: tables={}", tables);
            return Health.down()
                    .withDetail("error", "SessionTablesUnavailable")
                    .withDetail("database", database)
                    .withDetail("tables", tables)
                    .build();

        } catch (Exception e) {
            log.error("Session store health check failed", e);

            return Health.down()
                    .withDetail("error", e.getClass().getSimpleName())
                    .withDetail("message", e.getMessage())
                    .build();
        }
    }

    private String probe(Connection connection, String table) {
        try (Statement statement = connection.createStatement()) {
            statement.execute("SELECT 1 FROM " + table + " WHERE 1 = 0");
            return REACHABLE;
        } catch (SQLException e) {
            log.warn("Session table {} is not reachable: {}", table, e.getMessage());
            return "unreachable: " + e.getMessage();
        }
    }
}
