package com.theobroma.perf.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import com.theobroma.perf.instrumentation.QueryExecutor;
import com.theobroma.perf.instrumentation.QueryExecutor.QueryResult;

import lombok.extern.slf4j.Slf4j;

/**
 * Service health: uptime and database connectivity.
 *
 * The connectivity check runs through the timed {@link QueryExecutor}, so it shows up
 * in the query statistics like any other statement.
 */
@Slf4j
@Service
public class HealthService {

    static final String CHECK_SQL = "SELECT 1";

    private final QueryExecutor queryExecutor;
    private final Clock clock;
    private final Instant startedAt;

    public HealthService(QueryExecutor queryExecutor, Clock clock) {
        this.queryExecutor = queryExecutor;
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void logConnectivityOnStartup() {
        DatabaseStatus status = checkDatabase();
        if (status.connected()) {
            log.info("Database connection OK ({} ms)", status.latencyMillis());
        } else {
            log.warn("Database connection failed at startup: {}", status.error());
        }
    }

    public HealthResponse health() {
        DatabaseStatus database = checkDatabase();
        double uptime = Duration.between(startedAt, clock.instant()).toMillis() / 1000.0;

        return new HealthResponse(
            database.connected() ? "healthy" : "degraded",
            Math.round(uptime * 100) / 100.0,
            database,
            clock.instant().toString()
        );
    }

    /**
     * Runs the connectivity check. A failing check is reported, not thrown.
     */
    public DatabaseStatus checkDatabase() {
        try {
            QueryResult result = queryExecutor.execute(CHECK_SQL);
            return new DatabaseStatus(true, Math.round(result.elapsedSeconds() * 1000), null);
        } catch (DataAccessException e) {
            log.error("Database connectivity check failed", e);
            return new DatabaseStatus(false, 0L, e.getMostSpecificCause().getMessage());
        }
    }

    public record DatabaseStatus(boolean connected, long latencyMillis, String error) {}

    public record HealthResponse(String status, double uptimeSeconds, DatabaseStatus database, String timestamp) {}
}
