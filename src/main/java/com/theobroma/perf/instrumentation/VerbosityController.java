package com.theobroma.perf.instrumentation;

import java.util.Optional;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggerConfiguration;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.stereotype.Component;

import com.theobroma.perf.config.QueryStatsProperties;
import com.theobroma.perf.domain.VerbosityMode;

import lombok.extern.slf4j.Slf4j;

/**
 * Switches query logging between slow-only and every-query without a restart.
 *
 * The mode is a single volatile field. {@link QueryTimer} reads it when a query
 * completes, so a toggle applies to the very next completion; nothing is queued
 * and nothing already logged is revisited.
 *
 * While DETAILED, jOOQ's own statement logger is raised to DEBUG as well, and
 * restored to its previous level when going back to NORMAL.
 */
@Slf4j
@Component
public class VerbosityController {

    static final String JOOQ_STATEMENT_LOGGER = "org.jooq.tools.LoggerListener";

    private final Optional<LoggingSystem> loggingSystem;

    private volatile VerbosityMode mode;
    private LogLevel previousJooqLevel;

    @Autowired
    public VerbosityController(QueryStatsProperties properties, Optional<LoggingSystem> loggingSystem) {
        this.loggingSystem = loggingSystem;
        this.mode = VerbosityMode.NORMAL;
        if (properties.isDetailedLogging()) {
            enableDetailed();
        }
    }

    public VerbosityController() {
        this.loggingSystem = Optional.empty();
        this.mode = VerbosityMode.NORMAL;
    }

    public synchronized void enableDetailed() {
        if (mode == VerbosityMode.DETAILED) {
            return;
        }
        mode = VerbosityMode.DETAILED;
        loggingSystem.ifPresent(system -> {
            LoggerConfiguration current = system.getLoggerConfiguration(JOOQ_STATEMENT_LOGGER);
            previousJooqLevel = current == null ? null : current.getConfiguredLevel();
            system.setLogLevel(JOOQ_STATEMENT_LOGGER, LogLevel.DEBUG);
        });
        log.info("Detailed query logging enabled: every query will be logged");
    }

    public synchronized void disableDetailed() {
        if (mode == VerbosityMode.NORMAL) {
            return;
        }
        mode = VerbosityMode.NORMAL;
        loggingSystem.ifPresent(system -> system.setLogLevel(JOOQ_STATEMENT_LOGGER, previousJooqLevel));
        previousJooqLevel = null;
        log.info("Detailed query logging disabled: only slow queries will be logged");
    }

    public VerbosityMode currentMode() {
        return mode;
    }

    public boolean isDetailed() {
        return mode == VerbosityMode.DETAILED;
    }
}
