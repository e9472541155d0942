package com.behavior.affinity.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC wrapper. Adds key-value pairs to the SLF4J MDC and
 * removes them on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forBatchRun(runId, tenantName, cohortName)) {
 *     log.info("batch.completed runId={} rowsTouched={}", runId, rows);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    public static LogContext forBatchRun(String runId, String tenantName, String cohortName) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("tenant", tenantName);
        ctx.put("cohort", cohortName);
        ctx.put("operation", "batch");
        return ctx;
    }

    public static LogContext forProfileLookup(String tenantId, String profileId) {
        LogContext ctx = new LogContext();
        ctx.put("tenantId", tenantId);
        ctx.put("profileId", profileId);
        ctx.put("operation", "read");
        return ctx;
    }

    public static LogContext forGarbageCollection(String runId) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("operation", "gc");
        return ctx;
    }

    public static String generateRunId() {
        return UUID.randomUUID().toString();
    }

    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}
