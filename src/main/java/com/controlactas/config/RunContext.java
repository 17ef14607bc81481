package com.controlactas.config;

import com.controlactas.model.Period;
import org.slf4j.MDC;

import java.util.UUID;

/**
 * Puts the run id and the period being processed into the logging MDC.
 * Used with try-with-resources around a period run.
 */
public final class RunContext implements AutoCloseable {

    public static final String RUN_ID = "runId";
    public static final String PERIOD = "period";

    private final String previousRunId;
    private final String previousPeriod;

    private RunContext(String runId, String period) {
        this.previousRunId = MDC.get(RUN_ID);
        this.previousPeriod = MDC.get(PERIOD);
        MDC.put(RUN_ID, runId);
        if (period == null) {
            MDC.remove(PERIOD);
        } else {
            MDC.put(PERIOD, period);
        }
    }

    /**
     * Opens a context for a batch of periods; each period run inside it shares the run id.
     */
    public static RunContext openRun() {
        return new RunContext(generateRunId(), null);
    }

    /**
     * Opens a context for the period. A run id already in the MDC (batch of periods)
     * is reused, otherwise a new one is generated.
     */
    public static RunContext open(Period period) {
        String runId = MDC.get(RUN_ID);
        if (runId == null || runId.isEmpty()) {
            runId = generateRunId();
        }
        return new RunContext(runId, period.folderName());
    }

    public static String generateRunId() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    }

    public static String currentRunId() {
        return MDC.get(RUN_ID);
    }

    @Override
    public void close() {
        restore(RUN_ID, previousRunId);
        restore(PERIOD, previousPeriod);
    }

    private static void restore(String key, String value) {
        if (value == null) {
            MDC.remove(key);
        } else {
            MDC.put(key, value);
        }
    }
}
