package com.taleforge.engine.logging;

import com.taleforge.core.model.TurnPhase;
import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC helper so that every log line written while a turn or rewind runs
 * carries the campaign, turn index and phase.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forTurn(campaignId)) {
 *     LoggingContext.setTurnIndex(7);
 *     log.info("Turn started"); // includes campaignId, turnIndex, traceId
 * }
 * </pre>
 */
public final class LoggingContext implements AutoCloseable {

    public static final String CAMPAIGN_ID = "campaignId";
    public static final String TURN_INDEX = "turnIndex";
    public static final String PHASE = "phase";
    public static final String OPERATION = "operation";
    public static final String TRACE_ID = "traceId";

    private LoggingContext() {
    }

    public static LoggingContext forTurn(UUID campaignId) {
        return open(campaignId, "turn");
    }

    /**
     * Context for a rewind; the turn index is the rewind target.
     */
    public static LoggingContext forRewind(UUID campaignId, int targetTurnIndex) {
        LoggingContext ctx = open(campaignId, "rewind");
        setTurnIndex(targetTurnIndex);
        return ctx;
    }

    private static LoggingContext open(UUID campaignId, String operation) {
        LoggingContext ctx = new LoggingContext();
        if (campaignId != null) {
            MDC.put(CAMPAIGN_ID, campaignId.toString());
        }
        MDC.put(OPERATION, operation);
        ensureTraceId();
        return ctx;
    }

    public static void setTurnIndex(int turnIndex) {
        MDC.put(TURN_INDEX, String.valueOf(turnIndex));
    }

    public static void setPhase(TurnPhase phase) {
        if (phase != null) {
            MDC.put(PHASE, phase.name());
        }
    }

    public static String getCampaignId() {
        return MDC.get(CAMPAIGN_ID);
    }

    public static String getTraceId() {
        return MDC.get(TRACE_ID);
    }

    private static void ensureTraceId() {
        if (MDC.get(TRACE_ID) == null) {
            MDC.put(TRACE_ID, UUID.randomUUID().toString().substring(0, 8));
        }
    }

    @Override
    public void close() {
        MDC.remove(CAMPAIGN_ID);
        MDC.remove(TURN_INDEX);
        MDC.remove(PHASE);
        MDC.remove(OPERATION);
        // traceId stays for the rest of the caller's request
    }

    public static void clearAll() {
        MDC.clear();
    }
}
