package uk.gegc.videobatch.features.ledger.application;

import org.slf4j.Logger;
import org.slf4j.MDC;

import java.util.UUID;

/**
 * Writes ledger log lines with the entry's fields in the MDC.
 */
public final class LedgerStructuredLogger {

    private LedgerStructuredLogger() {
    }

    public static void logLedgerWrite(Logger logger, String message,
                                      UUID ownerId, String reason, long delta,
                                      UUID refBatchId, UUID refTaskId, long balanceAfter,
                                      Object... args) {
        MDC.put("ledger.ownerId", ownerId != null ? ownerId.toString() : null);
        MDC.put("ledger.reason", reason);
        MDC.put("ledger.delta", String.valueOf(delta));
        MDC.put("ledger.refBatchId", refBatchId != null ? refBatchId.toString() : null);
        MDC.put("ledger.refTaskId", refTaskId != null ? refTaskId.toString() : null);
        MDC.put("ledger.balanceAfter", String.valueOf(balanceAfter));
        try {
            logger.info(message, args);
        } finally {
            clearLedgerMDC();
        }
    }

    public static void clearLedgerMDC() {
        MDC.remove("ledger.ownerId");
        MDC.remove("ledger.reason");
        MDC.remove("ledger.delta");
        MDC.remove("ledger.refBatchId");
        MDC.remove("ledger.refTaskId");
        MDC.remove("ledger.balanceAfter");
    }
}
