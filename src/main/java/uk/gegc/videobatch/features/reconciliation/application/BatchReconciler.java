package uk.gegc.videobatch.features.reconciliation.application;

import java.util.UUID;

/**
 * Heals drift between task rows and what actually happened, then recounts batch aggregates.
 * Never throws: failed corrections are logged and picked up by the next pass.
 */
public interface BatchReconciler {

    ReconciliationReport reconcileBatch(UUID batchId);

    /**
     * Reconcile every batch that currently has a stale running task or an unflagged result.
     */
    SweepSummary sweep();

    record ReconciliationReport(
            UUID batchId,
            int healedCompleted,
            int expiredRunning,
            int errors
    ) {
        public boolean hasCorrections() {
            return healedCompleted > 0 || expiredRunning > 0;
        }
    }

    record SweepSummary(
            int batchesVisited,
            int healedCompleted,
            int expiredRunning,
            int errors
    ) {}
}
