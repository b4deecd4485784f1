package uk.gegc.videobatch.features.reconciliation.application.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import uk.gegc.videobatch.features.reconciliation.application.BatchReconciler;

/**
 * Periodic reconciliation of all batches with drift.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "reconciler", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ReconciliationSweepScheduler {

    private final BatchReconciler reconciler;

    @Scheduled(fixedDelayString = "${reconciler.sweep-interval:PT60S}", initialDelayString = "${reconciler.sweep-interval:PT60S}")
    public void sweep() {
        log.debug("Running scheduled reconciliation sweep");
        try {
            reconciler.sweep();
        } catch (Exception e) {
            log.error("Error during scheduled reconciliation sweep", e);
            // keep the schedule alive, the next sweep retries
        }
    }
}
