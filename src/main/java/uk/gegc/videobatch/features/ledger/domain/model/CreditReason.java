package uk.gegc.videobatch.features.ledger.domain.model;

import java.util.UUID;

/**
 * Reason tags written on ledger entries.
 */
public enum CreditReason {
    BATCH_DEBIT("batch_debit"),
    TASK_REFUND("task_refund"),
    ADJUSTMENT("adjustment");

    private final String tag;

    CreditReason(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    /**
     * Reason string referencing a batch or task, e.g. {@code task_refund:3f2a...}.
     */
    public String forReference(UUID reference) {
        return reference == null ? tag : tag + ":" + reference;
    }
}
