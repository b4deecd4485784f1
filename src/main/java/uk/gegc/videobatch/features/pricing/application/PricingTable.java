package uk.gegc.videobatch.features.pricing.application;

import java.util.Set;

/**
 * Price list for generated units.
 */
public interface PricingTable {

    /**
     * Credits charged for one unit. Never fails: unknown combinations fall back to the
     * configured default cost.
     *
     * @return a positive credit amount
     */
    int unitCost(String model, int duration, String size);

    /**
     * Whether the model accepts the duration and size at all.
     */
    boolean isAllowed(String model, int duration, String size);

    Set<String> models();
}
