package uk.gegc.videobatch.features.pricing.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Credit price list and per-model allow-lists.
 *
 * <pre>
 * pricing:
 *   default-unit-cost: 15
 *   models:
 *     sora-2:
 *       durations: [10, 15]
 *       sizes: [small, large]
 *       unit-costs: {10: 10, 15: 15}
 * </pre>
 */
@Data
@Validated
@ConfigurationProperties(prefix = "pricing")
public class PricingProperties {

    /**
     * Cost charged per unit when the model/duration/size combination has no configured price.
     */
    @Positive
    private int defaultUnitCost = 15;

    @Valid
    private Map<String, ModelPricing> models = new LinkedHashMap<>();

    @Data
    public static class ModelPricing {
        private Set<Integer> durations = new LinkedHashSet<>();
        private Set<String> sizes = new LinkedHashSet<>();
        /**
         * Credits per unit keyed by duration in seconds.
         */
        private Map<Integer, Integer> unitCosts = new LinkedHashMap<>();
        /**
         * Extra credits per unit keyed by size; absent sizes cost nothing extra.
         */
        private Map<String, Integer> sizeSurcharges = new LinkedHashMap<>();
    }
}
