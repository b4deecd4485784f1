package uk.gegc.videobatch.features.pricing.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.videobatch.features.pricing.application.PricingTable;
import uk.gegc.videobatch.features.pricing.config.PricingProperties;

import java.util.Collections;
import java.util.Set;

@Slf4j
@Service
@RequiredArgsConstructor
public class ConfiguredPricingTable implements PricingTable {

    private final PricingProperties properties;

    @Override
    public int unitCost(String model, int duration, String size) {
        PricingProperties.ModelPricing pricing = model == null ? null : properties.getModels().get(model);
        if (pricing == null) {
            log.warn("No pricing for model {}, charging default unit cost {}", model, properties.getDefaultUnitCost());
            return properties.getDefaultUnitCost();
        }
        Integer base = pricing.getUnitCosts().get(duration);
        if (base == null || base <= 0) {
            log.warn("No pricing for model {} duration {}s, charging default unit cost {}",
                    model, duration, properties.getDefaultUnitCost());
            return properties.getDefaultUnitCost();
        }
        int surcharge = size == null ? 0 : pricing.getSizeSurcharges().getOrDefault(size, 0);
        return base + Math.max(0, surcharge);
    }

    @Override
    public boolean isAllowed(String model, int duration, String size) {
        PricingProperties.ModelPricing pricing = model == null ? null : properties.getModels().get(model);
        if (pricing == null) {
            return false;
        }
        return pricing.getDurations().contains(duration) && pricing.getSizes().contains(size);
    }

    @Override
    public Set<String> models() {
        return Collections.unmodifiableSet(properties.getModels().keySet());
    }
}
