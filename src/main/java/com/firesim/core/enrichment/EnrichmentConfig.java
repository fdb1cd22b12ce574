package com.firesim.core.enrichment;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Optional;

@Configuration
public class EnrichmentConfig {

    /** No dataset wired: every lookup reports no coverage. */
    @Bean
    @ConditionalOnMissingBean(VegetationLookup.class)
    public VegetationLookup noCoverageVegetationLookup() {
        return (centroid, boundingBox) -> Optional.empty();
    }
}
