package io.github.riemr.pto.optimization.config;

import io.github.riemr.pto.optimization.service.BreakSuggestionOptimizer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OptimizerConfig {

    // working days a gap may have and still be chained with its neighbours
    @Value("${pto.optimizer.merge-gap-limit:2}")
    private int mergeGapLimit;

    @Bean
    public BreakSuggestionOptimizer breakSuggestionOptimizer() {
        if (mergeGapLimit < 0) {
            throw new IllegalStateException("pto.optimizer.merge-gap-limit must be >= 0 but was " + mergeGapLimit);
        }
        return new BreakSuggestionOptimizer(mergeGapLimit);
    }
}
