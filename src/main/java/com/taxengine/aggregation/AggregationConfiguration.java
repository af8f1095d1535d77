package com.taxengine.aggregation;

import com.taxengine.contract.ConflictAspect;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.stream.Collectors;

@Configuration
public class AggregationConfiguration {

    /**
     * Authority precedence with a relative tolerance for numeric agreement.
     */
    @Bean
    public ReconciliationPolicy reconciliationPolicy(
            @Value("${taxengine.aggregation.tolerance:0.0001}") BigDecimal tolerance) {
        return new AuthorityPrecedencePolicy(tolerance);
    }

    @Bean
    public AggregationSettings aggregationSettings(
            @Value("${taxengine.aggregation.required-aspects:brackets,formulas}") String[] requiredAspects) {
        return new AggregationSettings(Arrays.stream(requiredAspects)
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .map(ConflictAspect::fromValue)
            .collect(Collectors.toSet()));
    }
}
