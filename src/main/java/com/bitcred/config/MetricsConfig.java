package com.bitcred.config;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import org.springframework.context.annotation.Configuration;

/**
 * Common tags for every meter, so custom ledger metrics and the auto-configured JVM/HTTP
 * metrics share the same dimensions. Ledger meters themselves are defined in
 * {@link com.bitcred.observability.LedgerMetricsService}.
 */
@Configuration
public class MetricsConfig {

    private final MeterRegistry meterRegistry;

    public MetricsConfig(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    void configureCommonTags() {
        meterRegistry.config().commonTags("application", "bitcred");
    }
}
