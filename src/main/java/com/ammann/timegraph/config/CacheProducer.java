/* (C)2026 */
package com.ammann.timegraph.config;

import com.ammann.timegraph.cache.ColumnCache;
import com.ammann.timegraph.properties.EngineProperties;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import org.eclipse.microprofile.config.inject.ConfigProperty;

/**
 * Produces the application's single {@link ColumnCache}.
 */
@ApplicationScoped
public class CacheProducer {

    @ConfigProperty(name = EngineProperties.Statistics.CACHE_CAPACITY, defaultValue = "256")
    int statisticsCapacity;

    @Produces
    @ApplicationScoped
    public ColumnCache columnCache(Instance<MeterRegistry> meterRegistry) {
        return new ColumnCache(
                statisticsCapacity, meterRegistry.isResolvable() ? meterRegistry.get() : null);
    }
}
