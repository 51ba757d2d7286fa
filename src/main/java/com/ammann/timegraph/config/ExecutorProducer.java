/* (C)2026 */
package com.ammann.timegraph.config;

import com.ammann.timegraph.properties.EngineProperties;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Named;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.context.ManagedExecutor;
import org.eclipse.microprofile.context.ThreadContext;

/**
 * CDI producer for the named ManagedExecutor that runs loads, filters and correlation
 * batches off the caller's thread.
 *
 * <p>Configuration properties:
 * <ul>
 *   <li>timegraph.executor.max-async</li>
 *   <li>timegraph.executor.max-queued</li>
 * </ul>
 */
@ApplicationScoped
public class ExecutorProducer {

    @ConfigProperty(name = EngineProperties.Executor.MAX_ASYNC, defaultValue = "2")
    int maxAsync;

    @ConfigProperty(name = EngineProperties.Executor.MAX_QUEUED, defaultValue = "16")
    int maxQueued;

    @Produces
    @Named(EngineProperties.EXECUTOR_NAME)
    @ApplicationScoped
    public ManagedExecutor createEngineExecutor() {
        return ManagedExecutor.builder()
                .maxAsync(maxAsync)
                .maxQueued(maxQueued)
                .propagated(ThreadContext.ALL_REMAINING)
                .cleared(ThreadContext.TRANSACTION)
                .build();
    }
}
