/* (C)2026 */
package com.ammann.dashboard.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Named;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.context.ManagedExecutor;
import org.eclipse.microprofile.context.ThreadContext;

/**
 * CDI producer for the named ManagedExecutor used by the analysis pipeline.
 *
 * <p>The "analysis-executor" plans the charts of a dataset while the request thread profiles it.
 * Its size is configured via application.properties:
 * <ul>
 *   <li>dashboard.executor.max-async</li>
 *   <li>dashboard.executor.max-queued</li>
 * </ul>
 */
@ApplicationScoped
public class ExecutorProducer {

    @ConfigProperty(name = "dashboard.executor.max-async", defaultValue = "4")
    int maxAsync = 4;

    @ConfigProperty(name = "dashboard.executor.max-queued", defaultValue = "64")
    int maxQueued = 64;

    /**
     * Produces the named ManagedExecutor for dataset analysis.
     *
     * @return configured ManagedExecutor instance
     */
    @Produces
    @Named("analysis-executor")
    @ApplicationScoped
    public ManagedExecutor createAnalysisExecutor() {
        return ManagedExecutor.builder()
                .maxAsync(maxAsync)
                .maxQueued(maxQueued)
                .propagated(ThreadContext.ALL_REMAINING)
                .cleared(ThreadContext.TRANSACTION)
                .build();
    }

    void closeAnalysisExecutor(@Disposes @Named("analysis-executor") ManagedExecutor executor) {
        executor.shutdown();
    }
}
