/* (C)2026 */
package com.ammann.oscillation.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Named;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.context.ManagedExecutor;
import org.eclipse.microprofile.context.ThreadContext;

/**
 * CDI producer for the executor that runs batch trace analyses.
 *
 * <p>Each submitted task is one independent pipeline invocation; the pool size bounds how
 * many traces of a batch are analysed at the same time.
 */
@ApplicationScoped
public class ExecutorProducer {

    public static final String TRACE_ANALYSIS_EXECUTOR = "trace-analysis-executor";

    @ConfigProperty(name = "oscillation.analysis.batch.max-threads", defaultValue = "4")
    int maxThreads;

    @ConfigProperty(name = "oscillation.analysis.batch.queue-size", defaultValue = "100")
    int queueSize;

    /**
     * Configuration properties:
     * <ul>
     *   <li>oscillation.analysis.batch.max-threads</li>
     *   <li>oscillation.analysis.batch.queue-size</li>
     * </ul>
     *
     * @return Configured ManagedExecutor instance
     */
    @Produces
    @Named(TRACE_ANALYSIS_EXECUTOR)
    @ApplicationScoped
    public ManagedExecutor createTraceAnalysisExecutor() {
        return ManagedExecutor.builder()
                .maxAsync(maxThreads)
                .maxQueued(queueSize)
                .propagated(ThreadContext.NONE)
                .cleared(ThreadContext.ALL_REMAINING)
                .build();
    }
}
