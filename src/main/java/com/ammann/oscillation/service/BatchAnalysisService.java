/* (C)2026 */
package com.ammann.oscillation.service;

import com.ammann.oscillation.config.ExecutorProducer;
import com.ammann.oscillation.exception.SomeThingWentWrongException;
import com.ammann.oscillation.model.AnalysisParameters;
import com.ammann.oscillation.model.AnalysisResult;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Analyses many traces concurrently with the same parameters.
 *
 * <p>Every trace is an independent pipeline invocation submitted to the
 * {@value ExecutorProducer#TRACE_ANALYSIS_EXECUTOR}. Results keep the request order. A trace
 * whose analysis throws, or that the executor rejects because its queue is full, does not fail
 * the batch; its item carries the error message instead.
 */
@ApplicationScoped
public class BatchAnalysisService
{

    private static final Logger LOG = Logger.getLogger(BatchAnalysisService.class);

    private final OscillationAnalysisService analysisService;
    private final Executor executor;

    @Inject
    public BatchAnalysisService(OscillationAnalysisService analysisService,
                                @Named(ExecutorProducer.TRACE_ANALYSIS_EXECUTOR) Executor executor)
    {
        this.analysisService = analysisService;
        this.executor = executor;
    }

    /**
     * One named trace of a batch.
     */
    public record NamedTrace(String name, String content) {}

    /**
     * Outcome of one trace: either a result or the error that prevented it.
     */
    public record BatchItem(String name, AnalysisResult result, String error) {

        public boolean succeeded() {
            return result != null;
        }
    }

    /**
     * @param traces     traces in request order
     * @param parameters parameters applied to every trace
     * @return one item per trace, in request order
     * @throws SomeThingWentWrongException if waiting for the results is interrupted
     */
    public List<BatchItem> analyzeAll(List<NamedTrace> traces, AnalysisParameters parameters)
    {
        long start = System.nanoTime();
        List<CompletableFuture<BatchItem>> futures = new ArrayList<>(traces.size());

        for (NamedTrace trace : traces) {
            try {
                futures.add(CompletableFuture
                        .supplyAsync(() -> analysisService.analyze(trace.content(), parameters), executor)
                        .handle((result, error) -> toItem(trace.name(), result, error)));
            } catch (RejectedExecutionException e) {
                futures.add(CompletableFuture.completedFuture(toItem(trace.name(), null, e)));
            }
        }

        List<BatchItem> items = new ArrayList<>(futures.size());
        try {
            for (CompletableFuture<BatchItem> future : futures) {
                items.add(future.get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SomeThingWentWrongException("Batch analysis interrupted", e);
        } catch (ExecutionException e) {
            throw new SomeThingWentWrongException("Batch analysis failed", e.getCause());
        }

        LOG.infof("Batch of %d traces analysed in %.2fms (%d failed)",
                Integer.valueOf(traces.size()), Double.valueOf((System.nanoTime() - start) / 1_000_000.0),
                Long.valueOf(items.stream().filter(item -> !item.succeeded()).count()));
        return items;
    }

    private static BatchItem toItem(String name, AnalysisResult result, Throwable error)
    {
        if (error == null) {
            return new BatchItem(name, result, null);
        }

        Throwable cause = error.getCause() != null ? error.getCause() : error;
        LOG.warnf(cause, "Analysis of trace '%s' failed", name);
        return new BatchItem(name, null, cause.getClass().getSimpleName() + ": " + cause.getMessage());
    }
}
