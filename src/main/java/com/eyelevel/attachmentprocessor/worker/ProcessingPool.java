package com.eyelevel.attachmentprocessor.worker;

import com.eyelevel.attachmentprocessor.exception.BatchAggregationException;
import com.eyelevel.attachmentprocessor.model.ProcessingContext;
import com.eyelevel.attachmentprocessor.model.ProcessingOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Fans a batch of attachments out to a bounded pool of threads and collects exactly one outcome per attachment.
 * <p>
 * Each call to {@link #runAll(List, int)} creates its own pool and shuts it down before returning,
 * so no worker thread outlives the call. Outcomes are gathered through an {@link ExecutorCompletionService},
 * in completion order.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProcessingPool {

    static final String THREAD_NAME_PREFIX = "attachment-worker-";
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 30;

    private final AttachmentWorker attachmentWorker;

    /**
     * Processes every context with at most {@code workerCount} attachments in flight and blocks until all are done.
     * A fault in one attachment becomes a failed outcome for that attachment only.
     *
     * @param contexts    The work items. May be empty.
     * @param workerCount Maximum number of concurrent workers, at least 1.
     * @return One outcome per context, in no particular order.
     * @throws BatchAggregationException if the calling thread is interrupted while waiting.
     */
    public List<ProcessingOutcome> runAll(final List<ProcessingContext> contexts, final int workerCount) {
        if (workerCount < 1) {
            throw new IllegalArgumentException("workerCount must be at least 1, was " + workerCount);
        }
        if (contexts.isEmpty()) {
            log.debug("No attachments to process; no workers started.");
            return List.of();
        }

        final int poolSize = Math.min(workerCount, contexts.size());
        log.info("Processing {} attachments using {} workers", contexts.size(), poolSize);
        final ExecutorService executor = Executors.newFixedThreadPool(poolSize,
                new CustomizableThreadFactory(THREAD_NAME_PREFIX));

        try {
            final CompletionService<ProcessingOutcome> completionService = new ExecutorCompletionService<>(executor);
            // Only touched by the calling thread.
            final Map<Future<ProcessingOutcome>, ProcessingContext> pending = new HashMap<>();
            for (final ProcessingContext context : contexts) {
                pending.put(completionService.submit(isolated(context)), context);
            }

            final List<ProcessingOutcome> outcomes = new ArrayList<>(contexts.size());
            for (int i = 0; i < contexts.size(); i++) {
                final Future<ProcessingOutcome> done = completionService.take();
                outcomes.add(collect(done, pending.remove(done)));
            }
            return outcomes;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BatchAggregationException("Interrupted while waiting for attachment outcomes.", e);
        } finally {
            shutdown(executor);
        }
    }

    private Callable<ProcessingOutcome> isolated(final ProcessingContext context) {
        return () -> {
            final long start = System.nanoTime();
            try {
                final ProcessingOutcome outcome = attachmentWorker.process(context);
                if (outcome == null) {
                    return ProcessingOutcome.failed(context, "Worker returned no outcome.",
                            Duration.ofNanos(System.nanoTime() - start));
                }
                return outcome;
            } catch (RuntimeException e) {
                log.error("Unexpected worker fault for '{}'", context.filename(), e);
                return ProcessingOutcome.failed(context, "Unexpected worker fault: " + AttachmentWorker.describe(e),
                        Duration.ofNanos(System.nanoTime() - start));
            }
        };
    }

    private ProcessingOutcome collect(final Future<ProcessingOutcome> done, final ProcessingContext context)
    throws InterruptedException {
        try {
            return done.get();
        } catch (ExecutionException e) {
            final Throwable cause = e.getCause() == null ? e : e.getCause();
            log.error("Worker for '{}' terminated abnormally", context.filename(), cause);
            return ProcessingOutcome.failed(context, "Worker terminated abnormally: " + AttachmentWorker.describe(cause),
                    Duration.ZERO);
        }
    }

    private void shutdown(final ExecutorService executor) {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Attachment workers did not terminate within {} seconds.", SHUTDOWN_TIMEOUT_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for attachment workers to terminate.");
        }
    }
}
