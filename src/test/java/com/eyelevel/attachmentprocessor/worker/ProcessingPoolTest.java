package com.eyelevel.attachmentprocessor.worker;

import com.eyelevel.attachmentprocessor.exception.BatchAggregationException;
import com.eyelevel.attachmentprocessor.exception.ObjectStoreException;
import com.eyelevel.attachmentprocessor.model.Attachment;
import com.eyelevel.attachmentprocessor.model.ProcessingContext;
import com.eyelevel.attachmentprocessor.model.ProcessingOutcome;
import com.eyelevel.attachmentprocessor.storage.ObjectStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * ProcessingPool unit tests
 */
class ProcessingPoolTest {

    private static ProcessingContext context(String filename) {
        Attachment attachment = Attachment.builder()
                .filename(filename)
                .size(4)
                .contentType("application/pdf")
                .payload(new byte[]{1, 2, 3, 4})
                .build();
        return new ProcessingContext(attachment, "Batch " + filename);
    }

    private static List<ProcessingContext> contexts(int count) {
        return IntStream.rangeClosed(1, count).mapToObj(i -> context("file-" + i + ".pdf")).toList();
    }

    private static ProcessingPool poolWith(ObjectStore store) {
        return new ProcessingPool(new AttachmentWorker(store, Clock.systemUTC()));
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 2, 4, 16})
    @DisplayName("Exactly one outcome per context regardless of worker count")
    void testOneOutcomePerContext(int workerCount) {
        List<ProcessingContext> work = contexts(10);

        List<ProcessingOutcome> outcomes = poolWith((key, payload, type, meta) -> { }).runAll(work, workerCount);

        assertThat(outcomes).hasSize(10);
        assertThat(outcomes).allMatch(ProcessingOutcome::success);
        assertThat(outcomes.stream().map(ProcessingOutcome::filename).collect(Collectors.toSet()))
                .isEqualTo(work.stream().map(ProcessingContext::filename).collect(Collectors.toSet()));
    }

    @Test
    @DisplayName("Empty work list returns immediately without invoking the worker")
    void testEmptyWorkList() {
        AttachmentWorker worker = mock(AttachmentWorker.class);

        List<ProcessingOutcome> outcomes = new ProcessingPool(worker).runAll(List.of(), 4);

        assertThat(outcomes).isEmpty();
        verifyNoInteractions(worker);
    }

    @Test
    @DisplayName("Worker count below one is rejected")
    void testInvalidWorkerCount() {
        ProcessingPool pool = poolWith((key, payload, type, meta) -> { });

        assertThatThrownBy(() -> pool.runAll(contexts(1), 0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("A failing upload affects only its own outcome")
    void testFaultIsolation() {
        ObjectStore store = (key, payload, type, meta) -> {
            if (key.endsWith("x.pdf")) {
                throw new ObjectStoreException("backend rejected x.pdf");
            }
        };

        List<ProcessingOutcome> outcomes = poolWith(store).runAll(List.of(context("x.pdf"), context("y.pdf")), 2);

        assertThat(outcomes).hasSize(2);
        assertThat(outcomes).filteredOn(o -> !o.success())
                .singleElement()
                .satisfies(o -> {
                    assertThat(o.filename()).isEqualTo("x.pdf");
                    assertThat(o.error()).contains("backend rejected");
                });
        assertThat(outcomes).filteredOn(ProcessingOutcome::success)
                .singleElement()
                .extracting(ProcessingOutcome::filename).isEqualTo("y.pdf");
    }

    @Test
    @DisplayName("A worker that throws still yields a failed outcome")
    void testWorkerRuntimeFault() {
        AttachmentWorker worker = mock(AttachmentWorker.class);
        ProcessingContext bad = context("bad.pdf");
        ProcessingContext good = context("good.pdf");
        when(worker.process(any())).thenAnswer(invocation -> {
            ProcessingContext ctx = invocation.getArgument(0);
            if (ctx == bad) {
                throw new IllegalStateException("worker crashed");
            }
            return ProcessingOutcome.succeeded(ctx, "key", Duration.ZERO);
        });

        List<ProcessingOutcome> outcomes = new ProcessingPool(worker).runAll(List.of(bad, good), 2);

        assertThat(outcomes).hasSize(2);
        assertThat(outcomes).filteredOn(o -> o.filename().equals("bad.pdf")).singleElement()
                .satisfies(o -> {
                    assertThat(o.success()).isFalse();
                    assertThat(o.error()).contains("worker crashed");
                });
    }

    @Test
    @DisplayName("An Error escaping the worker still yields a failed outcome")
    void testWorkerErrorFault() {
        AttachmentWorker worker = mock(AttachmentWorker.class);
        when(worker.process(any())).thenThrow(new NoClassDefFoundError("com/example/Missing"));

        List<ProcessingOutcome> outcomes = new ProcessingPool(worker).runAll(contexts(3), 2);

        assertThat(outcomes).hasSize(3).noneMatch(ProcessingOutcome::success);
        assertThat(outcomes).allSatisfy(o -> assertThat(o.error()).contains("terminated abnormally"));
    }

    @Test
    @DisplayName("Never more uploads in flight than workers")
    void testConcurrencyBound() {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        ObjectStore slowStore = (key, payload, type, meta) -> {
            int now = inFlight.incrementAndGet();
            maxInFlight.accumulateAndGet(now, Math::max);
            try {
                Thread.sleep(20);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                inFlight.decrementAndGet();
            }
        };

        List<ProcessingOutcome> outcomes = poolWith(slowStore).runAll(contexts(12), 3);

        assertThat(outcomes).hasSize(12);
        assertThat(maxInFlight.get()).isBetween(1, 3);
    }

    @Test
    @DisplayName("Work runs on named pool threads, not on the caller")
    void testRunsOnWorkerThreads() {
        Set<String> threadNames = ConcurrentHashMap.newKeySet();
        ObjectStore store = (key, payload, type, meta) -> threadNames.add(Thread.currentThread().getName());

        poolWith(store).runAll(contexts(4), 2);

        assertThat(threadNames).isNotEmpty()
                .allMatch(name -> name.startsWith(ProcessingPool.THREAD_NAME_PREFIX));
    }

    @Test
    @DisplayName("Outcomes are collected as they complete, not in submission order")
    void testCompletionOrder() {
        ObjectStore store = (key, payload, type, meta) -> {
            if (key.endsWith("slow.pdf")) {
                try {
                    Thread.sleep(300);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        };

        List<ProcessingOutcome> outcomes = poolWith(store).runAll(List.of(context("slow.pdf"), context("fast.pdf")), 2);

        assertThat(outcomes).extracting(ProcessingOutcome::filename).containsExactly("fast.pdf", "slow.pdf");
    }

    @Test
    @DisplayName("Interrupting the caller aborts the batch with an aggregation fault")
    void testInterruptedCaller() {
        ObjectStore store = (key, payload, type, meta) -> {
            try {
                Thread.sleep(5_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        };
        ProcessingPool pool = poolWith(store);

        Thread.currentThread().interrupt();
        try {
            assertThatThrownBy(() -> pool.runAll(contexts(2), 2)).isInstanceOf(BatchAggregationException.class);
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }
}
