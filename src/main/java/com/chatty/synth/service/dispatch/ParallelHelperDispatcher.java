package com.chatty.synth.service.dispatch;

import com.chatty.synth.config.properties.DispatchProperties;
import com.chatty.synth.config.seat.SeatModels;
import com.chatty.synth.domain.HelperResult;
import com.chatty.synth.domain.HelperSeat;
import com.chatty.synth.exception.AllHelpersFailedException;
import com.chatty.synth.exception.BackendException;
import com.chatty.synth.service.calibration.CalibrationComposer;
import com.chatty.synth.service.llm.LanguageModelBackend;
import com.chatty.synth.service.metrics.SynthMetricsPublisher;
import com.chatty.synth.service.orchestration.event.HelperCompletedEvent;
import com.chatty.synth.service.orchestration.event.HelperFailedEvent;
import com.chatty.synth.util.LogSanitizer;
import com.chatty.synth.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs the coding, creative and smalltalk seats in parallel on the {@code helperExecutor}.
 *
 * <p><b>Thread model:</b> one task per seat. The calling thread blocks on a barrier over all
 * tasks, bounded by {@code synth.dispatch.timeout-ms}; tasks still running at the deadline are
 * cancelled and count as failed; their worker threads are interrupted. A seat the executor
 * rejects (pool and queue full) fails immediately with reason {@code rejected}.
 *
 * <p><b>Error handling:</b> a backend error, blank output or timeout turns that seat into
 * "no result". Failures are logged, counted and published as {@link HelperFailedEvent}s;
 * they never propagate unless every seat failed.
 *
 * <p><b>Ordering:</b> results are collected after the barrier by walking the futures in
 * seat order, so the output order never depends on which call finished first. Events are
 * published from the calling thread in the same order.
 */
@Service
public class ParallelHelperDispatcher implements HelperDispatcher {

    private static final Logger LOG = LogManager.getLogger(ParallelHelperDispatcher.class);

    static final String REASON_BACKEND = "backend_error";
    static final String REASON_BLANK = "blank_output";
    static final String REASON_TIMEOUT = "timeout";
    static final String REASON_UNEXPECTED = "unexpected_error";
    static final String REASON_REJECTED = "rejected";

    private final LanguageModelBackend backend;
    private final CalibrationComposer composer;
    private final Executor executor;
    private final ApplicationEventPublisher publisher;
    private final SynthMetricsPublisher metrics;
    private final long timeoutMs;

    public ParallelHelperDispatcher(LanguageModelBackend backend,
                                    CalibrationComposer composer,
                                    @Qualifier("helperExecutor") Executor executor,
                                    ApplicationEventPublisher publisher,
                                    SynthMetricsPublisher metrics,
                                    DispatchProperties props) {
        this.backend = Objects.requireNonNull(backend, "backend");
        this.composer = Objects.requireNonNull(composer, "composer");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.metrics = metrics == null ? SynthMetricsPublisher.NOOP : metrics;
        this.timeoutMs = props.timeoutMs() <= 0 ? DispatchProperties.DEFAULT_TIMEOUT_MS : props.timeoutMs();
    }

    @Override
    public List<HelperResult> dispatch(String prompt, SeatModels models) {
        Objects.requireNonNull(prompt, "prompt");
        Objects.requireNonNull(models, "models");
        List<HelperSeat> seats = HelperSeat.dispatchOrder();

        List<CompletableFuture<SeatOutcome>> futures = new ArrayList<>(seats.size());
        List<SeatTask> tasks = new ArrayList<>(seats.size());
        for (HelperSeat seat : seats) {
            String model = models.modelFor(seat);
            SeatTask task = new SeatTask();
            tasks.add(task);
            futures.add(submit(seat, model, prompt, task));
        }

        try {
            CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new))
                    .get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException te) {
            LOG.warn("Helper dispatch timed out after {} ms; cancelling unfinished seats", timeoutMs);
            cancelAll(futures, tasks);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            cancelAll(futures, tasks);
        } catch (ExecutionException ee) {
            // runSeat handles its own errors; per-seat outcomes are still collected below
            LOG.debug("Helper barrier completed exceptionally: {}", ee.getMessage());
        }

        List<HelperResult> results = new ArrayList<>(seats.size());
        for (int i = 0; i < seats.size(); i++) {
            HelperSeat seat = seats.get(i);
            SeatOutcome outcome = outcomeOf(futures.get(i), seat, models.modelFor(seat));
            report(outcome);
            if (outcome.result() != null) {
                results.add(outcome.result());
            }
        }

        if (results.isEmpty()) {
            throw new AllHelpersFailedException(seats.size());
        }
        LOG.info("Helper dispatch finished: {}/{} seats answered", results.size(), seats.size());
        return List.copyOf(results);
    }

    private CompletableFuture<SeatOutcome> submit(HelperSeat seat, String model, String prompt, SeatTask task) {
        try {
            return CompletableFuture.supplyAsync(() -> task.run(() -> runSeat(seat, model, prompt)), executor);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.completedFuture(
                    SeatOutcome.failed(seat, model, REASON_REJECTED, "Helper pool saturated"));
        }
    }

    private static void cancelAll(List<CompletableFuture<SeatOutcome>> futures, List<SeatTask> tasks) {
        for (int i = 0; i < futures.size(); i++) {
            if (futures.get(i).cancel(true)) {
                tasks.get(i).interrupt();
            }
        }
    }

    private SeatOutcome runSeat(HelperSeat seat, String model, String prompt) {
        long t0 = System.nanoTime();
        try {
            String output = backend.generate(model, composer.compose(seat, prompt));
            long nanos = System.nanoTime() - t0;
            String trimmed = output == null ? "" : output.trim();
            if (trimmed.isEmpty()) {
                return SeatOutcome.failed(seat, model, REASON_BLANK, "Blank output");
            }
            return SeatOutcome.succeeded(seat, model, new HelperResult(seat, trimmed, TimeUtils.nanosToMillis(nanos)), nanos);
        } catch (BackendException be) {
            return SeatOutcome.failed(seat, model, REASON_BACKEND, be.getMessage());
        } catch (RuntimeException re) {
            LOG.error("Seat {} unexpected error", seat.id(), re);
            return SeatOutcome.failed(seat, model, REASON_UNEXPECTED, re.getMessage());
        }
    }

    private static SeatOutcome outcomeOf(CompletableFuture<SeatOutcome> f, HelperSeat seat, String model) {
        if (f.isDone() && !f.isCompletedExceptionally() && !f.isCancelled()) {
            SeatOutcome outcome = f.getNow(null);
            if (outcome != null) {
                return outcome;
            }
        }
        return SeatOutcome.failed(seat, model, REASON_TIMEOUT, "No result before dispatch deadline");
    }

    private void report(SeatOutcome outcome) {
        String seatId = outcome.seat().id();
        if (outcome.result() != null) {
            HelperResult r = outcome.result();
            LOG.debug("Seat {} answered in {}ms: '{}'", seatId, r.durationMs(), LogSanitizer.preview(r.output()));
            metrics.recordHelperSuccess(seatId, outcome.nanos());
            publisher.publishEvent(new HelperCompletedEvent(seatId, outcome.model(), r.durationMs(),
                    r.output().length(), Instant.now()));
        } else {
            LOG.warn("Seat {} produced no result ({}): {}", seatId, outcome.reason(), outcome.message());
            metrics.recordHelperFailure(seatId, outcome.reason());
            publisher.publishEvent(new HelperFailedEvent(seatId, outcome.model(), outcome.reason(),
                    outcome.message(), Instant.now()));
        }
    }

    /**
     * Tracks the worker running one seat so a cancelled seat's thread can be interrupted.
     * CompletableFuture.cancel alone never reaches the running task.
     */
    private static final class SeatTask {
        private Thread worker;
        private boolean cancelled;

        SeatOutcome run(Supplier<SeatOutcome> body) {
            synchronized (this) {
                if (cancelled) {
                    return null;
                }
                worker = Thread.currentThread();
            }
            try {
                return body.get();
            } finally {
                synchronized (this) {
                    worker = null;
                }
            }
        }

        synchronized void interrupt() {
            cancelled = true;
            if (worker != null) {
                worker.interrupt();
            }
        }
    }

    private record SeatOutcome(HelperSeat seat, String model, HelperResult result, long nanos,
                               String reason, String message) {

        static SeatOutcome succeeded(HelperSeat seat, String model, HelperResult result, long nanos) {
            return new SeatOutcome(seat, model, result, nanos, null, null);
        }

        static SeatOutcome failed(HelperSeat seat, String model, String reason, String message) {
            return new SeatOutcome(seat, model, null, 0L, reason, message);
        }
    }
}
