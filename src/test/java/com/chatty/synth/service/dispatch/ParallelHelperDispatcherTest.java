package com.chatty.synth.service.dispatch;

import com.chatty.synth.config.ThreadPoolConfig;
import com.chatty.synth.config.properties.DispatchProperties;
import com.chatty.synth.config.properties.ThreadPoolProperties;
import com.chatty.synth.config.seat.SeatModels;
import com.chatty.synth.domain.HelperResult;
import com.chatty.synth.domain.HelperSeat;
import com.chatty.synth.exception.AllHelpersFailedException;
import com.chatty.synth.exception.BackendException;
import com.chatty.synth.service.calibration.CalibrationComposer;
import com.chatty.synth.service.metrics.SynthMetrics;
import com.chatty.synth.service.metrics.SynthMetricsPublisher;
import com.chatty.synth.service.orchestration.event.HelperCompletedEvent;
import com.chatty.synth.service.orchestration.event.HelperFailedEvent;
import com.chatty.synth.testutil.EventCapturingPublisher;
import com.chatty.synth.testutil.RecordingBackend;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.awaitility.Awaitility;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ParallelHelperDispatcherTest {

    private static final SeatModels MODELS = models();

    private ExecutorService executor;
    private EventCapturingPublisher events;
    private SimpleMeterRegistry registry;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(3);
        events = new EventCapturingPublisher();
        registry = new SimpleMeterRegistry();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static SeatModels models() {
        Map<HelperSeat, String> m = new EnumMap<>(HelperSeat.class);
        m.put(HelperSeat.CODING, "m-coding");
        m.put(HelperSeat.CREATIVE, "m-creative");
        m.put(HelperSeat.SMALLTALK, "m-smalltalk");
        return new SeatModels(m, "m-synth");
    }

    private ParallelHelperDispatcher dispatcher(RecordingBackend backend, long timeoutMs) {
        return new ParallelHelperDispatcher(backend, new CalibrationComposer(), executor, events,
                new SynthMetricsPublisher(new SynthMetrics(registry)), new DispatchProperties(timeoutMs));
    }

    private static void sleep(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Test
    void resultsKeepSeatOrderRegardlessOfCompletionOrder() {
        // coding finishes last, smalltalk first
        RecordingBackend backend = new RecordingBackend((model, prompt) -> {
            switch (model) {
                case "m-coding" -> sleep(200);
                case "m-creative" -> sleep(100);
                default -> { }
            }
            return "  answer from " + model + "  ";
        });

        List<HelperResult> results = dispatcher(backend, 5000).dispatch("hello", MODELS);

        assertThat(results).extracting(HelperResult::seat)
                .containsExactly(HelperSeat.CODING, HelperSeat.CREATIVE, HelperSeat.SMALLTALK);
        assertThat(results).extracting(HelperResult::output)
                .containsExactly("answer from m-coding", "answer from m-creative", "answer from m-smalltalk");
        assertThat(events.eventsOfType(HelperCompletedEvent.class)).extracting(HelperCompletedEvent::seat)
                .containsExactly("coding", "creative", "smalltalk");
    }

    @Test
    void eachSeatReceivesItsCalibratedPrompt() {
        RecordingBackend backend = RecordingBackend.answering("ok");

        dispatcher(backend, 5000).dispatch("hello", MODELS);

        assertThat(backend.calls()).hasSize(3);
        assertThat(backend.calls()).allSatisfy(call -> assertThat(call.prompt()).endsWith("User request: hello"));
        assertThat(backend.callsWithPromptStarting("You are a code-first assistant."))
                .singleElement()
                .satisfies(call -> assertThat(call.model()).isEqualTo("m-coding"));
    }

    @Test
    void failedAndBlankSeatsAreDroppedAndReported() {
        RecordingBackend backend = new RecordingBackend((model, prompt) -> {
            if (model.equals("m-creative")) {
                throw new BackendException("connection refused", model);
            }
            return model.equals("m-smalltalk") ? "   " : "code answer";
        });

        List<HelperResult> results = dispatcher(backend, 5000).dispatch("hello", MODELS);

        assertThat(results).extracting(HelperResult::seat).containsExactly(HelperSeat.CODING);
        List<HelperFailedEvent> failures = events.eventsOfType(HelperFailedEvent.class);
        assertThat(failures).extracting(HelperFailedEvent::seat).containsExactly("creative", "smalltalk");
        assertThat(failures).extracting(HelperFailedEvent::reason)
                .containsExactly(ParallelHelperDispatcher.REASON_BACKEND, ParallelHelperDispatcher.REASON_BLANK);
        assertThat(registry.find("chattysynth.helper.failure").tag("seat", "creative").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.find("chattysynth.helper.success").tag("seat", "coding").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void unexpectedRuntimeErrorIsContainedToItsSeat() {
        RecordingBackend backend = new RecordingBackend((model, prompt) -> {
            if (model.equals("m-coding")) {
                throw new IllegalStateException("bug in stub");
            }
            return "fine";
        });

        List<HelperResult> results = dispatcher(backend, 5000).dispatch("hello", MODELS);

        assertThat(results).extracting(HelperResult::seat)
                .containsExactly(HelperSeat.CREATIVE, HelperSeat.SMALLTALK);
        assertThat(events.eventsOfType(HelperFailedEvent.class)).singleElement()
                .satisfies(e -> assertThat(e.reason()).isEqualTo(ParallelHelperDispatcher.REASON_UNEXPECTED));
    }

    @Test
    void seatStillRunningAtDeadlineCountsAsFailed() {
        RecordingBackend backend = new RecordingBackend((model, prompt) -> {
            if (model.equals("m-coding")) {
                sleep(3000);
            }
            return "answer";
        });

        long start = System.nanoTime();
        List<HelperResult> results = dispatcher(backend, 300).dispatch("hello", MODELS);
        long elapsedMs = (System.nanoTime() - start) / 1_000_000L;

        assertThat(elapsedMs).isLessThan(2000);
        assertThat(results).extracting(HelperResult::seat)
                .containsExactly(HelperSeat.CREATIVE, HelperSeat.SMALLTALK);
        assertThat(events.eventsOfType(HelperFailedEvent.class)).singleElement()
                .satisfies(e -> {
                    assertThat(e.seat()).isEqualTo("coding");
                    assertThat(e.reason()).isEqualTo(ParallelHelperDispatcher.REASON_TIMEOUT);
                });
    }

    @Test
    void allSeatsFailingThrows() {
        RecordingBackend backend = new RecordingBackend((model, prompt) -> {
            throw new BackendException("down", model);
        });

        assertThatThrownBy(() -> dispatcher(backend, 5000).dispatch("hello", MODELS))
                .isInstanceOf(AllHelpersFailedException.class)
                .hasMessage("All 3 helper seats failed");
        assertThat(events.eventsOfType(HelperFailedEvent.class)).hasSize(3);
    }

    @Test
    void saturatedPoolRejectsSeatsInsteadOfRunningThemOnCaller() {
        ThreadPoolProperties props = new ThreadPoolProperties();
        props.getHelper().setCorePoolSize(1);
        props.getHelper().setMaxPoolSize(1);
        props.getHelper().setQueueCapacity(0);
        ThreadPoolTaskExecutor pool = (ThreadPoolTaskExecutor) new ThreadPoolConfig(props).helperExecutor();
        String caller = Thread.currentThread().getName();
        List<String> workerThreads = new CopyOnWriteArrayList<>();
        RecordingBackend backend = new RecordingBackend((model, prompt) -> {
            workerThreads.add(Thread.currentThread().getName());
            sleep(1500);
            return "answer";
        });
        ParallelHelperDispatcher saturated = new ParallelHelperDispatcher(backend, new CalibrationComposer(), pool,
                events, new SynthMetricsPublisher(new SynthMetrics(registry)), new DispatchProperties(200));

        try {
            long start = System.nanoTime();
            assertThatThrownBy(() -> saturated.dispatch("hello", MODELS))
                    .isInstanceOf(AllHelpersFailedException.class);
            long elapsedMs = (System.nanoTime() - start) / 1_000_000L;

            assertThat(elapsedMs).isLessThan(1000);
            assertThat(workerThreads).doesNotContain(caller);
            assertThat(events.eventsOfType(HelperFailedEvent.class)).extracting(HelperFailedEvent::reason)
                    .containsExactly(ParallelHelperDispatcher.REASON_TIMEOUT,
                            ParallelHelperDispatcher.REASON_REJECTED, ParallelHelperDispatcher.REASON_REJECTED);
        } finally {
            pool.shutdown();
        }
    }

    @Test
    void seatCancelledAtDeadlineIsInterrupted() {
        AtomicBoolean interrupted = new AtomicBoolean();
        RecordingBackend backend = new RecordingBackend((model, prompt) -> {
            if (model.equals("m-coding")) {
                try {
                    Thread.sleep(5000);
                } catch (InterruptedException e) {
                    interrupted.set(true);
                    Thread.currentThread().interrupt();
                }
            }
            return "answer";
        });

        dispatcher(backend, 200).dispatch("hello", MODELS);

        Awaitility.await().atMost(1, TimeUnit.SECONDS).untilTrue(interrupted);
    }
}
