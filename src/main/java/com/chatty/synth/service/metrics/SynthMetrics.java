package com.chatty.synth.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer instrumentation for helper dispatch and synthesis.
 *
 * <p>Meters:
 * <ul>
 *   <li>{@code chattysynth.helper.latency} per seat</li>
 *   <li>{@code chattysynth.helper.success} / {@code chattysynth.helper.failure} per seat</li>
 *   <li>{@code chattysynth.synthesis.latency}</li>
 *   <li>{@code chattysynth.request.failure} per failure category</li>
 * </ul>
 */
@Component
public class SynthMetrics {

    private static final String METRIC_PREFIX = "chattysynth";

    private final MeterRegistry registry;

    public SynthMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordHelperLatency(String seat, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".helper.latency")
                .description("Time taken by one helper seat backend call")
                .tag("seat", seat)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementHelperSuccess(String seat) {
        Counter.builder(METRIC_PREFIX + ".helper.success")
                .description("Number of helper seats that produced output")
                .tag("seat", seat)
                .register(registry)
                .increment();
    }

    /**
     * @param seat helper seat id
     * @param reason failure category (backend_error, blank_output, timeout, unexpected_error)
     */
    public void incrementHelperFailure(String seat, String reason) {
        Counter.builder(METRIC_PREFIX + ".helper.failure")
                .description("Number of helper seats that produced no result")
                .tag("seat", seat)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordSynthesisLatency(long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".synthesis.latency")
                .description("Time taken by the synthesis backend call")
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * @param category failure category, e.g. the simple name of the exception
     */
    public void incrementRequestFailure(String category) {
        Counter.builder(METRIC_PREFIX + ".request.failure")
                .description("Number of synthesis requests that failed")
                .tag("category", category)
                .register(registry)
                .increment();
    }
}
