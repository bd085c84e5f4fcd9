package com.chatty.synth.service.metrics;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

/**
 * Null-tolerant front for {@link SynthMetrics} used by the dispatcher, synthesizer and orchestrator.
 *
 * <p>With no {@link SynthMetrics} every method is a no-op, so components run without a registry
 * in unit tests.
 */
@Component
public final class SynthMetricsPublisher {

    private static final Logger LOG = LogManager.getLogger(SynthMetricsPublisher.class);

    /**
     * Shared no-op instance.
     */
    public static final SynthMetricsPublisher NOOP = new SynthMetricsPublisher(null);

    private final SynthMetrics metrics;

    /**
     * @param metrics metrics service (nullable for test mode)
     */
    public SynthMetricsPublisher(SynthMetrics metrics) {
        this.metrics = metrics;
        if (metrics == null) {
            LOG.debug("SynthMetricsPublisher created without metrics (test mode)");
        }
    }

    public void recordHelperSuccess(String seat, long durationNanos) {
        if (metrics == null) {
            return;
        }
        metrics.recordHelperLatency(seat, durationNanos);
        metrics.incrementHelperSuccess(seat);
    }

    public void recordHelperFailure(String seat, String reason) {
        if (metrics == null) {
            return;
        }
        metrics.incrementHelperFailure(seat, reason);
    }

    public void recordSynthesis(long durationNanos) {
        if (metrics == null) {
            return;
        }
        metrics.recordSynthesisLatency(durationNanos);
    }

    public void recordRequestFailure(String category) {
        if (metrics == null) {
            return;
        }
        metrics.incrementRequestFailure(category);
    }

    public boolean isEnabled() {
        return metrics != null;
    }
}
