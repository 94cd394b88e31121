package io.workline.core.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.workline.core.conversation.AdversarialLevel;
import io.workline.core.outbox.DeliveryOutcome;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Counters and distributions for calls, turns and webhook deliveries, rendered in the
 * Prometheus text format when backed by a {@link PrometheusMeterRegistry}.
 */
public final class PipelineMetrics {
    static final String CALLS_STARTED = "workline.calls.started";
    static final String CALLS_COMPLETED = "workline.calls.completed";
    static final String CALLS_FAILED = "workline.calls.failed";
    static final String TURNS = "workline.turns";
    static final String DELIVERIES = "workline.webhook.deliveries";
    static final String CALL_DURATION = "workline.call.duration";
    static final String DELIVERY_LATENCY = "workline.webhook.delivery.latency";
    static final String ADVERSARIAL_SCORE = "workline.adversarial.score";

    private final MeterRegistry registry;
    private final Counter callsStarted;
    private final Timer callDuration;
    private final Timer deliveryLatency;
    private final DistributionSummary adversarialScore;

    public PipelineMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.callsStarted = Counter.builder(CALLS_STARTED)
            .description("Calls admitted past the rate limiter")
            .register(registry);
        this.callDuration = Timer.builder(CALL_DURATION)
            .description("Wall time from call start to completion or failure")
            .register(registry);
        this.deliveryLatency = Timer.builder(DELIVERY_LATENCY)
            .description("Round trip of one webhook delivery attempt")
            .register(registry);
        this.adversarialScore = DistributionSummary.builder(ADVERSARIAL_SCORE)
            .description("Mean per-turn adversarial score of finished calls")
            .register(registry);
    }

    public static PipelineMetrics prometheus() {
        return new PipelineMetrics(new PrometheusMeterRegistry(PrometheusConfig.DEFAULT));
    }

    public void callStarted() {
        callsStarted.increment();
    }

    public void callCompleted(double meanAdversarialScore, Duration duration) {
        AdversarialLevel level = AdversarialLevel.of(meanAdversarialScore);
        Counter.builder(CALLS_COMPLETED)
            .tag("adversarial_level", level.name().toLowerCase(Locale.ROOT))
            .register(registry)
            .increment();
        adversarialScore.record(meanAdversarialScore);
        recordDuration(duration);
    }

    public void callFailed(String reason, Duration duration) {
        Counter.builder(CALLS_FAILED)
            .tag("reason", reason == null || reason.isBlank() ? "unknown" : reason)
            .register(registry)
            .increment();
        recordDuration(duration);
    }

    public void turn(boolean fallback) {
        Counter.builder(TURNS)
            .tag("result", fallback ? "fallback" : "ok")
            .register(registry)
            .increment();
    }

    public void delivery(DeliveryOutcome outcome, Duration latency) {
        Counter.builder(DELIVERIES)
            .tag("outcome", outcome.tag())
            .register(registry)
            .increment();
        if (latency != null) {
            deliveryLatency.record(latency);
        }
    }

    public PipelineSummary summary() {
        long started = (long) callsStarted.count();
        long completed = sum(CALLS_COMPLETED, null, null);
        long failed = sum(CALLS_FAILED, null, null);
        long finished = completed + failed;
        return new PipelineSummary(
            started,
            completed,
            failed,
            finished == 0 ? 0.0 : (completed * 100.0) / finished,
            sum(TURNS, null, null),
            sum(TURNS, "result", "fallback"),
            sum(DELIVERIES, "outcome", DeliveryOutcome.SUCCESS.tag()),
            sum(DELIVERIES, "outcome", DeliveryOutcome.RETRY.tag()),
            sum(DELIVERIES, "outcome", DeliveryOutcome.DEAD_LETTER.tag()),
            callDuration.count() == 0 ? 0.0 : callDuration.mean(TimeUnit.SECONDS),
            adversarialScore.count() == 0 ? 0.0 : adversarialScore.mean()
        );
    }

    /**
     * Prometheus exposition text, or an empty string when the registry cannot render it.
     */
    public String scrape() {
        if (registry instanceof PrometheusMeterRegistry prometheus) {
            return prometheus.scrape();
        }
        return "";
    }

    public MeterRegistry registry() {
        return registry;
    }

    private void recordDuration(Duration duration) {
        if (duration != null && !duration.isNegative()) {
            callDuration.record(duration);
        }
    }

    private long sum(String name, String tagKey, String tagValue) {
        var search = registry.find(name);
        if (tagKey != null) {
            search = search.tag(tagKey, tagValue);
        }
        return (long) search.counters().stream().mapToDouble(Counter::count).sum();
    }
}
