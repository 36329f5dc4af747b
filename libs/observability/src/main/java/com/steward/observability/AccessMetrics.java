package com.steward.observability;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Meters for access-control mutations.
 *
 * <ul>
 *   <li>{@value #ACTIONS}: counter tagged {@code operation} and {@code outcome}
 *       ({@code success}, {@code denied} or {@code error})
 *   <li>{@value #DURATION}: timer tagged {@code operation}
 * </ul>
 *
 * <p>Predicates are not metered; they run far more often than mutations and carry no state change.
 */
public final class AccessMetrics {

    public static final String ACTIONS = "steward.access.actions";
    public static final String DURATION = "steward.access.action.duration";

    public static final String TAG_OPERATION = "operation";
    public static final String TAG_OUTCOME = "outcome";

    /** How a metered action ended. */
    public enum Outcome {
        SUCCESS,
        DENIED,
        ERROR;

        public String tagValue() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    private final MetricFactory factory;

    public AccessMetrics(MetricFactory factory) {
        if (factory == null) {
            throw new IllegalArgumentException("factory must not be null");
        }
        this.factory = factory;
    }

    /** Metrics recorded into a private registry that nothing scrapes. */
    public static AccessMetrics noop() {
        return new AccessMetrics(new MetricFactory(new SimpleMeterRegistry(), "steward"));
    }

    /** Records one finished action and how long it took. */
    public void record(String operation, Outcome outcome, long durationNanos) {
        factory.counter(
                        ACTIONS,
                        "Access-control actions by operation and outcome",
                        TAG_OPERATION,
                        operation,
                        TAG_OUTCOME,
                        outcome.tagValue())
                .increment();
        factory.timer(DURATION, "Access-control action duration", TAG_OPERATION, operation)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public MetricFactory factory() {
        return factory;
    }
}
