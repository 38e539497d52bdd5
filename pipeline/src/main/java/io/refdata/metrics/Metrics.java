package io.refdata.metrics;

import com.codahale.metrics.Counter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;

/**
 * Thin facade over a shared {@link MetricRegistry}; names are prefixed so several components can share one registry.
 */
public class Metrics {
    private final MetricRegistry registry;
    private final String prefix;

    public Metrics(MetricRegistry registry) {
        this(registry, "");
    }

    public Metrics(MetricRegistry registry, String prefix) {
        this.registry = registry;
        this.prefix = prefix == null || prefix.isEmpty() ? "" : prefix + ".";
    }

    public MetricRegistry registry() { return registry; }

    public Metrics scoped(String name) { return new Metrics(registry, prefix + name); }

    public Counter counter(String name) { return registry.counter(prefix + name); }
    public Timer timer(String name) { return registry.timer(prefix + name); }
}
