package io.raggedcsv.metrics;

import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;

import java.util.Objects;

/**
 * Metrics of one component, registered as {@code <scope>.<name>} in a shared {@link MetricRegistry}.
 */
public class Metrics {
    private final MetricRegistry registry;
    private final String scope;

    public Metrics(MetricRegistry registry, String scope) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.scope = Objects.requireNonNull(scope, "scope");
    }

    public MetricRegistry registry() { return registry; }

    public String name(String metric) { return MetricRegistry.name(scope, metric); }

    public Meter meter(String metric) { return registry.meter(name(metric)); }
    public Timer timer(String metric) { return registry.timer(name(metric)); }
}
