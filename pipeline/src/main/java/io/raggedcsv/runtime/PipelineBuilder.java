package io.raggedcsv.runtime;

import com.codahale.metrics.MetricRegistry;
import io.raggedcsv.core.Sink;
import io.raggedcsv.core.Source;
import io.raggedcsv.core.Transform;
import io.raggedcsv.error.DeadLetterSink;
import io.raggedcsv.metrics.Metrics;

import java.util.Objects;

public class PipelineBuilder<I, O> {
    private Source<I> source;
    private Transform<I, O> transform;
    private Sink<O> sink;
    private int workers = Math.max(1, Runtime.getRuntime().availableProcessors());
    private int maxInFlight = 64;
    private MetricRegistry metricRegistry = new MetricRegistry();
    private DeadLetterSink<I> dlqIn;
    private DeadLetterSink<O> dlqOut;

    public PipelineBuilder<I, O> source(Source<I> s) { this.source = s; return this; }
    public PipelineBuilder<I, O> transform(Transform<I, O> t) { this.transform = t; return this; }
    public PipelineBuilder<I, O> sink(Sink<O> s) { this.sink = s; return this; }
    public PipelineBuilder<I, O> workers(int w) { this.workers = Math.max(1, w); return this; }
    public PipelineBuilder<I, O> maxInFlight(int n) { this.maxInFlight = Math.max(1, n); return this; }
    public PipelineBuilder<I, O> metrics(MetricRegistry r) { this.metricRegistry = r; return this; }
    public PipelineBuilder<I, O> deadLetterIn(DeadLetterSink<I> d) { this.dlqIn = d; return this; }
    public PipelineBuilder<I, O> deadLetterOut(DeadLetterSink<O> d) { this.dlqOut = d; return this; }

    public Pipeline<I, O> build() {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(transform, "transform");
        Objects.requireNonNull(sink, "sink");
        Objects.requireNonNull(metricRegistry, "metrics");
        return new Pipeline<>(source, transform, sink, workers, maxInFlight, new Metrics(metricRegistry, "pipeline"), dlqIn, dlqOut);
    }
}
