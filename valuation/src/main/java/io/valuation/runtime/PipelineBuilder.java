package io.valuation.runtime;

import com.codahale.metrics.MetricRegistry;
import io.valuation.core.Sink;
import io.valuation.core.Source;
import io.valuation.core.Transform;

import java.util.Objects;

public class PipelineBuilder<I, O> {
    private Source<I> source;
    private Transform<I, O> transform;
    private Sink<O> sink;
    private int workers = 4;
    private int queueCapacity = 64;
    private MetricRegistry metricRegistry = new MetricRegistry();
    private String name = "pipeline";

    public PipelineBuilder<I, O> source(Source<I> s) { this.source = s; return this; }
    public PipelineBuilder<I, O> transform(Transform<I, O> t) { this.transform = t; return this; }
    public PipelineBuilder<I, O> sink(Sink<O> s) { this.sink = s; return this; }
    public PipelineBuilder<I, O> workers(int w) { this.workers = Math.max(1, w); return this; }
    public PipelineBuilder<I, O> queueCapacity(int c) { this.queueCapacity = Math.max(1, c); return this; }
    public PipelineBuilder<I, O> metrics(MetricRegistry r) { this.metricRegistry = r; return this; }
    /** Prefix for the pipeline's metric names and thread names. */
    public PipelineBuilder<I, O> name(String n) { this.name = n; return this; }

    public Pipeline<I, O> build() {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(transform, "transform");
        Objects.requireNonNull(sink, "sink");
        Objects.requireNonNull(metricRegistry, "metrics");
        return new Pipeline<>(source, transform, sink, workers, queueCapacity, metricRegistry, name);
    }
}
