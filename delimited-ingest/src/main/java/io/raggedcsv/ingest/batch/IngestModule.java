package io.raggedcsv.ingest.batch;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import io.raggedcsv.core.Sink;
import io.raggedcsv.core.Source;
import io.raggedcsv.core.Transform;
import io.raggedcsv.error.DeadLetterSink;
import io.raggedcsv.error.FileDeadLetterSink;
import io.raggedcsv.ingest.DelimitedIngestor;
import io.raggedcsv.ingest.IngestOptions;
import io.raggedcsv.ingest.decode.ByteDecoder;
import io.raggedcsv.ingest.delimiter.DelimiterInferencer;
import io.raggedcsv.ingest.fallback.FallbackParser;
import io.raggedcsv.ingest.tokenize.RowTokenizer;
import io.raggedcsv.runtime.Pipeline;
import io.raggedcsv.runtime.PipelineBuilder;
import io.raggedcsv.source.FileListSource;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Wires a batch run over the given inputs: file source, ingest transform, CSV sink and dead-letter files.
 */
public class IngestModule extends AbstractModule {
    public static final String FAILURES_FILE = "failures.jsonl";
    public static final String WRITE_FAILURES_FILE = "write-failures.jsonl";

    private final IngestConfig config;
    private final List<Path> inputs;

    public IngestModule(IngestConfig config, List<Path> inputs) {
        this.config = config;
        this.inputs = List.copyOf(inputs);
    }

    @Override
    protected void configure() {
        bind(IngestConfig.class).toInstance(config);
    }

    @Provides @Singleton MetricRegistry metricRegistry() { return new MetricRegistry(); }

    @Provides IngestOptions options() { return config.options(); }

    @Provides @Singleton DelimitedIngestor ingestor(MetricRegistry registry) {
        return new DelimitedIngestor(new ByteDecoder(), new DelimiterInferencer(),
                new FallbackParser(RowTokenizer.defaults(config.fieldLimit())), registry);
    }

    @Provides Source<Path> source() throws IOException { return new FileListSource(inputs); }

    @Provides Transform<Path, IngestedFile> transform(DelimitedIngestor ingestor, IngestOptions options) {
        return new IngestFileTransform(ingestor, options);
    }

    @Provides Sink<IngestedFile> sink() throws IOException { return new NormalizedCsvSink(config.outputDir()); }

    @Provides @Singleton DeadLetterSink<Path> ingestFailures() throws IOException {
        return new FileDeadLetterSink<>(config.outputDir().resolve(FAILURES_FILE));
    }

    @Provides @Singleton DeadLetterSink<IngestedFile> writeFailures() throws IOException {
        return new FileDeadLetterSink<>(config.outputDir().resolve(WRITE_FAILURES_FILE));
    }

    @Provides @Singleton Pipeline<Path, IngestedFile> pipeline(Source<Path> src,
                                                              Transform<Path, IngestedFile> tf,
                                                              Sink<IngestedFile> sk,
                                                              MetricRegistry registry,
                                                              DeadLetterSink<Path> dlqIn,
                                                              DeadLetterSink<IngestedFile> dlqOut) {
        return new PipelineBuilder<Path, IngestedFile>()
                .source(src)
                .transform(tf)
                .sink(sk)
                .workers(config.workers())
                .maxInFlight(Math.max(1, config.workers()) * 2)
                .metrics(registry)
                .deadLetterIn(dlqIn)
                .deadLetterOut(dlqOut)
                .build();
    }
}
