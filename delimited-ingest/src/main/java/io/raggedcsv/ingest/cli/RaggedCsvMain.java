package io.raggedcsv.ingest.cli;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.Key;
import com.google.inject.ProvisionException;
import com.google.inject.TypeLiteral;
import io.raggedcsv.ingest.batch.IngestConfig;
import io.raggedcsv.ingest.batch.IngestModule;
import io.raggedcsv.ingest.batch.IngestedFile;
import io.raggedcsv.runtime.Pipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Normalizes messy delimited files into fixed-width CSVs.
 */
@CommandLine.Command(name = "ragged-csv", mixinStandardHelpOptions = true,
        description = "Read messy delimited files without dropping rows and write fixed-width CSVs")
public final class RaggedCsvMain implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(RaggedCsvMain.class);

    @CommandLine.Parameters(arity = "1..*", paramLabel = "INPUT", description = "Files or directories (not recursed) to ingest")
    List<Path> inputs = new ArrayList<>();

    @CommandLine.Option(names = {"-n", "--expected-cols"}, description = "Columns in every output row (default 106 unless configured)")
    Integer expectedCols;

    @CommandLine.Option(names = {"-m", "--merge-into"}, description = "Header name of the column that absorbs overflow fields (default: last column)")
    String mergeInto;

    @CommandLine.Option(names = {"-d", "--delimiter"}, description = "Field delimiter: a character or tab|comma|semicolon|pipe (default: inferred)")
    String delimiter;

    @CommandLine.Option(names = {"-e", "--encoding"}, description = "Input charset (default: detected)")
    String encoding;

    @CommandLine.Option(names = {"-o", "--out"}, description = "Output directory")
    Path outDir;

    @CommandLine.Option(names = {"-w", "--workers"}, description = "Files ingested in parallel")
    Integer workers;

    @CommandLine.Option(names = {"--sample-lines"}, description = "Non-blank lines sampled for delimiter inference")
    Integer sampleLines;

    public static void main(String[] args) {
        int code = new CommandLine(new RaggedCsvMain()).execute(args);
        System.exit(code);
    }

    @Override
    public Integer call() throws Exception {
        IngestConfig config;
        try {
            config = resolve(IngestConfig.fromEnv());
        } catch (IllegalArgumentException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            return 2;
        }

        Injector injector = Guice.createInjector(new IngestModule(config, inputs));
        Pipeline<Path, IngestedFile> pipeline;
        try {
            pipeline = injector.getInstance(Key.get(new TypeLiteral<Pipeline<Path, IngestedFile>>() {}));
        } catch (ProvisionException e) {
            log.error("Could not set up ingestion: {}", e.getCause() == null ? e.getMessage() : e.getCause().getMessage());
            return 2;
        }
        MetricRegistry registry = injector.getInstance(MetricRegistry.class);

        Pipeline.RunSummary summary;
        try (Pipeline<Path, IngestedFile> p = pipeline) {
            summary = p.run();
        }

        log.info("Ingested {} of {} files into {} (rows={}, merged={}, padded={}, exhausted={})",
                summary.written(), summary.total(), config.outputDir().toAbsolutePath(),
                registry.counter("ingest.rows.total").getCount(),
                registry.counter("ingest.rows.long").getCount(),
                registry.counter("ingest.rows.short").getCount(),
                registry.counter("ingest.exhausted").getCount());
        if (!summary.allSucceeded()) {
            log.warn("{} files failed; see {}", summary.failed(), config.outputDir().resolve(IngestModule.FAILURES_FILE));
            return 1;
        }
        return 0;
    }

    IngestConfig resolve(IngestConfig base) {
        IngestConfig c = base;
        if (outDir != null) c = c.withOutputDir(outDir);
        if (expectedCols != null) c = c.withExpectedCols(expectedCols);
        if (mergeInto != null) c = c.withMergeInto(mergeInto);
        if (delimiter != null) c = c.withDelimiter(IngestConfig.parseDelimiter(delimiter));
        if (encoding != null) c = c.withEncoding(encoding);
        if (workers != null) c = c.withWorkers(workers);
        if (sampleLines != null) c = c.withSampleLines(sampleLines);
        // validates expectedCols and sampleLines
        c.options();
        return c;
    }
}
