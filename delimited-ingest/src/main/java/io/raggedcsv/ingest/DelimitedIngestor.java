package io.raggedcsv.ingest;

import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;
import io.raggedcsv.ingest.decode.ByteDecoder;
import io.raggedcsv.ingest.decode.DecodedText;
import io.raggedcsv.ingest.delimiter.DelimiterInferencer;
import io.raggedcsv.ingest.fallback.FallbackParser;
import io.raggedcsv.ingest.fallback.ParsedRows;
import io.raggedcsv.ingest.normalize.NormalizedRows;
import io.raggedcsv.ingest.normalize.WidthNormalizer;
import io.raggedcsv.ingest.report.DiagnosticsReporter;
import io.raggedcsv.ingest.tokenize.RowTokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Reads a delimited text file of unknown encoding and shape into a {@link Table} of fixed width.
 *
 * <p>Stages run strictly in order: decode, sample and infer the delimiter, tokenize with fallback,
 * normalize widths, report. The ingestor holds no per-call state and may be shared across threads.
 */
public class DelimitedIngestor {
    private static final Logger log = LoggerFactory.getLogger(DelimitedIngestor.class);

    private final ByteDecoder decoder;
    private final DelimiterInferencer inferencer;
    private final FallbackParser parser;
    private final DiagnosticsReporter reporter;
    private final Timer fileTimer; // optional

    public DelimitedIngestor() {
        this(new ByteDecoder(), new DelimiterInferencer(),
                new FallbackParser(RowTokenizer.defaults(RowTokenizer.DEFAULT_FIELD_LIMIT)), null);
    }

    public DelimitedIngestor(ByteDecoder decoder,
                             DelimiterInferencer inferencer,
                             FallbackParser parser,
                             MetricRegistry registry) {
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.inferencer = Objects.requireNonNull(inferencer, "inferencer");
        this.parser = Objects.requireNonNull(parser, "parser");
        this.reporter = new DiagnosticsReporter(registry);
        this.fileTimer = registry == null ? null : registry.timer("ingest.file.time");
    }

    public Table ingest(Path path, IngestOptions options) throws IOException, IngestException {
        byte[] raw;
        try (InputStream in = Files.newInputStream(path)) {
            raw = in.readAllBytes();
        }
        return ingest(raw, options, String.valueOf(path.getFileName()));
    }

    public Table ingest(byte[] raw, IngestOptions options, String source) throws IngestException {
        Objects.requireNonNull(options, "options");
        Timer.Context timing = fileTimer == null ? null : fileTimer.time();
        try {
            return run(raw, options, source);
        } catch (IngestException e) {
            reporter.failed(e);
            throw e;
        } finally {
            if (timing != null) timing.stop();
        }
    }

    private Table run(byte[] raw, IngestOptions options, String source) throws IngestException {
        DecodedText decoded = options.encoding() != null
                ? decoder.decode(raw, options.encoding())
                : decoder.decode(raw);
        String text = decoded.text();

        List<String> sample = inferencer.sample(text, options.sampleLines());
        boolean inferred = options.delimiter() == null;
        char delimiter = inferred ? inferencer.infer(sample) : options.delimiter();
        int modal = inferencer.modalCount(sample, delimiter);
        log.debug("{}: encoding={} delimiter={} (inferred={}) modalCount={}",
                source, decoded.encoding(), (int) delimiter, inferred, modal);

        ParsedRows parsed = parser.parse(text, delimiter, modal);
        NormalizedRows normalized = new WidthNormalizer(options.expectedCols())
                .normalize(parsed.rows(), options.mergeInto());
        return reporter.assemble(source, decoded, delimiter, inferred, modal, parsed, normalized);
    }
}
