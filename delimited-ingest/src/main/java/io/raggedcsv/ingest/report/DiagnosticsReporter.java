package io.raggedcsv.ingest.report;

import com.codahale.metrics.MetricRegistry;
import io.raggedcsv.ingest.IngestException;
import io.raggedcsv.ingest.Table;
import io.raggedcsv.ingest.decode.DecodeException;
import io.raggedcsv.ingest.decode.DecodedText;
import io.raggedcsv.ingest.delimiter.DelimiterCandidate;
import io.raggedcsv.ingest.fallback.IngestExhaustedException;
import io.raggedcsv.ingest.fallback.ParseAttempt;
import io.raggedcsv.ingest.fallback.ParsedRows;
import io.raggedcsv.ingest.normalize.NormalizedRows;

/**
 * Builds the {@link IngestReport} for a finished ingestion and keeps the optional metric counters.
 */
public class DiagnosticsReporter {
    private final MetricRegistry registry; // optional

    public DiagnosticsReporter() {
        this(null);
    }

    public DiagnosticsReporter(MetricRegistry registry) {
        this.registry = registry;
    }

    public Table assemble(String source,
                          DecodedText decoded,
                          char delimiter,
                          boolean delimiterInferred,
                          int modalDelimiterCount,
                          ParsedRows parsed,
                          NormalizedRows normalized) {
        IngestReport report = new IngestReport(
                source,
                decoded.encoding(),
                decoded.wide(),
                delimiter,
                delimiterInferred,
                modalDelimiterCount,
                normalized.header().size(),
                normalized.mergeTargetIndex(),
                parsed.strategy(),
                normalized.rows().size(),
                normalized.longRows(),
                normalized.shortRows(),
                parsed.attempts());
        if (registry != null) {
            registry.counter("ingest.files").inc();
            registry.counter("ingest.rows.total").inc(report.rowCount());
            registry.counter("ingest.rows.long").inc(report.longRows());
            registry.counter("ingest.rows.short").inc(report.shortRows());
            if (report.wideEncoding()) registry.counter("ingest.decode.wide").inc();
            countFailedAttempts(report.attempts().stream().filter(a -> !a.success()).toList());
        }
        return new Table(normalized.header(), normalized.rows(), report);
    }

    public void failed(IngestException e) {
        if (registry == null) return;
        if (e instanceof IngestExhaustedException exhausted) {
            registry.counter("ingest.exhausted").inc();
            countFailedAttempts(exhausted.attempts());
        } else if (e instanceof DecodeException) {
            registry.counter("ingest.decode.failures").inc();
        }
    }

    private void countFailedAttempts(Iterable<ParseAttempt> failedAttempts) {
        for (ParseAttempt a : failedAttempts) {
            registry.counter("ingest.strategy." + a.strategy().name().toLowerCase() + ".failures").inc();
        }
    }

    /**
     * One-paragraph summary suitable for a log line.
     */
    public static String summary(IngestReport report) {
        StringBuilder sb = new StringBuilder();
        sb.append(report.source()).append(": loaded ").append(report.rowCount())
                .append(" rows with exactly ").append(report.expectedCols()).append(" columns")
                .append(" (encoding=").append(report.encoding())
                .append(", delimiter=").append(DelimiterCandidate.display(report.delimiter()))
                .append(report.delimiterInferred() ? " inferred" : " given")
                .append(", strategy=").append(report.strategy()).append(')');
        if (report.longRows() > 0) {
            sb.append("; ").append(report.longRows()).append(" rows had more than ")
                    .append(report.expectedCols()).append(" fields (merged, nothing dropped)");
        }
        if (report.shortRows() > 0) {
            sb.append("; ").append(report.shortRows()).append(" rows had fewer than ")
                    .append(report.expectedCols()).append(" fields (padded)");
        }
        return sb.toString();
    }
}
