package io.raggedcsv.ingest.report;

import com.codahale.metrics.MetricRegistry;
import io.raggedcsv.ingest.Table;
import io.raggedcsv.ingest.decode.DecodeException;
import io.raggedcsv.ingest.decode.DecodedText;
import io.raggedcsv.ingest.fallback.IngestExhaustedException;
import io.raggedcsv.ingest.fallback.ParseAttempt;
import io.raggedcsv.ingest.fallback.ParsedRows;
import io.raggedcsv.ingest.normalize.NormalizedRows;
import io.raggedcsv.ingest.tokenize.TokenizerKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DiagnosticsReporterTest {

    private static final List<ParseAttempt> TWO_ATTEMPTS = List.of(
            new ParseAttempt(TokenizerKind.STRICT_QUOTE, false, "UNTERMINATED_QUOTE", "quoted field opened on line 3 is never closed (line 3)"),
            new ParseAttempt(TokenizerKind.ESCAPED_QUOTE, true, null, null));

    private static Table assemble(DiagnosticsReporter reporter) {
        ParsedRows parsed = new ParsedRows(List.of(List.of("a", "b"), List.of("1", "2", "3")),
                TokenizerKind.ESCAPED_QUOTE, TWO_ATTEMPTS);
        NormalizedRows normalized = new NormalizedRows(List.of("a", "b"),
                List.of(List.of("1", "2,3"), List.of("4", "")), 1, 1, 1);
        return reporter.assemble("orders.csv", new DecodedText("ignored", "windows-1252", false),
                ';', true, 1, parsed, normalized);
    }

    @Test
    void reportDescribesEveryDecision() {
        Table table = assemble(new DiagnosticsReporter());
        IngestReport r = table.report();

        assertEquals("orders.csv", r.source());
        assertEquals("windows-1252", r.encoding());
        assertFalse(r.wideEncoding());
        assertEquals(';', r.delimiter());
        assertEquals(2, r.expectedCols());
        assertEquals(1, r.mergeTargetIndex());
        assertEquals(TokenizerKind.ESCAPED_QUOTE, r.strategy());
        assertEquals(2, r.rowCount());
        assertEquals(TWO_ATTEMPTS, r.attempts());
        assertEquals(List.of("1", "2,3"), table.row(0));
    }

    @Test
    void summaryMentionsMergedAndPaddedRows() {
        String summary = DiagnosticsReporter.summary(assemble(new DiagnosticsReporter()).report());
        assertTrue(summary.startsWith("orders.csv: loaded 2 rows with exactly 2 columns"), summary);
        assertTrue(summary.contains("delimiter=';' inferred"), summary);
        assertTrue(summary.contains("strategy=ESCAPED_QUOTE"), summary);
        assertTrue(summary.contains("1 rows had more than 2 fields (merged, nothing dropped)"), summary);
        assertTrue(summary.contains("1 rows had fewer than 2 fields (padded)"), summary);
    }

    @Test
    void failedAttemptsAreCountedPerStrategy() {
        MetricRegistry registry = new MetricRegistry();
        assemble(new DiagnosticsReporter(registry));

        assertEquals(1, registry.counter("ingest.strategy.strict_quote.failures").getCount());
        assertEquals(0, registry.counter("ingest.strategy.escaped_quote.failures").getCount());
        assertEquals(2, registry.counter("ingest.rows.total").getCount());
    }

    @Test
    void failuresAreCountedByKind() {
        MetricRegistry registry = new MetricRegistry();
        DiagnosticsReporter reporter = new DiagnosticsReporter(registry);
        reporter.failed(new IngestExhaustedException(',', 0, List.of(
                new ParseAttempt(TokenizerKind.STRICT_QUOTE, false, "NO_COLUMNS", "no columns to parse from input"))));
        reporter.failed(new DecodeException("no charset", null));

        assertEquals(1, registry.counter("ingest.exhausted").getCount());
        assertEquals(1, registry.counter("ingest.strategy.strict_quote.failures").getCount());
        assertEquals(1, registry.counter("ingest.decode.failures").getCount());
    }

    @Test
    void exhaustedMessageIsTheAuditTrail() {
        IngestExhaustedException e = new IngestExhaustedException('\t', 3, TWO_ATTEMPTS);
        String[] lines = e.getMessage().split("\n");
        assertEquals("Could not parse delimited text without skipping lines.", lines[0]);
        assertEquals("Delimiter guess: \\t; sample modal delimiter count: 3", lines[1]);
        assertEquals("Errors:", lines[2]);
        assertEquals(" - STRICT_QUOTE: UNTERMINATED_QUOTE: quoted field opened on line 3 is never closed (line 3)", lines[3]);
        assertEquals(" - ESCAPED_QUOTE: ok", lines[4]);
    }
}
