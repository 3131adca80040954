package io.raggedcsv.ingest.batch;

import io.raggedcsv.ingest.IngestOptions;
import io.raggedcsv.ingest.delimiter.DelimiterInferencer;
import io.raggedcsv.ingest.tokenize.RowTokenizer;

import java.nio.file.Path;

/**
 * Settings for a batch run. Resolved from system properties ({@code raggedcsv.*}), then environment
 * variables ({@code RAGGEDCSV_*}), then defaults.
 */
public record IngestConfig(
        Path outputDir,
        int expectedCols,
        String mergeInto,
        Character delimiter,
        String encoding,
        int sampleLines,
        int fieldLimit,
        int workers
) {
    public static IngestConfig fromEnv() {
        Path out = Path.of(setting("raggedcsv.out", "RAGGEDCSV_OUT", "./normalized"));
        int cols = Integer.parseInt(setting("raggedcsv.expectedCols", "RAGGEDCSV_EXPECTED_COLS", String.valueOf(IngestOptions.DEFAULT_EXPECTED_COLS)));
        String merge = setting("raggedcsv.mergeInto", "RAGGEDCSV_MERGE_INTO", null);
        String delim = setting("raggedcsv.delimiter", "RAGGEDCSV_DELIMITER", null);
        String enc = setting("raggedcsv.encoding", "RAGGEDCSV_ENCODING", null);
        int sample = Integer.parseInt(setting("raggedcsv.sampleLines", "RAGGEDCSV_SAMPLE_LINES", String.valueOf(DelimiterInferencer.DEFAULT_SAMPLE_LINES)));
        int limit = Integer.parseInt(setting("raggedcsv.fieldLimit", "RAGGEDCSV_FIELD_LIMIT", String.valueOf(RowTokenizer.DEFAULT_FIELD_LIMIT)));
        int workers = Integer.parseInt(setting("raggedcsv.workers", "RAGGEDCSV_WORKERS", String.valueOf(Runtime.getRuntime().availableProcessors())));
        return new IngestConfig(out, cols, merge, parseDelimiter(delim), enc, sample, limit, workers);
    }

    private static String setting(String property, String env, String def) {
        return System.getProperty(property, System.getenv().getOrDefault(env, def));
    }

    /**
     * Accepts a single character or one of the names {@code tab}, {@code comma}, {@code semicolon},
     * {@code pipe} and the escape {@code \t}. Null or empty means "infer".
     */
    public static Character parseDelimiter(String value) {
        if (value == null || value.isEmpty()) return null;
        return switch (value.toLowerCase()) {
            case "tab", "\\t" -> '\t';
            case "comma" -> ',';
            case "semicolon" -> ';';
            case "pipe" -> '|';
            default -> {
                if (value.length() != 1) {
                    throw new IllegalArgumentException("delimiter must be a single character or tab|comma|semicolon|pipe: " + value);
                }
                yield value.charAt(0);
            }
        };
    }

    public IngestOptions options() {
        return new IngestOptions(expectedCols, mergeInto, delimiter, encoding, sampleLines);
    }

    public IngestConfig withOutputDir(Path p) { return new IngestConfig(p, expectedCols, mergeInto, delimiter, encoding, sampleLines, fieldLimit, workers); }
    public IngestConfig withExpectedCols(int n) { return new IngestConfig(outputDir, n, mergeInto, delimiter, encoding, sampleLines, fieldLimit, workers); }
    public IngestConfig withMergeInto(String m) { return new IngestConfig(outputDir, expectedCols, m, delimiter, encoding, sampleLines, fieldLimit, workers); }
    public IngestConfig withDelimiter(Character d) { return new IngestConfig(outputDir, expectedCols, mergeInto, d, encoding, sampleLines, fieldLimit, workers); }
    public IngestConfig withEncoding(String e) { return new IngestConfig(outputDir, expectedCols, mergeInto, delimiter, e, sampleLines, fieldLimit, workers); }
    public IngestConfig withSampleLines(int n) { return new IngestConfig(outputDir, expectedCols, mergeInto, delimiter, encoding, n, fieldLimit, workers); }
    public IngestConfig withWorkers(int n) { return new IngestConfig(outputDir, expectedCols, mergeInto, delimiter, encoding, sampleLines, fieldLimit, n); }
}
