package io.raggedcsv.ingest;

import io.raggedcsv.ingest.delimiter.DelimiterInferencer;

/**
 * Per-call ingestion settings.
 *
 * @param expectedCols    width of every output row
 * @param mergeInto       header name of the column that absorbs overflow fields; null means the last column
 * @param delimiter       explicit delimiter, null to infer
 * @param encoding        explicit charset name, null to detect
 * @param sampleLines     number of non-blank lines used to infer the delimiter
 */
public record IngestOptions(int expectedCols, String mergeInto, Character delimiter, String encoding, int sampleLines) {
    public static final int DEFAULT_EXPECTED_COLS = 106;

    public IngestOptions {
        if (expectedCols < 1) throw new IllegalArgumentException("expectedCols must be at least 1: " + expectedCols);
        if (sampleLines < 1) throw new IllegalArgumentException("sampleLines must be at least 1: " + sampleLines);
        if (delimiter != null && (delimiter == '"' || delimiter == '\n' || delimiter == '\r')) {
            throw new IllegalArgumentException("delimiter cannot be a quote or a line break: " + (int) delimiter.charValue());
        }
        if (mergeInto != null && mergeInto.isEmpty()) mergeInto = null;
        if (encoding != null && encoding.isBlank()) encoding = null;
    }

    public static IngestOptions defaults() {
        return new IngestOptions(DEFAULT_EXPECTED_COLS, null, null, null, DelimiterInferencer.DEFAULT_SAMPLE_LINES);
    }

    public static IngestOptions expecting(int expectedCols) {
        return defaults().withExpectedCols(expectedCols);
    }

    public IngestOptions withExpectedCols(int n) { return new IngestOptions(n, mergeInto, delimiter, encoding, sampleLines); }
    public IngestOptions withMergeInto(String name) { return new IngestOptions(expectedCols, name, delimiter, encoding, sampleLines); }
    public IngestOptions withDelimiter(Character d) { return new IngestOptions(expectedCols, mergeInto, d, encoding, sampleLines); }
    public IngestOptions withEncoding(String e) { return new IngestOptions(expectedCols, mergeInto, delimiter, e, sampleLines); }
    public IngestOptions withSampleLines(int n) { return new IngestOptions(expectedCols, mergeInto, delimiter, encoding, n); }
}
