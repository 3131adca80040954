package io.raggedcsv.ingest.report;

import io.raggedcsv.ingest.fallback.ParseAttempt;
import io.raggedcsv.ingest.tokenize.TokenizerKind;

import java.util.List;

/**
 * What the ingestion decided and how much reshaping it had to do.
 *
 * @param source              file name or other label of the input
 * @param encoding            charset the bytes were decoded with
 * @param wideEncoding        whether the double-byte path was taken
 * @param delimiter           field separator used for parsing
 * @param delimiterInferred   false when the caller supplied the delimiter
 * @param modalDelimiterCount most common per-line delimiter count in the sample, -1 for an empty sample
 * @param expectedCols        width of every output row
 * @param mergeTargetIndex    column that absorbed overflow fields
 * @param strategy            tokenization strategy that produced the rows
 * @param rowCount            number of body rows
 * @param longRows            body rows that had overflow merged
 * @param shortRows           body rows that were padded
 * @param attempts            every strategy tried, in order
 */
public record IngestReport(String source,
                           String encoding,
                           boolean wideEncoding,
                           char delimiter,
                           boolean delimiterInferred,
                           int modalDelimiterCount,
                           int expectedCols,
                           int mergeTargetIndex,
                           TokenizerKind strategy,
                           int rowCount,
                           int longRows,
                           int shortRows,
                           List<ParseAttempt> attempts) {
    public IngestReport {
        attempts = List.copyOf(attempts);
    }

    public int modifiedRows() {
        return longRows + shortRows;
    }
}
