package io.raggedcsv.ingest.tokenize;

import java.util.List;

/**
 * Splits decoded text into rows of fields. The first row is the header. Rows may be ragged.
 */
public interface RowTokenizer {

    /** Default upper bound on the length of a single field. */
    int DEFAULT_FIELD_LIMIT = 131_072;

    char QUOTE = '"';

    TokenizerKind kind();

    List<List<String>> split(String text, char delimiter) throws ParseException;

    default TokenizeOutcome tokenize(String text, char delimiter) {
        try {
            return TokenizeOutcome.success(kind(), split(text, delimiter));
        } catch (ParseException e) {
            return TokenizeOutcome.failure(kind(), e);
        }
    }

    /**
     * The four built-in strategies in fallback order.
     */
    static List<RowTokenizer> defaults(int fieldLimit) {
        return List.of(
                new StrictQuoteTokenizer(fieldLimit),
                new EscapedQuoteTokenizer(fieldLimit),
                new QuoteBlindTokenizer(fieldLimit),
                new QuoteRepairedTokenizer(fieldLimit));
    }
}
