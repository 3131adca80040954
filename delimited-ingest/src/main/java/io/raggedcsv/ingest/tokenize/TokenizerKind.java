package io.raggedcsv.ingest.tokenize;

/**
 * Tokenization strategies, from the strictest grammar to the most forgiving.
 */
public enum TokenizerKind {
    STRICT_QUOTE,
    ESCAPED_QUOTE,
    QUOTE_BLIND,
    QUOTE_REPAIRED
}
