package io.raggedcsv.ingest.fallback;

import io.raggedcsv.ingest.tokenize.TokenizerKind;

import java.util.List;

/**
 * Rows produced by the first strategy that succeeded, with every attempt made to get there.
 */
public record ParsedRows(List<List<String>> rows, TokenizerKind strategy, List<ParseAttempt> attempts) {
    public ParsedRows {
        rows = List.copyOf(rows);
        attempts = List.copyOf(attempts);
    }
}
