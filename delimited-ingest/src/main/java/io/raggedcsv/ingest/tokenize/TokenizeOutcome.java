package io.raggedcsv.ingest.tokenize;

import java.util.List;
import java.util.Objects;

/**
 * Result of running one strategy: either the rows or the failure, never both.
 */
public record TokenizeOutcome(TokenizerKind strategy, List<List<String>> rows, ParseException error) {

    public TokenizeOutcome {
        Objects.requireNonNull(strategy, "strategy");
        if ((rows == null) == (error == null)) {
            throw new IllegalArgumentException("exactly one of rows and error must be set");
        }
    }

    public static TokenizeOutcome success(TokenizerKind strategy, List<List<String>> rows) {
        return new TokenizeOutcome(strategy, rows, null);
    }

    public static TokenizeOutcome failure(TokenizerKind strategy, ParseException error) {
        return new TokenizeOutcome(strategy, null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
