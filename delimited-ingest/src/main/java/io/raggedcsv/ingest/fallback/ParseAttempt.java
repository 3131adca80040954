package io.raggedcsv.ingest.fallback;

import io.raggedcsv.ingest.tokenize.TokenizeOutcome;
import io.raggedcsv.ingest.tokenize.TokenizerKind;

/**
 * One entry of the parse audit trail.
 *
 * @param errorKind null on success
 * @param message   null on success
 */
public record ParseAttempt(TokenizerKind strategy, boolean success, String errorKind, String message) {

    static ParseAttempt of(TokenizeOutcome outcome) {
        if (outcome.isSuccess()) {
            return new ParseAttempt(outcome.strategy(), true, null, null);
        }
        return new ParseAttempt(outcome.strategy(), false,
                outcome.error().kind().name(), outcome.error().getMessage());
    }

    @Override
    public String toString() {
        return success ? strategy + ": ok" : strategy + ": " + errorKind + ": " + message;
    }
}
