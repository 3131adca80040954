package io.raggedcsv.ingest.fallback;

import io.raggedcsv.ingest.tokenize.RowTokenizer;
import io.raggedcsv.ingest.tokenize.TokenizeOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs tokenization strategies in order until one succeeds.
 *
 * <p>States: ATTEMPTING(k) runs strategy k; success moves to SUCCEEDED, failure records the attempt and
 * moves to ATTEMPTING(k + 1); failing the last strategy moves to EXHAUSTED, which raises
 * {@link IngestExhaustedException}. Rows are returned whole or not at all.
 */
public class FallbackParser {
    private static final Logger log = LoggerFactory.getLogger(FallbackParser.class);

    enum State { ATTEMPTING, SUCCEEDED, EXHAUSTED }

    private final List<RowTokenizer> strategies;

    public FallbackParser(List<RowTokenizer> strategies) {
        if (strategies == null || strategies.isEmpty()) {
            throw new IllegalArgumentException("at least one tokenization strategy is required");
        }
        this.strategies = List.copyOf(strategies);
    }

    public List<RowTokenizer> strategies() { return strategies; }

    /**
     * @param modalDelimiterCount reported in the failure diagnostics only
     */
    public ParsedRows parse(String text, char delimiter, int modalDelimiterCount) throws IngestExhaustedException {
        List<ParseAttempt> attempts = new ArrayList<>(strategies.size());
        State state = State.ATTEMPTING;
        int k = 0;
        TokenizeOutcome outcome = null;
        while (state == State.ATTEMPTING) {
            RowTokenizer strategy = strategies.get(k);
            outcome = strategy.tokenize(text, delimiter);
            attempts.add(ParseAttempt.of(outcome));
            if (outcome.isSuccess()) {
                state = State.SUCCEEDED;
            } else {
                log.debug("Strategy {} failed: {}", strategy.kind(), outcome.error().getMessage());
                k++;
                if (k >= strategies.size()) state = State.EXHAUSTED;
            }
        }
        if (state == State.EXHAUSTED) {
            throw new IngestExhaustedException(delimiter, modalDelimiterCount, attempts);
        }
        return new ParsedRows(outcome.rows(), outcome.strategy(), attempts);
    }
}
