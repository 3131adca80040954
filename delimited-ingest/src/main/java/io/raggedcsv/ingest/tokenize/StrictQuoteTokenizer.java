package io.raggedcsv.ingest.tokenize;

/**
 * Standard quoted-field grammar with doubled-quote escaping and no escape character.
 */
public class StrictQuoteTokenizer extends QuotedGrammarTokenizer {

    public StrictQuoteTokenizer() {
        this(DEFAULT_FIELD_LIMIT);
    }

    public StrictQuoteTokenizer(int fieldLimit) {
        super(fieldLimit, NO_ESCAPE);
    }

    @Override
    public TokenizerKind kind() {
        return TokenizerKind.STRICT_QUOTE;
    }
}
