package io.raggedcsv.ingest.tokenize;

/**
 * Quoted-field grammar where a backslash makes the following character literal, quotes included.
 * Doubled quotes still work inside quoted fields.
 */
public class EscapedQuoteTokenizer extends QuotedGrammarTokenizer {
    public static final char ESCAPE = '\\';

    public EscapedQuoteTokenizer() {
        this(DEFAULT_FIELD_LIMIT);
    }

    public EscapedQuoteTokenizer(int fieldLimit) {
        super(fieldLimit, ESCAPE);
    }

    @Override
    public TokenizerKind kind() {
        return TokenizerKind.ESCAPED_QUOTE;
    }
}
