package io.raggedcsv.ingest.tokenize;

import io.raggedcsv.ingest.IngestException;

/**
 * One tokenization strategy could not make sense of the text.
 */
public class ParseException extends IngestException {

    public enum Kind {
        /** A quoted field is still open at end of input. */
        UNTERMINATED_QUOTE,
        /** A closing quote is followed by something other than a delimiter or a line break. */
        TEXT_AFTER_CLOSING_QUOTE,
        /** The delimiter is the strategy's escape character, so fields cannot be told apart. */
        DELIMITER_IS_ESCAPE,
        /** The escape character is the last character of the input. */
        DANGLING_ESCAPE,
        /** A line holds an odd number of quote characters. */
        UNBALANCED_QUOTES,
        /** A single field grew beyond the configured field limit. */
        FIELD_TOO_LARGE,
        /** The text holds no record at all. */
        NO_COLUMNS
    }

    private final TokenizerKind strategy;
    private final Kind kind;
    private final long line;

    public ParseException(TokenizerKind strategy, Kind kind, long line, String message) {
        super(message);
        this.strategy = strategy;
        this.kind = kind;
        this.line = line;
    }

    public TokenizerKind strategy() { return strategy; }
    public Kind kind() { return kind; }

    /** 1-based line where the problem was detected, 0 when it does not apply. */
    public long line() { return line; }
}
