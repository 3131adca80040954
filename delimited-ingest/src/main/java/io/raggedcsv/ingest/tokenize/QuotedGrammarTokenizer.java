package io.raggedcsv.ingest.tokenize;

import java.util.ArrayList;
import java.util.List;

/**
 * Character-level scanner for the quoted-field grammar shared by the strict and escaped strategies.
 * A field is quoted only when the quote is its first character; inside it, a doubled quote stands for
 * one quote and delimiters and line breaks are literal. A quote met later in an unquoted field is kept
 * as an ordinary character. Records end at {@code \n}, {@code \r\n} or {@code \r}. Records holding
 * only whitespace and no delimiter are skipped.
 */
abstract class QuotedGrammarTokenizer implements RowTokenizer {
    static final int NO_ESCAPE = -1;

    private enum State { FIELD_START, UNQUOTED, QUOTED, AFTER_QUOTE }

    private final int fieldLimit;
    private final int escape;

    QuotedGrammarTokenizer(int fieldLimit, int escape) {
        if (fieldLimit < 1) throw new IllegalArgumentException("fieldLimit must be positive: " + fieldLimit);
        this.fieldLimit = fieldLimit;
        this.escape = escape;
    }

    @Override
    public List<List<String>> split(String text, char delimiter) throws ParseException {
        if (delimiter == QUOTE || delimiter == '\n' || delimiter == '\r') {
            throw new IllegalArgumentException("unusable delimiter: " + (int) delimiter);
        }
        if (delimiter == escape) {
            throw fail(ParseException.Kind.DELIMITER_IS_ESCAPE, 0,
                    "delimiter '" + delimiter + "' is also the escape character");
        }
        List<List<String>> rows = new ArrayList<>();
        List<String> row = new ArrayList<>();
        StringBuilder field = new StringBuilder();
        State state = State.FIELD_START;
        boolean quotedSeen = false;
        long line = 1;
        long quoteOpenedAt = 0;

        int n = text.length();
        for (int i = 0; i < n; i++) {
            char c = text.charAt(i);
            switch (state) {
                case FIELD_START, UNQUOTED -> {
                    if (c == QUOTE && state == State.UNQUOTED) {
                        // only a leading quote opens a quoted field
                        append(field, c, line);
                    } else if (c == QUOTE) {
                        state = State.QUOTED;
                        quotedSeen = true;
                        quoteOpenedAt = line;
                    } else if (c == escape) {
                        i = appendEscaped(text, i, field, line);
                        state = State.UNQUOTED;
                    } else if (c == delimiter) {
                        row.add(field.toString());
                        field.setLength(0);
                        state = State.FIELD_START;
                    } else if (c == '\n' || c == '\r') {
                        if (c == '\r' && i + 1 < n && text.charAt(i + 1) == '\n') i++;
                        endRecord(rows, row, field, quotedSeen);
                        row = new ArrayList<>();
                        quotedSeen = false;
                        state = State.FIELD_START;
                        line++;
                    } else {
                        append(field, c, line);
                        state = State.UNQUOTED;
                    }
                }
                case QUOTED -> {
                    if (c == escape) {
                        i = appendEscaped(text, i, field, line);
                    } else if (c == QUOTE) {
                        if (i + 1 < n && text.charAt(i + 1) == QUOTE) {
                            append(field, QUOTE, line);
                            i++;
                        } else {
                            state = State.AFTER_QUOTE;
                        }
                    } else {
                        if (c == '\n' || (c == '\r' && (i + 1 >= n || text.charAt(i + 1) != '\n'))) line++;
                        append(field, c, line);
                    }
                }
                case AFTER_QUOTE -> {
                    if (c == delimiter) {
                        row.add(field.toString());
                        field.setLength(0);
                        state = State.FIELD_START;
                    } else if (c == '\n' || c == '\r') {
                        if (c == '\r' && i + 1 < n && text.charAt(i + 1) == '\n') i++;
                        endRecord(rows, row, field, quotedSeen);
                        row = new ArrayList<>();
                        quotedSeen = false;
                        state = State.FIELD_START;
                        line++;
                    } else {
                        throw fail(ParseException.Kind.TEXT_AFTER_CLOSING_QUOTE, line,
                                "'" + c + "' after closing quote, expected delimiter or end of line");
                    }
                }
            }
        }
        if (state == State.QUOTED) {
            throw fail(ParseException.Kind.UNTERMINATED_QUOTE, quoteOpenedAt,
                    "quoted field opened on line " + quoteOpenedAt + " is never closed");
        }
        endRecord(rows, row, field, quotedSeen);
        if (rows.isEmpty()) {
            throw fail(ParseException.Kind.NO_COLUMNS, 0, "no columns to parse from input");
        }
        return rows;
    }

    private int appendEscaped(String text, int i, StringBuilder field, long line) throws ParseException {
        if (i + 1 >= text.length()) {
            throw fail(ParseException.Kind.DANGLING_ESCAPE, line, "escape character at end of input");
        }
        append(field, text.charAt(i + 1), line);
        return i + 1;
    }

    private void append(StringBuilder field, char c, long line) throws ParseException {
        if (field.length() >= fieldLimit) {
            throw fail(ParseException.Kind.FIELD_TOO_LARGE, line, "field larger than field limit (" + fieldLimit + ")");
        }
        field.append(c);
    }

    private static void endRecord(List<List<String>> rows, List<String> row, StringBuilder field, boolean quotedSeen) {
        String last = field.toString();
        field.setLength(0);
        if (row.isEmpty() && !quotedSeen && last.isBlank()) return;
        row.add(last);
        rows.add(row);
    }

    ParseException fail(ParseException.Kind kind, long line, String message) {
        String where = line > 0 ? " (line " + line + ")" : "";
        return new ParseException(kind(), kind, line, message + where);
    }
}
