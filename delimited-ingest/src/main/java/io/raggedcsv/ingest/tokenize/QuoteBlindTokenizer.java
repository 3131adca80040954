package io.raggedcsv.ingest.tokenize;

import java.util.ArrayList;
import java.util.List;

/**
 * Line-by-line split that only honours quote parity: a delimiter separates fields when an even number
 * of quote characters precede it on the same line. Quoted fields cannot span lines. A field wrapped in
 * quotes is unwrapped and its doubled quotes collapsed; other fields are kept verbatim, stray quotes
 * included.
 */
public class QuoteBlindTokenizer implements RowTokenizer {
    private final int fieldLimit;

    public QuoteBlindTokenizer() {
        this(DEFAULT_FIELD_LIMIT);
    }

    public QuoteBlindTokenizer(int fieldLimit) {
        if (fieldLimit < 1) throw new IllegalArgumentException("fieldLimit must be positive: " + fieldLimit);
        this.fieldLimit = fieldLimit;
    }

    @Override
    public TokenizerKind kind() {
        return TokenizerKind.QUOTE_BLIND;
    }

    @Override
    public List<List<String>> split(String text, char delimiter) throws ParseException {
        if (delimiter == QUOTE || delimiter == '\n' || delimiter == '\r') {
            throw new IllegalArgumentException("unusable delimiter: " + (int) delimiter);
        }
        List<List<String>> rows = new ArrayList<>();
        long lineNo = 0;
        for (String line : text.lines().toList()) {
            lineNo++;
            if (isBlankRecord(line, delimiter)) continue;
            rows.add(splitLine(line, delimiter, lineNo));
        }
        if (rows.isEmpty()) {
            throw new ParseException(kind(), ParseException.Kind.NO_COLUMNS, 0, "no columns to parse from input");
        }
        return rows;
    }

    /**
     * A line that holds only whitespace and no delimiter. A line of delimiters, tabs for a TSV, is a row
     * of empty fields.
     */
    static boolean isBlankRecord(String line, char delimiter) {
        return line.isBlank() && line.indexOf(delimiter) < 0;
    }

    private List<String> splitLine(String line, char delimiter, long lineNo) throws ParseException {
        int quotes = 0;
        for (int i = 0; i < line.length(); i++) {
            if (line.charAt(i) == QUOTE) quotes++;
        }
        if ((quotes & 1) == 1) {
            throw new ParseException(kind(), ParseException.Kind.UNBALANCED_QUOTES, lineNo,
                    "odd number of quote characters (" + quotes + ") on line " + lineNo);
        }
        List<String> fields = new ArrayList<>();
        boolean inside = false;
        int start = 0;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == QUOTE) {
                inside = !inside;
            } else if (c == delimiter && !inside) {
                fields.add(field(line.substring(start, i), lineNo));
                start = i + 1;
            }
        }
        fields.add(field(line.substring(start), lineNo));
        return fields;
    }

    private String field(String raw, long lineNo) throws ParseException {
        if (raw.length() > fieldLimit) {
            throw new ParseException(kind(), ParseException.Kind.FIELD_TOO_LARGE, lineNo,
                    "field larger than field limit (" + fieldLimit + ") on line " + lineNo);
        }
        if (raw.length() >= 2 && raw.charAt(0) == QUOTE && raw.charAt(raw.length() - 1) == QUOTE) {
            return raw.substring(1, raw.length() - 1).replace("\"\"", "\"");
        }
        return raw;
    }
}
