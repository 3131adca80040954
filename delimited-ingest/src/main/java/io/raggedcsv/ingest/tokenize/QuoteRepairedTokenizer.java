package io.raggedcsv.ingest.tokenize;

import java.util.List;

/**
 * Quote-blind split over text that first went through {@link #repair(String)}.
 *
 * <p>The repair is lossy: on a line with an odd number of quotes every quote becomes two apostrophes,
 * including quotes that were correctly paired. It is a best-effort last resort, not a faithful
 * reconstruction, and quoted values spanning lines are not rebuilt.
 */
public class QuoteRepairedTokenizer extends QuoteBlindTokenizer {

    public QuoteRepairedTokenizer() {
        this(DEFAULT_FIELD_LIMIT);
    }

    public QuoteRepairedTokenizer(int fieldLimit) {
        super(fieldLimit);
    }

    @Override
    public TokenizerKind kind() {
        return TokenizerKind.QUOTE_REPAIRED;
    }

    @Override
    public List<List<String>> split(String text, char delimiter) throws ParseException {
        return super.split(repair(text), delimiter);
    }

    /**
     * Maps typographic quotes to their ASCII forms, then neutralises every quote on lines where the
     * quotes do not pair up. Line terminators are preserved.
     */
    public static String repair(String text) {
        String plain = text
                .replace('\u201C', '"').replace('\u201D', '"')
                .replace('\u2018', '\'').replace('\u2019', '\'');
        StringBuilder out = new StringBuilder(plain.length() + 16);
        int start = 0;
        int n = plain.length();
        while (start < n) {
            int end = start;
            while (end < n && plain.charAt(end) != '\n' && plain.charAt(end) != '\r') end++;
            int next = end;
            if (next < n && plain.charAt(next) == '\r') next++;
            if (next < n && plain.charAt(next) == '\n') next++;
            String line = plain.substring(start, end);
            if (line.chars().filter(ch -> ch == QUOTE).count() % 2 == 1) {
                line = line.replace("\"", "''");
            }
            out.append(line).append(plain, end, next);
            start = next;
        }
        return out.toString();
    }
}
