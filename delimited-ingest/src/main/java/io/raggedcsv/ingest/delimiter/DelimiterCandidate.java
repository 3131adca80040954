package io.raggedcsv.ingest.delimiter;

import java.util.Comparator;

/**
 * Score of one candidate separator over a sample.
 *
 * @param delimiter  the separator character
 * @param modalCount most frequent per-line occurrence count
 * @param variance   mean squared deviation of the per-line counts from the mode
 * @param order      position in the candidate list, used to break exact ties
 */
public record DelimiterCandidate(char delimiter, int modalCount, double variance, int order) {

    /** Best candidate first: higher modal count, then lower variance, then earlier candidate. */
    public static final Comparator<DelimiterCandidate> BEST_FIRST =
            Comparator.comparingInt(DelimiterCandidate::modalCount).reversed()
                    .thenComparingDouble(DelimiterCandidate::variance)
                    .thenComparingInt(DelimiterCandidate::order);

    public static String display(char c) {
        return switch (c) {
            case '\t' -> "\\t";
            case ',' -> "','";
            default -> "'" + c + "'";
        };
    }

    @Override
    public String toString() {
        return display(delimiter) + "{mode=" + modalCount + ", variance=" + variance + "}";
    }
}
