package io.raggedcsv.ingest.normalize;

import java.util.ArrayList;
import java.util.List;

/**
 * Forces every row to exactly {@code expectedCols} fields without dropping any value.
 *
 * <p>The header is padded with {@code __placeholder_<i>} names or truncated. Body rows that are too
 * long keep their first {@code expectedCols} fields and have the rest comma-joined onto the merge target
 * column; rows that are too short are padded with empty strings.
 */
public class WidthNormalizer {
    public static final String PLACEHOLDER_PREFIX = "__placeholder_";

    private final int expectedCols;

    public WidthNormalizer(int expectedCols) {
        if (expectedCols < 1) {
            throw new IllegalArgumentException("expectedCols must be at least 1: " + expectedCols);
        }
        this.expectedCols = expectedCols;
    }

    public int expectedCols() { return expectedCols; }

    /**
     * @param rows            header first, then the body; at least the header must be present
     * @param mergeTargetName header name of the column that absorbs overflow, null for the last column
     */
    public NormalizedRows normalize(List<List<String>> rows, String mergeTargetName) {
        if (rows.isEmpty()) {
            throw new IllegalArgumentException("rows must contain at least a header");
        }
        List<String> header = normalizeHeader(rows.get(0));
        int target = mergeTargetIndex(header, mergeTargetName);

        List<List<String>> body = new ArrayList<>(rows.size() - 1);
        int longRows = 0;
        int shortRows = 0;
        for (List<String> row : rows.subList(1, rows.size())) {
            if (row.size() > expectedCols) {
                body.add(merge(row, target));
                longRows++;
            } else if (row.size() < expectedCols) {
                body.add(pad(row));
                shortRows++;
            } else {
                body.add(row);
            }
        }
        return new NormalizedRows(header, body, target, longRows, shortRows);
    }

    List<String> normalizeHeader(List<String> header) {
        if (header.size() > expectedCols) {
            return new ArrayList<>(header.subList(0, expectedCols));
        }
        List<String> out = new ArrayList<>(header);
        for (int i = 0; out.size() < expectedCols; i++) {
            out.add(PLACEHOLDER_PREFIX + i);
        }
        return out;
    }

    /**
     * Index of {@code name} in the normalized header, or the last column when absent.
     */
    public int mergeTargetIndex(List<String> header, String name) {
        if (name != null) {
            int idx = header.indexOf(name);
            if (idx >= 0 && idx < expectedCols) return idx;
        }
        return expectedCols - 1;
    }

    List<String> merge(List<String> row, int target) {
        List<String> kept = new ArrayList<>(row.subList(0, expectedCols));
        List<String> overflow = row.subList(expectedCols, row.size());
        int end = overflow.size();
        while (end > 0 && overflow.get(end - 1).isEmpty()) end--;
        if (end > 0) {
            kept.set(target, kept.get(target) + ',' + String.join(",", overflow.subList(0, end)));
        }
        return kept;
    }

    List<String> pad(List<String> row) {
        List<String> out = new ArrayList<>(expectedCols);
        out.addAll(row);
        while (out.size() < expectedCols) out.add("");
        return out;
    }
}
