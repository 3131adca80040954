package io.raggedcsv.ingest.normalize;

import java.util.List;

/**
 * Header and body forced to one width, with the number of body rows that had to be reshaped.
 */
public record NormalizedRows(List<String> header,
                             List<List<String>> rows,
                             int mergeTargetIndex,
                             int longRows,
                             int shortRows) {
    public NormalizedRows {
        header = List.copyOf(header);
        rows = rows.stream().map(List::copyOf).toList();
    }
}
