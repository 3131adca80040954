package io.raggedcsv.ingest.batch;

import io.raggedcsv.ingest.Table;

import java.nio.file.Path;

/**
 * A normalized table together with the file it came from.
 */
public record IngestedFile(Path source, Table table) {
    @Override
    public String toString() {
        return String.valueOf(source);
    }
}
