package io.raggedcsv.ingest;

import io.raggedcsv.ingest.report.IngestReport;

import java.util.List;
import java.util.Objects;

/**
 * Rectangular result of an ingestion: every row, header included, has {@link #columnCount()} fields.
 * The report rides along as metadata and is not part of the rows.
 */
public final class Table {
    private final List<String> header;
    private final List<List<String>> rows;
    private final IngestReport report;

    public Table(List<String> header, List<List<String>> rows, IngestReport report) {
        this.header = List.copyOf(header);
        this.rows = rows.stream().map(List::copyOf).toList();
        this.report = Objects.requireNonNull(report, "report");
        for (int i = 0; i < this.rows.size(); i++) {
            if (this.rows.get(i).size() != this.header.size()) {
                throw new IllegalArgumentException("row " + i + " has " + this.rows.get(i).size()
                        + " fields, expected " + this.header.size());
            }
        }
    }

    public List<String> header() { return header; }
    public List<List<String>> rows() { return rows; }
    public IngestReport report() { return report; }

    public int columnCount() { return header.size(); }
    public int rowCount() { return rows.size(); }

    public List<String> row(int index) { return rows.get(index); }

    /**
     * Values of the named column, in row order.
     *
     * @throws IllegalArgumentException if no header has that name
     */
    public List<String> column(String name) {
        int idx = header.indexOf(name);
        if (idx < 0) throw new IllegalArgumentException("no column named " + name);
        return rows.stream().map(r -> r.get(idx)).toList();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Table that)) return false;
        return header.equals(that.header) && rows.equals(that.rows);
    }

    @Override
    public int hashCode() {
        return Objects.hash(header, rows);
    }

    @Override
    public String toString() {
        return "Table{" + report.source() + ", cols=" + columnCount() + ", rows=" + rowCount() + '}';
    }
}
