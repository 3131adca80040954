package io.raggedcsv.ingest.batch;

import io.raggedcsv.core.Record;
import io.raggedcsv.core.Sink;
import io.raggedcsv.ingest.Table;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes each table to {@code <outDir>/<file stem>.normalized.csv}: UTF-8, comma separated, fields
 * quoted when they contain a comma, a quote or a line break.
 */
public class NormalizedCsvSink implements Sink<IngestedFile> {
    public static final String SUFFIX = ".normalized.csv";

    private final Path outDir;

    public NormalizedCsvSink(Path outDir) throws IOException {
        this.outDir = outDir;
        Files.createDirectories(outDir);
    }

    public Path target(Path source) {
        String name = String.valueOf(source.getFileName());
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        return outDir.resolve(stem + SUFFIX);
    }

    @Override
    public void accept(Record<IngestedFile> record) throws IOException {
        IngestedFile file = record.payload();
        try (BufferedWriter w = Files.newBufferedWriter(target(file.source()), StandardCharsets.UTF_8)) {
            write(file.table(), w);
        }
    }

    public static void write(Table table, Writer w) throws IOException {
        writeRow(table.header(), w);
        for (List<String> row : table.rows()) {
            writeRow(row, w);
        }
    }

    static void writeRow(List<String> fields, Writer w) throws IOException {
        for (int i = 0; i < fields.size(); i++) {
            if (i > 0) w.write(',');
            w.write(quote(fields.get(i)));
        }
        w.write('\n');
    }

    static String quote(String field) {
        boolean needs = false;
        for (int i = 0; i < field.length() && !needs; i++) {
            char c = field.charAt(i);
            needs = c == ',' || c == '"' || c == '\n' || c == '\r';
        }
        if (!needs) return field;
        return '"' + field.replace("\"", "\"\"") + '"';
    }
}
