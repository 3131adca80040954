package io.raggedcsv.ingest.batch;

import io.raggedcsv.core.Record;
import io.raggedcsv.core.Transform;
import io.raggedcsv.ingest.DelimitedIngestor;
import io.raggedcsv.ingest.IngestException;
import io.raggedcsv.ingest.IngestOptions;
import io.raggedcsv.ingest.Table;
import io.raggedcsv.ingest.report.DiagnosticsReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Ingests one file per record. Failures propagate so the pipeline can dead-letter the file.
 */
public class IngestFileTransform implements Transform<Path, IngestedFile> {
    private static final Logger log = LoggerFactory.getLogger(IngestFileTransform.class);

    private final DelimitedIngestor ingestor;
    private final IngestOptions options;

    public IngestFileTransform(DelimitedIngestor ingestor, IngestOptions options) {
        this.ingestor = ingestor;
        this.options = options;
    }

    @Override
    public Record<IngestedFile> apply(Record<Path> input) throws Exception {
        Path path = input.payload();
        try {
            Table table = ingestor.ingest(path, options);
            log.info(DiagnosticsReporter.summary(table.report()));
            return input.withPayload(new IngestedFile(path, table));
        } catch (IngestException e) {
            log.warn("{}: ingestion failed\n{}", path, e.getMessage());
            throw e;
        }
    }
}
