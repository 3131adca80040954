package io.raggedcsv.ingest.fallback;

import io.raggedcsv.ingest.IngestException;
import io.raggedcsv.ingest.delimiter.DelimiterCandidate;

import java.util.List;

/**
 * Every tokenization strategy failed. The message is the full audit trail.
 */
public class IngestExhaustedException extends IngestException {
    private final char delimiter;
    private final int modalDelimiterCount;
    private final List<ParseAttempt> attempts;

    public IngestExhaustedException(char delimiter, int modalDelimiterCount, List<ParseAttempt> attempts) {
        super(describe(delimiter, modalDelimiterCount, attempts));
        this.delimiter = delimiter;
        this.modalDelimiterCount = modalDelimiterCount;
        this.attempts = List.copyOf(attempts);
    }

    public char delimiter() { return delimiter; }

    /** Modal per-line delimiter count in the sample, -1 when the sample was empty. */
    public int modalDelimiterCount() { return modalDelimiterCount; }

    public List<ParseAttempt> attempts() { return attempts; }

    static String describe(char delimiter, int modalDelimiterCount, List<ParseAttempt> attempts) {
        StringBuilder sb = new StringBuilder("Could not parse delimited text without skipping lines.\n");
        sb.append("Delimiter guess: ").append(DelimiterCandidate.display(delimiter))
                .append("; sample modal delimiter count: ")
                .append(modalDelimiterCount < 0 ? "n/a" : String.valueOf(modalDelimiterCount))
                .append("\nErrors:");
        for (ParseAttempt a : attempts) {
            sb.append("\n - ").append(a);
        }
        return sb.toString();
    }
}
