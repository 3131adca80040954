package io.raggedcsv.ingest.delimiter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Picks the field separator that occurs the same number of times on most sampled lines.
 */
public class DelimiterInferencer {
    private static final Logger log = LoggerFactory.getLogger(DelimiterInferencer.class);

    public static final List<Character> DEFAULT_CANDIDATES = List.of(',', ';', '|', '\t');
    public static final char DEFAULT_DELIMITER = ',';
    public static final int DEFAULT_SAMPLE_LINES = 200;

    private final List<Character> candidates;

    public DelimiterInferencer() {
        this(DEFAULT_CANDIDATES);
    }

    public DelimiterInferencer(List<Character> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            throw new IllegalArgumentException("at least one candidate delimiter is required");
        }
        this.candidates = List.copyOf(candidates);
    }

    public List<Character> candidates() { return candidates; }

    /**
     * The first {@code maxLines} lines of {@code text} that are not blank. A whitespace-only line that
     * holds a candidate, such as a TSV row of empty fields, is kept.
     */
    public List<String> sample(String text, int maxLines) {
        return text.lines()
                .filter(line -> !isBlankLine(line))
                .limit(Math.max(0, maxLines))
                .toList();
    }

    public char infer(List<String> sampleLines) {
        List<DelimiterCandidate> scored = score(sampleLines);
        if (scored.isEmpty()) {
            log.debug("No candidate delimiter found in {} sampled lines; using {}",
                    sampleLines.size(), DelimiterCandidate.display(DEFAULT_DELIMITER));
            return DEFAULT_DELIMITER;
        }
        log.debug("Delimiter scores: {}", scored);
        return scored.get(0).delimiter();
    }

    /**
     * Scores every candidate that occurs at least once in the sample, best first.
     */
    public List<DelimiterCandidate> score(List<String> sampleLines) {
        List<DelimiterCandidate> scored = new ArrayList<>();
        for (int i = 0; i < candidates.size(); i++) {
            char d = candidates.get(i);
            int[] counts = counts(sampleLines, d);
            boolean seen = false;
            for (int c : counts) {
                if (c > 0) { seen = true; break; }
            }
            if (!seen) continue;
            int mode = mode(counts);
            scored.add(new DelimiterCandidate(d, mode, variance(counts, mode), i));
        }
        scored.sort(DelimiterCandidate.BEST_FIRST);
        return scored;
    }

    /**
     * Most common per-line count of {@code delimiter}, or -1 when the sample has no non-blank line.
     */
    public int modalCount(List<String> sampleLines, char delimiter) {
        int[] counts = counts(sampleLines, delimiter);
        return counts.length == 0 ? -1 : mode(counts);
    }

    boolean isBlankLine(String line) {
        if (!line.isBlank()) return false;
        for (char c : candidates) {
            if (line.indexOf(c) >= 0) return false;
        }
        return true;
    }

    int[] counts(List<String> lines, char delimiter) {
        return lines.stream()
                .filter(line -> !isBlankLine(line) || line.indexOf(delimiter) >= 0)
                .mapToInt(line -> occurrences(line, delimiter))
                .toArray();
    }

    static int occurrences(String line, char c) {
        int n = 0;
        for (int i = 0; i < line.length(); i++) {
            if (line.charAt(i) == c) n++;
        }
        return n;
    }

    // ties go to the value seen first
    static int mode(int[] counts) {
        Map<Integer, Integer> freq = new LinkedHashMap<>();
        for (int c : counts) freq.merge(c, 1, Integer::sum);
        int best = 0;
        int bestFreq = -1;
        for (Map.Entry<Integer, Integer> e : freq.entrySet()) {
            if (e.getValue() > bestFreq) {
                best = e.getKey();
                bestFreq = e.getValue();
            }
        }
        return best;
    }

    static double variance(int[] counts, int mode) {
        if (counts.length == 0) return 0.0;
        double sum = 0;
        for (int c : counts) {
            double d = c - mode;
            sum += d * d;
        }
        return sum / counts.length;
    }
}
