package io.raggedcsv.ingest.normalize;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WidthNormalizerTest {
    private final WidthNormalizer three = new WidthNormalizer(3);

    @SafeVarargs
    private static List<List<String>> rows(List<String> header, List<String>... body) {
        List<List<String>> all = new ArrayList<>();
        all.add(header);
        all.addAll(List.of(body));
        return all;
    }

    @Test
    void overflowIsMergedIntoTheLastColumn() {
        NormalizedRows out = three.normalize(rows(List.of("x", "y", "z"), List.of("a", "b", "c", "d")), null);
        assertEquals(List.of("a", "b", "c,d"), out.rows().get(0));
        assertEquals(1, out.longRows());
        assertEquals(0, out.shortRows());
        assertEquals(2, out.mergeTargetIndex());
    }

    @Test
    void shortRowsArePadded() {
        NormalizedRows out = three.normalize(rows(List.of("x", "y", "z"), List.of("a")), null);
        assertEquals(List.of("a", "", ""), out.rows().get(0));
        assertEquals(1, out.shortRows());
    }

    @Test
    void overflowGoesToTheNamedColumn() {
        NormalizedRows out = three.normalize(
                rows(List.of("id", "note", "tail"), List.of("1", "n", "t", "x", "y")), "note");
        assertEquals(1, out.mergeTargetIndex());
        assertEquals(List.of("1", "n,x,y", "t"), out.rows().get(0));
    }

    @Test
    void unknownMergeTargetFallsBackToLastColumn() {
        NormalizedRows out = three.normalize(rows(List.of("id", "note", "tail"), List.of("1", "2", "3", "4")), "missing");
        assertEquals(2, out.mergeTargetIndex());
        assertEquals(List.of("1", "2", "3,4"), out.rows().get(0));
    }

    @Test
    void trailingEmptyOverflowFieldsAreTrimmed() {
        NormalizedRows out = three.normalize(rows(List.of("x", "y", "z"),
                List.of("a", "b", "c", "d", "", ""),
                List.of("a", "b", "c", "", "")), null);
        assertEquals(List.of("a", "b", "c,d"), out.rows().get(0));
        assertEquals(List.of("a", "b", "c"), out.rows().get(1));
        assertEquals(2, out.longRows());
    }

    @Test
    void headerIsPaddedWithPlaceholdersOrTruncated() {
        NormalizedRows padded = new WidthNormalizer(4).normalize(List.of(List.of("a", "b")), null);
        assertEquals(List.of("a", "b", "__placeholder_0", "__placeholder_1"), padded.header());
        assertTrue(padded.rows().isEmpty());

        NormalizedRows truncated = new WidthNormalizer(2).normalize(List.of(List.of("a", "b", "c")), "c");
        assertEquals(List.of("a", "b"), truncated.header());
        assertEquals(1, truncated.mergeTargetIndex());
    }

    @Test
    void noRowIsLostAndEveryRowHasTheExpectedWidth() {
        List<List<String>> input = rows(List.of("h1", "h2", "h3"),
                List.of("1", "2", "3"),
                List.of("1", "2", "3", "4", "5", "6"),
                List.of("1"),
                List.of(),
                List.of("1", "2"),
                List.of("1", "2", "3"));
        NormalizedRows out = three.normalize(input, null);

        assertEquals(input.size() - 1, out.rows().size());
        assertTrue(out.rows().stream().allMatch(r -> r.size() == 3));
        assertEquals(1, out.longRows());
        assertEquals(3, out.shortRows());
        assertEquals("3,4,5,6", out.rows().get(1).get(2));
        assertEquals(List.of("", "", ""), out.rows().get(3));
    }

    @Test
    void normalizingTwiceChangesNothing() {
        NormalizedRows once = three.normalize(rows(List.of("h1", "h2"),
                List.of("a", "b", "c", "d"), List.of("a")), null);
        List<List<String>> again = new ArrayList<>();
        again.add(once.header());
        again.addAll(once.rows());

        NormalizedRows twice = three.normalize(again, null);
        assertEquals(once.header(), twice.header());
        assertEquals(once.rows(), twice.rows());
        assertEquals(0, twice.longRows());
        assertEquals(0, twice.shortRows());
    }

    @Test
    void singleColumnTableAbsorbsEverything() {
        NormalizedRows out = new WidthNormalizer(1).normalize(rows(List.of("only", "extra"), List.of("a", "b", "c")), null);
        assertEquals(List.of("only"), out.header());
        assertEquals(List.of("a,b,c"), out.rows().get(0));
    }

    @Test
    void widthMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new WidthNormalizer(0));
        assertThrows(IllegalArgumentException.class, () -> three.normalize(List.of(), null));
    }
}
