package io.raggedcsv.ingest.tokenize;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class QuoteRepairedTokenizerTest {
    private final QuoteRepairedTokenizer tokenizer = new QuoteRepairedTokenizer();

    @Test
    void typographicQuotesBecomeAscii() {
        assertEquals("\"quoted\" and 'single'", QuoteRepairedTokenizer.repair("\u201Cquoted\u201D and \u2018single\u2019"));
    }

    @Test
    void linesWithOddQuotesLoseEveryQuote() {
        String repaired = QuoteRepairedTokenizer.repair("a,\"b\",5\" pipe\r\n\"ok\",x\n");
        assertEquals("a,''b'',5'' pipe\r\n\"ok\",x\n", repaired);
    }

    @Test
    void repairedTextSplitsWherePlainQuoteBlindFails() throws Exception {
        String text = "item,size,note\nhose,5\" pipe,spare\n\u201Cvalve\u201D,2,\"a,b\"\n";
        assertThrows(ParseException.class, () -> new QuoteBlindTokenizer().split(text, ','));

        List<List<String>> rows = tokenizer.split(text, ',');
        assertEquals(List.of("hose", "5'' pipe", "spare"), rows.get(1));
        assertEquals(List.of("valve", "2", "a,b"), rows.get(2));
    }

    @Test
    void tabSeparatedRowOfEmptyFieldsSurvivesTheRepair() throws Exception {
        List<List<String>> rows = tokenizer.split("a\tb\n1\t2\n\t\n3\t4\"\n", '\t');
        assertEquals(List.of(
                List.of("a", "b"),
                List.of("1", "2"),
                List.of("", ""),
                List.of("3", "4''")), rows);
    }

    @Test
    void failuresAreAttributedToTheRepairStrategy() {
        QuoteRepairedTokenizer small = new QuoteRepairedTokenizer(4);
        ParseException e = assertThrows(ParseException.class, () -> small.split("a,b\n\"abcdefgh,x\n", ','));
        assertEquals(TokenizerKind.QUOTE_REPAIRED, e.strategy());
        assertEquals(ParseException.Kind.FIELD_TOO_LARGE, e.kind());
    }
}
