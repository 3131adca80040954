package io.raggedcsv.ingest.fallback;

import io.raggedcsv.ingest.tokenize.ParseException;
import io.raggedcsv.ingest.tokenize.RowTokenizer;
import io.raggedcsv.ingest.tokenize.TokenizerKind;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FallbackParserTest {
    private final FallbackParser parser = new FallbackParser(RowTokenizer.defaults(RowTokenizer.DEFAULT_FIELD_LIMIT));

    @Test
    void wellFormedTextStopsAtTheStrictStrategy() throws Exception {
        ParsedRows parsed = parser.parse("a,b\n\"1,5\",2\n", ',', 1);
        assertEquals(TokenizerKind.STRICT_QUOTE, parsed.strategy());
        assertEquals(1, parsed.attempts().size());
        assertTrue(parsed.attempts().get(0).success());
        assertEquals(List.of("1,5", "2"), parsed.rows().get(1));
    }

    @Test
    void backslashEscapedQuotesAdvanceToTheEscapedStrategy() throws Exception {
        ParsedRows parsed = parser.parse("a,b\n\"say \\\"hi\\\"\",2\n", ',', 1);
        assertEquals(TokenizerKind.ESCAPED_QUOTE, parsed.strategy());
        assertEquals(2, parsed.attempts().size());
        assertFalse(parsed.attempts().get(0).success());
        assertEquals("TEXT_AFTER_CLOSING_QUOTE", parsed.attempts().get(0).errorKind());
    }

    @Test
    void inchMarkNextToAMultiLineFieldStaysWithTheStrictStrategy() throws Exception {
        ParsedRows parsed = parser.parse("id,desc\n1,\"multi\nline\"\n2,5\" pipe\n", ',', 1);
        assertEquals(TokenizerKind.STRICT_QUOTE, parsed.strategy());
        assertEquals(List.of(
                List.of("id", "desc"),
                List.of("1", "multi\nline"),
                List.of("2", "5\" pipe")), parsed.rows());
    }

    @Test
    void unmatchedOpeningQuoteIsOnlyHandledByTheRepairStrategy() throws Exception {
        ParsedRows parsed = parser.parse("a,b\n\"open,x\n2,y\n", ',', 1);
        assertEquals(TokenizerKind.QUOTE_REPAIRED, parsed.strategy());
        assertEquals(List.of(TokenizerKind.STRICT_QUOTE, TokenizerKind.ESCAPED_QUOTE,
                        TokenizerKind.QUOTE_BLIND, TokenizerKind.QUOTE_REPAIRED),
                parsed.attempts().stream().map(ParseAttempt::strategy).toList());
        assertEquals("UNTERMINATED_QUOTE", parsed.attempts().get(0).errorKind());
        assertEquals("UNBALANCED_QUOTES", parsed.attempts().get(2).errorKind());
        assertEquals(List.of(List.of("a", "b"), List.of("''open", "x"), List.of("2", "y")), parsed.rows());
    }

    @Test
    void backslashDelimiterMovesPastTheEscapedStrategy() throws Exception {
        ParsedRows parsed = parser.parse("a\\b\n1\\\"x\"y\n", '\\', 1);
        assertEquals(TokenizerKind.QUOTE_BLIND, parsed.strategy());
        assertEquals("TEXT_AFTER_CLOSING_QUOTE", parsed.attempts().get(0).errorKind());
        assertEquals("DELIMITER_IS_ESCAPE", parsed.attempts().get(1).errorKind());
        assertEquals(List.of("1", "\"x\"y"), parsed.rows().get(1));
    }

    @Test
    void unterminatedQuoteSpanningAHugeFieldDefeatsEveryStrategy() {
        FallbackParser small = new FallbackParser(RowTokenizer.defaults(10));
        String text = "h1,h2\n\"unclosed,abcdefghijklmnop\nnext,row\n";
        IngestExhaustedException e = assertThrows(IngestExhaustedException.class, () -> small.parse(text, ',', 1));

        assertEquals(4, e.attempts().size());
        assertEquals(List.of(TokenizerKind.STRICT_QUOTE, TokenizerKind.ESCAPED_QUOTE,
                        TokenizerKind.QUOTE_BLIND, TokenizerKind.QUOTE_REPAIRED),
                e.attempts().stream().map(ParseAttempt::strategy).toList());
        assertTrue(e.attempts().stream().noneMatch(ParseAttempt::success));
        assertEquals("FIELD_TOO_LARGE", e.attempts().get(0).errorKind());
        assertEquals("UNBALANCED_QUOTES", e.attempts().get(2).errorKind());
        assertEquals("FIELD_TOO_LARGE", e.attempts().get(3).errorKind());
        assertEquals(',', e.delimiter());
        assertEquals(1, e.modalDelimiterCount());
        assertTrue(e.getMessage().contains("Delimiter guess: ','"));
        assertTrue(e.getMessage().contains("sample modal delimiter count: 1"));
        assertTrue(e.getMessage().contains("QUOTE_REPAIRED: FIELD_TOO_LARGE"));
    }

    @Test
    void emptyInputIsExhaustedNotAnEmptyTable() {
        IngestExhaustedException e = assertThrows(IngestExhaustedException.class, () -> parser.parse("", ',', -1));
        assertEquals(4, e.attempts().size());
        assertTrue(e.attempts().stream().allMatch(a -> "NO_COLUMNS".equals(a.errorKind())));
        assertTrue(e.getMessage().contains("sample modal delimiter count: n/a"));
    }

    @Test
    void strategiesAfterTheFirstSuccessAreNeverRun() throws Exception {
        List<TokenizerKind> ran = new ArrayList<>();
        RowTokenizer failing = new RowTokenizer() {
            @Override public TokenizerKind kind() { return TokenizerKind.STRICT_QUOTE; }
            @Override public List<List<String>> split(String text, char delimiter) throws ParseException {
                ran.add(kind());
                throw new ParseException(kind(), ParseException.Kind.UNTERMINATED_QUOTE, 1, "forced");
            }
        };
        RowTokenizer succeeding = new RowTokenizer() {
            @Override public TokenizerKind kind() { return TokenizerKind.ESCAPED_QUOTE; }
            @Override public List<List<String>> split(String text, char delimiter) {
                ran.add(kind());
                return List.of(List.of("only"));
            }
        };
        RowTokenizer unreachable = new RowTokenizer() {
            @Override public TokenizerKind kind() { return TokenizerKind.QUOTE_BLIND; }
            @Override public List<List<String>> split(String text, char delimiter) {
                ran.add(kind());
                return List.of();
            }
        };

        ParsedRows parsed = new FallbackParser(List.of(failing, succeeding, unreachable)).parse("x", ',', 0);
        assertEquals(List.of(TokenizerKind.STRICT_QUOTE, TokenizerKind.ESCAPED_QUOTE), ran);
        assertEquals(TokenizerKind.ESCAPED_QUOTE, parsed.strategy());
        assertEquals("forced", parsed.attempts().get(0).message());
    }

    @Test
    void needsAtLeastOneStrategy() {
        assertThrows(IllegalArgumentException.class, () -> new FallbackParser(List.of()));
    }
}
