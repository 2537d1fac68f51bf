package pl.marcinmilkowski.line_search.search;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import pl.marcinmilkowski.line_search.config.ServerConfig;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Boundary cases for the strategies that scan the joined corpus text.
 */
class TextScanSearchTest {

    @TempDir
    Path tempDir;

    private List<SearchAlgorithm> strategies(String content) throws Exception {
        Path file = tempDir.resolve("corpus.txt");
        Files.writeString(file, content, StandardCharsets.UTF_8);
        ServerConfig config = ServerConfig.builder(file).withRereadOnQuery(false).build();
        List<SearchAlgorithm> strategies = List.of(new BoyerMooreSearch(config), new RabinKarpSearch(config));
        strategies.forEach(SearchAlgorithm::reload);
        return strategies;
    }

    @Test
    @DisplayName("An occurrence inside a longer line does not hide a later whole line")
    void skipsPartialOccurrences() throws Exception {
        for (SearchAlgorithm search : strategies("xabc\nabcx\nzz abc zz\nabc\n")) {
            assertTrue(search.search("abc"), search.getName());
            assertFalse(search.search("bc"), search.getName());
        }
    }

    @Test
    @DisplayName("Occurrences spanning a line break are not matches")
    void doesNotMatchAcrossLines() throws Exception {
        for (SearchAlgorithm search : strategies("ab\ncd\n")) {
            assertFalse(search.search("b\nc"), search.getName());
            assertFalse(search.search("abcd"), search.getName());
            assertTrue(search.search("cd"), search.getName());
        }
    }

    @Test
    @DisplayName("First and last lines are found, with or without a final newline")
    void firstAndLastLine() throws Exception {
        for (String content : List.of("first\nmiddle\nlast", "first\nmiddle\nlast\n", "first\r\nmiddle\r\nlast\r\n")) {
            for (SearchAlgorithm search : strategies(content)) {
                assertTrue(search.search("first"), search.getName());
                assertTrue(search.search("last"), search.getName());
                assertTrue(search.search("middle"), search.getName());
            }
        }
    }

    @Test
    @DisplayName("Query longer than the whole corpus is simply absent")
    void queryLongerThanCorpus() throws Exception {
        for (SearchAlgorithm search : strategies("short\n")) {
            assertFalse(search.search("a much longer query than the corpus"), search.getName());
        }
    }

    @Test
    @DisplayName("Characters outside Latin-1 drive the bad-character shift correctly")
    void nonLatinShift() throws Exception {
        for (SearchAlgorithm search : strategies("ąąąą\nżółw ąą\nżółw\n")) {
            assertTrue(search.search("żółw"), search.getName());
            assertFalse(search.search("ółw"), search.getName());
        }
    }

    @Test
    void badCharacterTableKeepsLastPosition() {
        BoyerMooreSearch.BadCharacterTable table = new BoyerMooreSearch.BadCharacterTable("abcaż");

        assertEquals(3, table.lastIndexOf('a'));
        assertEquals(1, table.lastIndexOf('b'));
        assertEquals(4, table.lastIndexOf('ż'));
        assertEquals(-1, table.lastIndexOf('z'));
        assertEquals(-1, table.lastIndexOf('ł'));
    }
}
