package pl.marcinmilkowski.line_search.search;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.line_search.config.ServerConfig;
import pl.marcinmilkowski.line_search.corpus.CorpusLoader;
import pl.marcinmilkowski.line_search.corpus.CorpusText;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

/**
 * Boyer-Moore (bad-character rule) over the whole corpus text.
 *
 * <p>The pattern is scanned right to left against the '\n'-joined corpus, so
 * most windows are rejected after one comparison and skipped by up to the
 * query length. An occurrence only counts when it starts at a line start and
 * ends at a line end; an occurrence inside a longer line moves the scan to the
 * next line, since no full-line match can start before it.</p>
 */
public class BoyerMooreSearch extends AbstractSearchAlgorithm<CorpusText> {

    public BoyerMooreSearch(ServerConfig config) {
        this(config, LoggerFactory.getLogger(BoyerMooreSearch.class));
    }

    public BoyerMooreSearch(ServerConfig config, Logger logger) {
        super(config, logger);
    }

    @Override
    protected CorpusText buildIndex(CorpusLoader loader) {
        return loader.readText();
    }

    @Override
    protected boolean matches(CorpusText corpus, String query) {
        if (query.isEmpty()) {
            return corpus.hasEmptyLine();
        }
        String text = corpus.text();
        int n = text.length();
        int m = query.length();
        if (m > n) {
            return false;
        }

        BadCharacterTable badChar = new BadCharacterTable(query);
        int s = 0;
        while (s <= n - m) {
            int j = m - 1;
            while (j >= 0 && query.charAt(j) == text.charAt(s + j)) {
                j--;
            }
            if (j < 0) {
                if (corpus.isWholeLine(s, s + m)) {
                    return true;
                }
                int nextLine = text.indexOf('\n', s);
                if (nextLine < 0) {
                    return false;
                }
                s = nextLine + 1;
            } else {
                s += Math.max(1, j - badChar.lastIndexOf(text.charAt(s + j)));
            }
        }
        return false;
    }

    /**
     * Last position of each character in the pattern; -1 when absent.
     * Latin-1 characters use a flat array, the rest a map.
     */
    static final class BadCharacterTable {
        private final int[] latin = new int[256];
        private final Map<Character, Integer> other = new HashMap<>();

        BadCharacterTable(String pattern) {
            Arrays.fill(latin, -1);
            for (int i = 0; i < pattern.length(); i++) {
                char c = pattern.charAt(i);
                if (c < 256) {
                    latin[c] = i;
                } else {
                    other.put(c, i);
                }
            }
        }

        int lastIndexOf(char c) {
            return c < 256 ? latin[c] : other.getOrDefault(c, -1);
        }
    }
}
