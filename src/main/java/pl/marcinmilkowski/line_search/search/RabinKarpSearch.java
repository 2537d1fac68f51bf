package pl.marcinmilkowski.line_search.search;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.line_search.config.ServerConfig;
import pl.marcinmilkowski.line_search.corpus.CorpusLoader;
import pl.marcinmilkowski.line_search.corpus.CorpusText;

/**
 * Rabin-Karp rolling polynomial hash over the corpus text.
 *
 * <p>Hashes of every query-length window are rolled in O(1) per character.
 * A hash hit is confirmed character by character and must cover a whole line;
 * windows that do not begin at a line start are never reported. Arithmetic is
 * modulo 2^64 (natural long overflow), which keeps the roll cheap while the
 * verification step rules out false positives.</p>
 */
public class RabinKarpSearch extends AbstractSearchAlgorithm<CorpusText> {

    static final long BASE = 257L;

    public RabinKarpSearch(ServerConfig config) {
        this(config, LoggerFactory.getLogger(RabinKarpSearch.class));
    }

    public RabinKarpSearch(ServerConfig config, Logger logger) {
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

        // BASE^(m-1), the weight of the character leaving the window
        long high = 1L;
        for (int i = 0; i < m - 1; i++) {
            high *= BASE;
        }

        long queryHash = 0L;
        long windowHash = 0L;
        for (int i = 0; i < m; i++) {
            queryHash = queryHash * BASE + query.charAt(i);
            windowHash = windowHash * BASE + text.charAt(i);
        }

        for (int s = 0; ; s++) {
            if (windowHash == queryHash
                    && corpus.isWholeLine(s, s + m)
                    && text.regionMatches(s, query, 0, m)) {
                return true;
            }
            if (s >= n - m) {
                return false;
            }
            windowHash = (windowHash - text.charAt(s) * high) * BASE + text.charAt(s + m);
        }
    }
}
