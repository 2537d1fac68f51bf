package pl.marcinmilkowski.line_search.search;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.line_search.config.ServerConfig;
import pl.marcinmilkowski.line_search.corpus.CorpusLoader;

import java.util.List;

/**
 * Scans the lines in file order and compares each with the query.
 * O(n) build, O(n·m) worst-case query. The default and fallback strategy.
 */
public class LinearSearch extends AbstractSearchAlgorithm<List<String>> {

    public LinearSearch(ServerConfig config) {
        this(config, LoggerFactory.getLogger(LinearSearch.class));
    }

    public LinearSearch(ServerConfig config, Logger logger) {
        super(config, logger);
    }

    @Override
    protected List<String> buildIndex(CorpusLoader loader) {
        return loader.readLines();
    }

    @Override
    protected boolean matches(List<String> lines, String query) {
        for (String line : lines) {
            if (line.equals(query)) {
                return true;
            }
        }
        return false;
    }
}
