package pl.marcinmilkowski.line_search.search;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.line_search.config.ServerConfig;
import pl.marcinmilkowski.line_search.corpus.CorpusLoader;

import java.util.List;

/**
 * Linear comparison fanned out over the common fork-join pool.
 * Only pays off for very large line lists; small corpora are scanned sequentially.
 */
public class ParallelSearch extends AbstractSearchAlgorithm<List<String>> {

    static final int PARALLEL_THRESHOLD = 10_000;

    public ParallelSearch(ServerConfig config) {
        this(config, LoggerFactory.getLogger(ParallelSearch.class));
    }

    public ParallelSearch(ServerConfig config, Logger logger) {
        super(config, logger);
    }

    @Override
    protected List<String> buildIndex(CorpusLoader loader) {
        return loader.readLines();
    }

    @Override
    protected boolean matches(List<String> lines, String query) {
        if (lines.size() < PARALLEL_THRESHOLD) {
            return lines.contains(query);
        }
        return lines.parallelStream().anyMatch(query::equals);
    }
}
