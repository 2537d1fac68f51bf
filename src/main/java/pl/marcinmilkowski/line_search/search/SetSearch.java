package pl.marcinmilkowski.line_search.search;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.line_search.config.ServerConfig;
import pl.marcinmilkowski.line_search.corpus.CorpusLoader;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Hash-set membership. O(n) build, O(1) average query; the best fit for a
 * large file that is loaded once.
 */
public class SetSearch extends AbstractSearchAlgorithm<Set<String>> {

    public SetSearch(ServerConfig config) {
        this(config, LoggerFactory.getLogger(SetSearch.class));
    }

    public SetSearch(ServerConfig config, Logger logger) {
        super(config, logger);
    }

    @Override
    protected Set<String> buildIndex(CorpusLoader loader) {
        List<String> lines = loader.readLines();
        Set<String> set = new HashSet<>(Math.max(16, (int) (lines.size() / 0.75f) + 1));
        set.addAll(lines);
        return set;
    }

    @Override
    protected boolean matches(Set<String> lines, String query) {
        return lines.contains(query);
    }
}
