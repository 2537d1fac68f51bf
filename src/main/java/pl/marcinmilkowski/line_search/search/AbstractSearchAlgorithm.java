package pl.marcinmilkowski.line_search.search;

import org.slf4j.Logger;
import pl.marcinmilkowski.line_search.config.ServerConfig;
import pl.marcinmilkowski.line_search.corpus.CorpusLoader;

/**
 * Shared plumbing for strategies: corpus loading, index publication and the
 * line-terminator guard.
 *
 * <p>The index is published through a volatile field and replaced wholesale on
 * every reload, so concurrent searches always see a complete index (the one
 * built last) without locking.</p>
 *
 * @param <I> the strategy-specific index type
 */
public abstract class AbstractSearchAlgorithm<I> implements SearchAlgorithm {

    protected final ServerConfig config;
    protected final Logger logger;
    protected final CorpusLoader loader;

    private volatile I index;

    protected AbstractSearchAlgorithm(ServerConfig config, Logger logger) {
        this.config = config;
        this.logger = logger;
        this.loader = new CorpusLoader(config.corpusPath(), logger);
    }

    @Override
    public void reload() {
        long start = System.nanoTime();
        I fresh = buildIndex(loader);
        index = fresh;
        logger.debug("{} indexed {} in {} ms", getName(), loader.getPath(),
            (System.nanoTime() - start) / 1_000_000L);
    }

    @Override
    public boolean search(String query) {
        // lines never contain terminators, so such a query can never be equal to one
        if (query.indexOf('\n') >= 0 || query.indexOf('\r') >= 0) {
            return false;
        }
        I current = index;
        if (current == null) {
            reload();
            current = index;
        }
        return matches(current, query);
    }

    /**
     * Build a fresh index from the corpus file.
     *
     * @throws pl.marcinmilkowski.line_search.corpus.CorpusLoadException if the file cannot be read
     */
    protected abstract I buildIndex(CorpusLoader loader);

    /**
     * Exact full-line membership test against one index snapshot.
     * The query is guaranteed to contain no line terminator.
     */
    protected abstract boolean matches(I index, String query);
}
