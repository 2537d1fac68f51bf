package pl.marcinmilkowski.line_search.search;

import org.slf4j.Logger;
import pl.marcinmilkowski.line_search.config.ServerConfig;

/**
 * Interface for exact full-line search strategies.
 * Allows different implementations (linear scan, hash set, automaton, ...) to be used interchangeably.
 *
 * <p>Every implementation answers the same question: does some line of the
 * current corpus equal the query exactly, character for character, excluding
 * the line terminator? Implementations differ only in how they index the
 * corpus and what a query costs.</p>
 */
public interface SearchAlgorithm {

    /**
     * Re-derive the internal representation from the configured corpus file.
     *
     * @throws pl.marcinmilkowski.line_search.corpus.CorpusLoadException if the file cannot be read
     */
    void reload();

    /**
     * Check whether the query equals an entire line of the current corpus.
     *
     * @param query the decoded query, never {@code null}
     * @return true if a line equals the query exactly
     * @throws pl.marcinmilkowski.line_search.corpus.CorpusLoadException if a lazy or per-query load fails
     */
    boolean search(String query);

    /**
     * Get the name of this strategy for logging.
     *
     * @return Strategy name (e.g., "LinearSearch", "SetSearch")
     */
    default String getName() {
        return this.getClass().getSimpleName();
    }

    /**
     * Constructor reference registered in {@link SearchAlgorithmRegistry}.
     * Construction must be cheap; loading happens in {@link #reload()}.
     */
    @FunctionalInterface
    interface Factory {
        SearchAlgorithm create(ServerConfig config, Logger logger);
    }
}
