package pl.marcinmilkowski.line_search.search;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.line_search.config.ServerConfig;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Resolves a configured algorithm name to a {@link SearchAlgorithm}.
 *
 * Supported strategies:
 * - linear       : Sequential line comparison (default and fallback)
 * - set          : Hash-set membership
 * - aho_corasick : Automaton over all lines (aliases: automaton, ahocorasick)
 * - boyer_moore  : Bad-character skip scan over the corpus text
 * - rabin_karp   : Rolling-hash scan over the corpus text
 * - regex        : Query as a pattern matched against whole lines
 * - parallel     : Linear comparison on the fork-join pool (alias: multiprocessing)
 *
 * The table is fixed at class initialisation; nothing is looked up reflectively.
 */
public final class SearchAlgorithmRegistry {

    public static final String DEFAULT_ALGORITHM = "linear";

    private static final Logger defaultLogger = LoggerFactory.getLogger(SearchAlgorithmRegistry.class);

    private static final Pattern SEPARATORS = Pattern.compile("[\\s\\-]+");

    private static final Map<String, SearchAlgorithm.Factory> FACTORIES = new LinkedHashMap<>();
    private static final Map<String, Class<? extends SearchAlgorithm>> TYPES = new LinkedHashMap<>();
    private static final Map<String, String> ALIASES = new LinkedHashMap<>();

    static {
        register("linear", LinearSearch.class, LinearSearch::new);
        register("set", SetSearch.class, SetSearch::new);
        register("aho_corasick", AhoCorasickSearch.class, AhoCorasickSearch::new);
        register("boyer_moore", BoyerMooreSearch.class, BoyerMooreSearch::new);
        register("rabin_karp", RabinKarpSearch.class, RabinKarpSearch::new);
        register("regex", RegexSearch.class, RegexSearch::new);
        register("parallel", ParallelSearch.class, ParallelSearch::new);

        ALIASES.put("automaton", "aho_corasick");
        ALIASES.put("ahocorasick", "aho_corasick");
        ALIASES.put("boyermoore", "boyer_moore");
        ALIASES.put("rabinkarp", "rabin_karp");
        ALIASES.put("multiprocessing", "parallel");
    }

    private SearchAlgorithmRegistry() {
    }

    private static void register(String name, Class<? extends SearchAlgorithm> type,
                                 SearchAlgorithm.Factory factory) {
        FACTORIES.put(name, factory);
        TYPES.put(name, type);
    }

    /**
     * Canonical names of all registered strategies, in registration order.
     */
    public static List<String> availableAlgorithms() {
        return List.copyOf(FACTORIES.keySet());
    }

    /**
     * Canonical name for a user-supplied one: trimmed, lower-cased, separators
     * folded to '_', an optional "_search" suffix dropped, aliases resolved.
     * Unknown names are returned normalised but otherwise unchanged.
     */
    public static String normalizeName(String name) {
        if (name == null) {
            return "";
        }
        String normalized = SEPARATORS.matcher(name.strip().toLowerCase(Locale.ROOT)).replaceAll("_");
        if (normalized.endsWith("_search")) {
            normalized = normalized.substring(0, normalized.length() - "_search".length());
        } else if (normalized.endsWith("search")) {
            // "SetSearch" style class names
            String stem = normalized.substring(0, normalized.length() - "search".length());
            if (FACTORIES.containsKey(stem) || ALIASES.containsKey(stem)) {
                normalized = stem;
            }
        }
        return ALIASES.getOrDefault(normalized, normalized);
    }

    public static boolean isRegistered(String name) {
        return FACTORIES.containsKey(normalizeName(name));
    }

    /**
     * Build the strategy named in the configuration.
     *
     * <p>An unknown name or a failing constructor is logged and replaced by
     * {@link LinearSearch}; this never throws. When the configuration asks for
     * reread-on-query the result is wrapped in {@link RereadOnQuerySearch}.
     * The corpus is not loaded here; call {@link SearchAlgorithm#reload()}.</p>
     *
     * <p>Resolution is logged under this class; each strategy logs under its own class.</p>
     */
    public static SearchAlgorithm resolve(ServerConfig config) {
        return resolve(config, defaultLogger, FACTORIES,
            name -> LoggerFactory.getLogger(TYPES.getOrDefault(name, LinearSearch.class)));
    }

    /**
     * As {@link #resolve(ServerConfig)}, with every message going to the given logger.
     */
    public static SearchAlgorithm resolve(ServerConfig config, Logger logger) {
        return resolve(config, logger, FACTORIES, name -> logger);
    }

    static SearchAlgorithm resolve(ServerConfig config, Logger logger,
                                   Map<String, SearchAlgorithm.Factory> factories) {
        return resolve(config, logger, factories, name -> logger);
    }

    private static SearchAlgorithm resolve(ServerConfig config, Logger logger,
                                           Map<String, SearchAlgorithm.Factory> factories,
                                           Function<String, Logger> strategyLogger) {
        String requested = config.algorithmName();
        String name = normalizeName(requested);
        SearchAlgorithm algorithm = null;

        SearchAlgorithm.Factory factory = factories.get(name);
        if (factory == null) {
            logger.error("Error loading search algorithm '{}': unknown algorithm. Available: {}",
                requested, String.join(", ", factories.keySet()));
        } else {
            try {
                algorithm = factory.create(config, strategyLogger.apply(name));
            } catch (RuntimeException e) {
                logger.error("Error constructing search algorithm '{}': {}", requested, e.getMessage(), e);
            }
        }

        if (algorithm == null) {
            algorithm = new LinearSearch(config, strategyLogger.apply(DEFAULT_ALGORITHM));
        }
        logger.info("Using {} algorithm.", algorithm.getName());

        return config.rereadOnQuery() ? new RereadOnQuerySearch(algorithm) : algorithm;
    }

    /**
     * Read-only view of the registration table, for diagnostics and tests.
     */
    static Map<String, SearchAlgorithm.Factory> factories() {
        return Collections.unmodifiableMap(FACTORIES);
    }
}
