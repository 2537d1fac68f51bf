package pl.marcinmilkowski.line_search.search;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.line_search.config.ServerConfig;
import pl.marcinmilkowski.line_search.corpus.CorpusLoader;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Treats the query as a regular expression that must match an entire line.
 *
 * <p>Unlike the other strategies the query is a pattern, so {@code test.1}
 * matches the line {@code test 1}. A query that does not compile is matched
 * literally instead of failing the request.</p>
 */
public class RegexSearch extends AbstractSearchAlgorithm<List<String>> {

    public RegexSearch(ServerConfig config) {
        this(config, LoggerFactory.getLogger(RegexSearch.class));
    }

    public RegexSearch(ServerConfig config, Logger logger) {
        super(config, logger);
    }

    @Override
    protected List<String> buildIndex(CorpusLoader loader) {
        return loader.readLines();
    }

    @Override
    protected boolean matches(List<String> lines, String query) {
        Matcher matcher = compile(query).matcher("");
        for (String line : lines) {
            if (matcher.reset(line).matches()) {
                return true;
            }
        }
        return false;
    }

    Pattern compile(String query) {
        try {
            return Pattern.compile(query);
        } catch (PatternSyntaxException e) {
            logger.debug("Query is not a valid pattern, matching literally: {}", e.getDescription());
            return Pattern.compile(Pattern.quote(query));
        }
    }
}
