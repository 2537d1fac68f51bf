package pl.marcinmilkowski.line_search.search;

import org.apache.lucene.util.BytesRef;
import org.apache.lucene.util.IntsRefBuilder;
import org.apache.lucene.util.fst.FST;
import org.apache.lucene.util.fst.FSTCompiler;
import org.apache.lucene.util.fst.NoOutputs;
import org.apache.lucene.util.fst.Util;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.line_search.config.ServerConfig;
import pl.marcinmilkowski.line_search.corpus.CorpusLoader;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.TreeSet;

/**
 * Multi-pattern automaton over all lines, used for membership.
 *
 * <p>Every distinct line becomes a key of a minimal acyclic automaton over its
 * UTF-8 bytes (Lucene's {@link FST} with no outputs). A query is accepted iff
 * the automaton ends in a final state after consuming the whole query, which
 * is exactly full-line equality; failure links of a classic Aho-Corasick
 * matcher are not needed because matches are anchored at both ends.</p>
 *
 * <p>Build is O(Σ|line|) plus a sort and the FST stays a compact byte array,
 * so memory grows with the corpus size rather than with states times alphabet.
 * A query is O(|query|), independent of the number of lines.</p>
 */
public class AhoCorasickSearch extends AbstractSearchAlgorithm<AhoCorasickSearch.LineAutomaton> {

    private static final NoOutputs OUTPUTS = NoOutputs.getSingleton();

    public AhoCorasickSearch(ServerConfig config) {
        this(config, LoggerFactory.getLogger(AhoCorasickSearch.class));
    }

    public AhoCorasickSearch(ServerConfig config, Logger logger) {
        super(config, logger);
    }

    @Override
    protected LineAutomaton buildIndex(CorpusLoader loader) {
        List<String> lines = loader.readLines();

        // the compiler wants unique keys in UTF-8 byte order
        TreeSet<BytesRef> keys = new TreeSet<>();
        for (String line : lines) {
            keys.add(new BytesRef(line));
        }
        if (keys.isEmpty()) {
            return new LineAutomaton(null);
        }

        try {
            FSTCompiler<Object> compiler = new FSTCompiler.Builder<>(FST.INPUT_TYPE.BYTE1, OUTPUTS).build();
            IntsRefBuilder scratch = new IntsRefBuilder();
            for (BytesRef key : keys) {
                compiler.add(Util.toIntsRef(key, scratch), OUTPUTS.getNoOutput());
            }
            FST<Object> fst = FST.fromFSTReader(compiler.compile(), compiler.getFSTReader());
            logger.debug("Automaton over {} keys takes {} bytes", keys.size(), fst.ramBytesUsed());
            return new LineAutomaton(fst);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot build line automaton for " + loader.getPath(), e);
        }
    }

    @Override
    protected boolean matches(LineAutomaton index, String query) {
        FST<Object> fst = index.fst();
        if (fst == null) {
            return false;
        }
        try {
            return Util.get(fst, new BytesRef(query)) != null;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read line automaton", e);
        }
    }

    /**
     * Compiled automaton, or a null FST for an empty corpus.
     */
    record LineAutomaton(FST<Object> fst) {
    }
}
