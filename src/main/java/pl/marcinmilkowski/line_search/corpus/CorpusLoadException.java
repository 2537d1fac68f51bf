package pl.marcinmilkowski.line_search.corpus;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;

/**
 * Raised when the target file cannot be turned into a corpus.
 *
 * <p>Callers treat this as fatal: a search strategy that cannot load its data
 * must never keep answering from stale or empty state.</p>
 */
public class CorpusLoadException extends UncheckedIOException {

    private final Path path;

    public CorpusLoadException(Path path, IOException cause) {
        super("Cannot load corpus from " + path + ": " + cause.getMessage(), cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
