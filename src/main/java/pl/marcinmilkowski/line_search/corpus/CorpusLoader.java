package pl.marcinmilkowski.line_search.corpus;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the target file into the shapes the search strategies index.
 *
 * Two representations are offered:
 * - line list: one entry per line, terminators removed, nothing else trimmed
 * - corpus text: the whole file with terminators normalised to '\n' and no
 *   trailing terminator, for strategies that scan text rather than lines
 *
 * Input is decoded strictly as UTF-8. Any I/O problem (missing file, no
 * permission, malformed bytes) surfaces as {@link CorpusLoadException}.
 */
public class CorpusLoader {

    private static final Logger defaultLogger = LoggerFactory.getLogger(CorpusLoader.class);

    private final Path path;
    private final Logger logger;

    public CorpusLoader(Path path) {
        this(path, defaultLogger);
    }

    public CorpusLoader(Path path, Logger logger) {
        this.path = path;
        this.logger = logger;
    }

    public Path getPath() {
        return path;
    }

    /**
     * Load the file as a list of lines.
     *
     * @return lines in file order, without line terminators
     * @throws CorpusLoadException if the file cannot be read
     */
    public List<String> readLines() {
        long start = System.nanoTime();
        List<String> lines = new ArrayList<>();
        try (BufferedReader reader = openReader()) {
            String line;
            while ((line = reader.readLine()) != null) {
                lines.add(line);
            }
        } catch (IOException e) {
            throw new CorpusLoadException(path, e);
        }
        logger.debug("Read {} lines from {} in {} ms", lines.size(), path, elapsedMillis(start));
        return lines;
    }

    /**
     * Load the file as a single string with '\n' between lines.
     *
     * @return normalised corpus text with its line count
     * @throws CorpusLoadException if the file cannot be read
     */
    public CorpusText readText() {
        long start = System.nanoTime();
        StringBuilder text = new StringBuilder();
        int count = 0;
        try (BufferedReader reader = openReader()) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (count++ > 0) {
                    text.append('\n');
                }
                text.append(line);
            }
        } catch (IOException e) {
            throw new CorpusLoadException(path, e);
        }
        logger.debug("Read {} lines ({} chars) from {} in {} ms",
            count, text.length(), path, elapsedMillis(start));
        return new CorpusText(text.toString(), count);
    }

    private BufferedReader openReader() throws IOException {
        if (!Files.exists(path)) {
            throw new FileNotFoundException("Corpus file not found: " + path);
        }
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
        return new BufferedReader(new InputStreamReader(Files.newInputStream(path), decoder), 1 << 16);
    }

    private static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }
}
