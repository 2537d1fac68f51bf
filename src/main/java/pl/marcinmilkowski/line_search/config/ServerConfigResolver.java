package pl.marcinmilkowski.line_search.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds the single {@link ServerConfig} the server runs with.
 *
 * Sources, lowest precedence first:
 * <ol>
 *   <li>minimal file: any line-oriented file whose first {@code linuxpath=...} line names the corpus (mandatory)</li>
 *   <li>extended INI file with a {@code [Server]} section (optional)</li>
 *   <li>command-line overrides</li>
 * </ol>
 *
 * Expected extended structure:
 * <pre>
 * [Server]
 * port=44445
 * ssl=false
 * reread_on_query=false
 * linuxpath=/path/to/200k.txt
 * certfile=server.crt
 * keyfile=server.key
 * search_algorithm=set
 * </pre>
 */
public class ServerConfigResolver {

    static final String SERVER_SECTION = "Server";
    private static final Pattern LINUX_PATH = Pattern.compile("^linuxpath=(.*)");

    private static final Logger defaultLogger = LoggerFactory.getLogger(ServerConfigResolver.class);

    private final Logger logger;

    public ServerConfigResolver() {
        this(defaultLogger);
    }

    public ServerConfigResolver(Logger logger) {
        this.logger = logger;
    }

    /**
     * Merge all sources into one configuration.
     *
     * @param minimalPath  mandatory file providing {@code linuxpath}
     * @param extendedPath optional INI file, may be {@code null}
     * @param overrides    command-line values, never {@code null}
     * @return the resolved configuration
     * @throws ConfigurationException if a source is missing or invalid
     */
    public ServerConfig resolve(Path minimalPath, Path extendedPath, ConfigOverrides overrides)
            throws ConfigurationException {
        if (minimalPath == null) {
            throw new ConfigurationException("A configuration file with a linuxpath line is required");
        }
        ServerConfig.Builder builder = ServerConfig.builder(loadCorpusPath(minimalPath));

        if (extendedPath != null) {
            builder = loadExtended(extendedPath, builder);
            logger.info("Extended server configuration loaded from {}", extendedPath);
        }

        ServerConfig config;
        try {
            config = overrides.applyTo(builder).build();
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(e.getMessage(), e);
        }
        logger.info("Server configuration: {}", config);
        return config;
    }

    /**
     * Read the corpus path from the first {@code linuxpath=} line of the minimal file.
     */
    public Path loadCorpusPath(Path minimalPath) throws ConfigurationException {
        if (!Files.isRegularFile(minimalPath)) {
            throw new ConfigurationException("Error reading server config file: " + minimalPath + " - File not found.");
        }
        try (BufferedReader reader = Files.newBufferedReader(minimalPath, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                Matcher m = LINUX_PATH.matcher(line);
                if (m.find()) {
                    String value = m.group(1).strip();
                    if (!value.isEmpty()) {
                        return Path.of(value);
                    }
                    break;
                }
            }
        } catch (IOException e) {
            throw new ConfigurationException("Error reading server config file: " + minimalPath, e);
        }
        throw new ConfigurationException("Config file must have a linuxpath line: " + minimalPath);
    }

    /**
     * Replace the builder's values with those of an extended INI file.
     *
     * Absent keys take the built-in defaults, so an extended file describes a
     * whole configuration; {@code linuxpath} there wins over the minimal file.
     */
    ServerConfig.Builder loadExtended(Path extendedPath, ServerConfig.Builder base) throws ConfigurationException {
        if (!Files.isRegularFile(extendedPath)) {
            throw new ConfigurationException(
                "Error reading extra server config file: " + extendedPath + " - File not found.");
        }
        IniFile ini;
        try {
            ini = IniFile.load(extendedPath);
        } catch (IOException e) {
            throw new ConfigurationException("Error reading extra server config file: " + extendedPath, e);
        }
        if (!ini.hasSection(SERVER_SECTION)) {
            throw new ConfigurationException("Config file must have a [Server] section: " + extendedPath);
        }

        ServerConfig defaults = base.build();
        Optional<String> corpus = ini.get(SERVER_SECTION, "linuxpath").filter(s -> !s.isBlank());

        return ServerConfig.builder(corpus.map(Path::of).orElse(defaults.corpusPath()))
            .withPort(ini.getInt(SERVER_SECTION, "port", ServerConfig.DEFAULT_PORT))
            .withSslEnabled(ini.getBoolean(SERVER_SECTION, "ssl", false))
            .withRereadOnQuery(ini.getBoolean(SERVER_SECTION, "reread_on_query", true))
            .withCertPath(Path.of(ini.get(SERVER_SECTION, "certfile").orElse(ServerConfig.DEFAULT_CERT_FILE)))
            .withKeyPath(Path.of(ini.get(SERVER_SECTION, "keyfile").orElse(ServerConfig.DEFAULT_KEY_FILE)))
            .withAlgorithmName(ini.get(SERVER_SECTION, "search_algorithm").orElse(ServerConfig.DEFAULT_ALGORITHM))
            .withMaxWorkers(ini.getInt(SERVER_SECTION, "max_workers", ServerConfig.DEFAULT_MAX_WORKERS))
            .withReadTimeoutMillis(ini.getInt(SERVER_SECTION, "read_timeout_ms",
                ServerConfig.DEFAULT_READ_TIMEOUT_MILLIS))
            .withReadChunkSize(ini.getInt(SERVER_SECTION, "read_chunk_size", ServerConfig.DEFAULT_READ_CHUNK_SIZE));
    }
}
