package pl.marcinmilkowski.line_search;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.line_search.bench.SpeedTest;
import pl.marcinmilkowski.line_search.bench.SpeedTestResult;
import pl.marcinmilkowski.line_search.client.LineSearchClient;
import pl.marcinmilkowski.line_search.config.ClientConfig;
import pl.marcinmilkowski.line_search.config.ConfigOverrides;
import pl.marcinmilkowski.line_search.config.ConfigurationException;
import pl.marcinmilkowski.line_search.config.IniFile;
import pl.marcinmilkowski.line_search.config.LoggingConfig;
import pl.marcinmilkowski.line_search.config.ServerConfig;
import pl.marcinmilkowski.line_search.config.ServerConfigResolver;
import pl.marcinmilkowski.line_search.corpus.CorpusLoadException;
import pl.marcinmilkowski.line_search.search.SearchAlgorithm;
import pl.marcinmilkowski.line_search.search.SearchAlgorithmRegistry;
import pl.marcinmilkowski.line_search.server.LineSearchServer;
import pl.marcinmilkowski.line_search.server.TlsContextFactory;

import javax.net.ssl.SSLContext;
import java.io.IOException;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Command-line launcher.
 *
 * Commands:
 * - server : run the line-search server (default when the first argument is an option)
 * - query  : send one query to a running server
 * - bench  : speed-test every search algorithm
 * - help   : show usage
 */
public class Main {

    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FATAL = 1;
    static final int EXIT_USAGE = 2;

    private static final int CLIENT_TIMEOUT_MILLIS = 3_000;

    public static void main(String[] args) {
        int status = run(args);
        if (status != EXIT_OK) {
            System.exit(status);
        }
    }

    /**
     * Dispatch a command line and return the process exit status.
     * The server command returns only after the server has stopped.
     */
    static int run(String[] args) {
        if (args.length == 0) {
            showUsage();
            return EXIT_OK;
        }

        String command = args[0].toLowerCase(Locale.ROOT);
        int first = 1;
        if (command.startsWith("-")) {
            command = "server";
            first = 0;
        }

        try {
            switch (command) {
                case "server":
                    return handleServerCommand(args, first);
                case "query":
                    return handleQueryCommand(args, first);
                case "bench":
                    return handleBenchCommand(args, first);
                case "help":
                    showUsage();
                    return EXIT_OK;
                default:
                    System.err.println("Unknown command: " + args[0]);
                    showUsage();
                    return EXIT_USAGE;
            }
        } catch (UsageException e) {
            System.err.println("Error: " + e.getMessage());
            System.err.println("Use 'help' command for usage information.");
            return EXIT_USAGE;
        }
    }

    private static int handleServerCommand(String[] args, int first) throws UsageException {
        Path configPath = null;
        Path serverConfigPath = null;
        Integer port = null;
        Boolean sslEnabled = null;
        Boolean rereadOnQuery = null;
        Path certPath = null;
        Path keyPath = null;
        String algorithm = null;
        String logLevel = null;

        for (int i = first; i < args.length; i++) {
            switch (args[i]) {
                case "--config":
                case "-c":
                    configPath = Path.of(value(args, ++i, "--config"));
                    break;
                case "--server_config":
                    serverConfigPath = Path.of(value(args, ++i, "--server_config"));
                    break;
                case "--search_algorithm":
                case "-a":
                    algorithm = value(args, ++i, "--search_algorithm");
                    break;
                case "--port":
                case "-p":
                    port = intValue(args, ++i, "--port");
                    break;
                case "--ssl_enabled":
                    sslEnabled = booleanValue(args, ++i, "--ssl_enabled");
                    break;
                case "--reread_on_query":
                    rereadOnQuery = booleanValue(args, ++i, "--reread_on_query");
                    break;
                case "--certfile":
                    certPath = Path.of(value(args, ++i, "--certfile"));
                    break;
                case "--keyfile":
                    keyPath = Path.of(value(args, ++i, "--keyfile"));
                    break;
                case "--log_level":
                    logLevel = value(args, ++i, "--log_level");
                    break;
                case "--verbose":
                case "-v":
                    logLevel = "DEBUG";
                    break;
                case "--quiet":
                case "-q":
                    logLevel = "WARNING";
                    break;
                default:
                    throw new UsageException("Unknown option: " + args[i]);
            }
        }

        applyLogLevel(logLevel);
        if (configPath == null) {
            throw new UsageException("--config is required");
        }

        ServerConfig config;
        try {
            config = new ServerConfigResolver().resolve(configPath, serverConfigPath,
                new ConfigOverrides(port, sslEnabled, rereadOnQuery, certPath, keyPath, algorithm));
        } catch (ConfigurationException e) {
            logger.error(LoggingConfig.FATAL, "Configuration error: {}", e.getMessage());
            return EXIT_FATAL;
        }

        SearchAlgorithm searchAlgorithm = SearchAlgorithmRegistry.resolve(config);
        try {
            searchAlgorithm.reload();
        } catch (CorpusLoadException e) {
            logger.error(LoggingConfig.FATAL, "Error loading search data: {}", e.getMessage());
            return EXIT_FATAL;
        }

        SSLContext sslContext = null;
        if (config.sslEnabled()) {
            try {
                sslContext = TlsContextFactory.createServerContext(config.certPath(), config.keyPath());
            } catch (IOException | GeneralSecurityException e) {
                logger.error(LoggingConfig.FATAL, "Error loading SSL certificate {} / key {}: {}",
                    config.certPath(), config.keyPath(), e.getMessage());
                return EXIT_FATAL;
            }
        }

        LineSearchServer server = LineSearchServer.builder()
            .withConfig(config)
            .withAlgorithm(searchAlgorithm)
            .withSslContext(sslContext)
            .withFatalErrorHandler(Main::exitOnFatalError)
            .build();
        try {
            server.start();
        } catch (IOException e) {
            logger.error(LoggingConfig.FATAL, "Cannot listen on port {}: {}", config.port(), e.getMessage());
            return EXIT_FATAL;
        }
        Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "line-search-shutdown"));

        try {
            server.join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            server.stop();
        }
        return EXIT_OK;
    }

    /**
     * Exit from a separate thread so the failing worker can finish and the
     * shutdown hook does not wait on it.
     */
    private static void exitOnFatalError(Throwable cause) {
        logger.error(LoggingConfig.FATAL, "Shutting down: {}", cause.getMessage());
        new Thread(() -> System.exit(EXIT_FATAL), "line-search-fatal-exit").start();
    }

    private static int handleQueryCommand(String[] args, int first) throws UsageException {
        Path clientConfigPath = null;
        String server = null;
        Integer port = null;
        String query = null;
        Boolean sslEnabled = null;
        Path caFile = null;

        for (int i = first; i < args.length; i++) {
            switch (args[i]) {
                case "--client_config":
                    clientConfigPath = Path.of(value(args, ++i, "--client_config"));
                    break;
                case "--server":
                case "-s":
                    server = value(args, ++i, "--server");
                    break;
                case "--port":
                case "-p":
                    port = intValue(args, ++i, "--port");
                    break;
                case "--query":
                    query = value(args, ++i, "--query");
                    break;
                case "--ssl_enabled":
                    sslEnabled = booleanValue(args, ++i, "--ssl_enabled");
                    break;
                case "--cafile":
                case "--cert_file":
                    caFile = Path.of(value(args, ++i, "--cafile"));
                    break;
                default:
                    throw new UsageException("Unknown option: " + args[i]);
            }
        }

        ClientConfig base = ClientConfig.DEFAULTS;
        if (clientConfigPath != null) {
            try {
                base = ClientConfig.load(clientConfigPath);
                logger.info("Client configuration loaded from {}", clientConfigPath);
            } catch (ConfigurationException e) {
                logger.error(LoggingConfig.FATAL, "Configuration error: {}", e.getMessage());
                return EXIT_FATAL;
            }
        }
        ClientConfig config;
        try {
            config = base.override(server, port, query, sslEnabled, caFile);
        } catch (IllegalArgumentException e) {
            throw new UsageException(e.getMessage());
        }
        if (config.query() == null) {
            throw new UsageException("--query is required unless the client config names one");
        }

        try {
            SSLContext sslContext = null;
            if (config.sslEnabled()) {
                sslContext = config.caFile() != null
                    ? TlsContextFactory.createClientContext(config.caFile())
                    : SSLContext.getDefault();
            }
            LineSearchClient client = new LineSearchClient(config.server(), config.port(), sslContext,
                CLIENT_TIMEOUT_MILLIS);
            System.out.println("Server Response: " + client.query(config.query()));
            return EXIT_OK;
        } catch (IOException | GeneralSecurityException e) {
            logger.debug("Query failed", e);
            System.out.println("Server Response: Error: " + e.getMessage());
            return EXIT_FATAL;
        }
    }

    private static int handleBenchCommand(String[] args, int first) throws UsageException {
        Path outputDir = Path.of(".");
        List<Integer> sizes = SpeedTest.DEFAULT_FILE_SIZES;
        List<String> queries = new ArrayList<>();
        int runs = SpeedTest.DEFAULT_RUNS;

        for (int i = first; i < args.length; i++) {
            switch (args[i]) {
                case "--output":
                case "-o":
                    outputDir = Path.of(value(args, ++i, "--output"));
                    break;
                case "--sizes":
                    sizes = parseSizes(value(args, ++i, "--sizes"));
                    break;
                case "--query":
                    queries.add(value(args, ++i, "--query"));
                    break;
                case "--runs":
                    runs = intValue(args, ++i, "--runs");
                    break;
                default:
                    throw new UsageException("Unknown option: " + args[i]);
            }
        }
        if (queries.isEmpty()) {
            queries = SpeedTest.DEFAULT_QUERIES;
        }
        if (runs < 1) {
            throw new UsageException("--runs must be positive");
        }

        SpeedTest speedTest = new SpeedTest();
        try {
            List<SpeedTest.TestFile> files = speedTest.generateTestFiles(outputDir, sizes);
            for (boolean reread : new boolean[] {true, false}) {
                List<SpeedTestResult> results = speedTest.collect(files, queries, runs, reread);
                Path report = outputDir.resolve("speed_test_data_reread_" + reread + ".json");
                SpeedTest.writeReport(results, report);
                System.out.println("Report written: " + report.toAbsolutePath());
            }
            return EXIT_OK;
        } catch (IOException | CorpusLoadException e) {
            logger.error("Speed test failed: {}", e.getMessage(), e);
            return EXIT_FATAL;
        }
    }

    private static void applyLogLevel(String logLevel) throws UsageException {
        if (logLevel == null) {
            return;
        }
        try {
            LoggingConfig.setRootLevel(logLevel);
        } catch (IllegalArgumentException e) {
            throw new UsageException(e.getMessage());
        }
    }

    private static List<Integer> parseSizes(String raw) throws UsageException {
        List<Integer> sizes = new ArrayList<>();
        for (String part : raw.split(",")) {
            if (part.isBlank()) {
                continue;
            }
            try {
                int size = Integer.parseInt(part.strip());
                if (size < 1) {
                    throw new UsageException("File sizes must be positive: " + part);
                }
                sizes.add(size);
            } catch (NumberFormatException e) {
                throw new UsageException("Invalid file size: " + part);
            }
        }
        if (sizes.isEmpty()) {
            throw new UsageException("--sizes needs at least one value");
        }
        return sizes;
    }

    private static String value(String[] args, int index, String option) throws UsageException {
        if (index >= args.length) {
            throw new UsageException(option + " needs a value");
        }
        return args[index];
    }

    private static int intValue(String[] args, int index, String option) throws UsageException {
        String raw = value(args, index, option);
        try {
            return Integer.parseInt(raw.strip());
        } catch (NumberFormatException e) {
            throw new UsageException(option + " expects an integer, got '" + raw + "'");
        }
    }

    private static boolean booleanValue(String[] args, int index, String option) throws UsageException {
        String raw = value(args, index, option);
        return IniFile.parseBoolean(raw)
            .orElseThrow(() -> new UsageException(option + " expects true or false, got '" + raw + "'"));
    }

    private static void showUsage() {
        System.out.println("Usage: java -jar line-search-server.jar <command> [options]");
        System.out.println();
        System.out.println("Commands:");
        System.out.println("  server    Run the line-search server (default)");
        System.out.println("  query     Send one query to a running server");
        System.out.println("  bench     Speed-test all search algorithms");
        System.out.println("  help      Show this help message");
        System.out.println();
        System.out.println("Server options:");
        System.out.println("  --config, -c <file>         File with a linuxpath=<corpus> line (required)");
        System.out.println("  --server_config <file>      INI file with a [Server] section");
        System.out.println("  --search_algorithm, -a <n>  Search algorithm (default: linear)");
        System.out.println("  --port, -p <port>           Port to listen on (default: " + ServerConfig.DEFAULT_PORT + ")");
        System.out.println("  --ssl_enabled <bool>        Enable TLS");
        System.out.println("  --reread_on_query <bool>    Reload the corpus before every query");
        System.out.println("  --certfile <file>           PEM certificate (default: server.crt)");
        System.out.println("  --keyfile <file>            PEM private key (default: server.key)");
        System.out.println("  --log_level <level>         CRITICAL, ERROR, WARNING, INFO, DEBUG or NOTSET");
        System.out.println("  --verbose, -v / --quiet, -q Shortcuts for DEBUG / WARNING");
        System.out.println();
        System.out.println("Query options:");
        System.out.println("  --client_config <file>      INI file with a [Client] section");
        System.out.println("  --server, -s <host>         Server address (default: 127.0.0.1)");
        System.out.println("  --port, -p <port>           Server port");
        System.out.println("  --query <text>              Query string (required unless in the client config)");
        System.out.println("  --ssl_enabled <bool>        Connect with TLS");
        System.out.println("  --cafile <file>             PEM certificate to trust");
        System.out.println();
        System.out.println("Bench options:");
        System.out.println("  --output, -o <dir>          Directory for test files and reports (default: .)");
        System.out.println("  --sizes <n,n,...>           Line counts of the generated files");
        System.out.println("  --query <text>              Query to time (repeatable)");
        System.out.println("  --runs <n>                  Runs per combination (default: " + SpeedTest.DEFAULT_RUNS + ")");
        System.out.println();
        System.out.println("Algorithms: " + String.join(", ", SearchAlgorithmRegistry.availableAlgorithms()));
    }

    /**
     * Bad command line; reported on stderr with exit status 2.
     */
    static class UsageException extends Exception {
        UsageException(String message) {
            super(message);
        }
    }
}
