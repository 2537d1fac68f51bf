package pl.marcinmilkowski.line_search;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.line_search.config.ServerConfig;
import pl.marcinmilkowski.line_search.search.SearchAlgorithm;
import pl.marcinmilkowski.line_search.search.SearchAlgorithmRegistry;
import pl.marcinmilkowski.line_search.server.LineSearchServer;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MainTest {

    @TempDir
    Path tempDir;

    private final PrintStream originalOut = System.out;
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();

    @BeforeEach
    void captureOutput() {
        System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void restoreOutput() {
        System.setOut(originalOut);
    }

    private String output() {
        return out.toString(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("Help lists the commands and every algorithm")
    void help() {
        assertEquals(Main.EXIT_OK, Main.run(new String[] {"help"}));
        assertTrue(output().contains("Usage:"));
        for (String algorithm : SearchAlgorithmRegistry.availableAlgorithms()) {
            assertTrue(output().contains(algorithm), algorithm);
        }
    }

    @Test
    void unknownCommandIsUsageError() {
        assertEquals(Main.EXIT_USAGE, Main.run(new String[] {"frobnicate"}));
    }

    @Test
    @DisplayName("Server options without a command imply 'server'; --config is required")
    void serverNeedsConfig() {
        assertEquals(Main.EXIT_USAGE, Main.run(new String[] {"--port", "0"}));
        assertEquals(Main.EXIT_USAGE, Main.run(new String[] {"server", "--port", "abc"}));
        assertEquals(Main.EXIT_USAGE, Main.run(new String[] {"server", "--ssl_enabled", "maybe"}));
        assertEquals(Main.EXIT_USAGE, Main.run(new String[] {"server", "--config"}));
        assertEquals(Main.EXIT_USAGE, Main.run(new String[] {"server", "--bogus"}));
    }

    @Test
    @DisplayName("Missing configuration file is fatal")
    void missingConfigIsFatal() {
        Path missing = tempDir.resolve("missing.conf");

        assertEquals(Main.EXIT_FATAL, Main.run(new String[] {"server", "--config", missing.toString()}));
    }

    @Test
    @DisplayName("Missing corpus file is fatal at startup")
    void missingCorpusIsFatal() throws Exception {
        Path conf = tempDir.resolve("app.conf");
        Files.writeString(conf, "linuxpath=" + tempDir.resolve("absent.txt") + "\n");

        assertEquals(Main.EXIT_FATAL, Main.run(new String[] {"--config", conf.toString(), "--port", "0"}));
    }

    @Test
    @DisplayName("Unreadable TLS material is fatal at startup")
    void missingCertificateIsFatal() throws Exception {
        Path corpus = tempDir.resolve("corpus.txt");
        Files.writeString(corpus, "a\n");
        Path conf = tempDir.resolve("app.conf");
        Files.writeString(conf, "linuxpath=" + corpus + "\n");

        assertEquals(Main.EXIT_FATAL, Main.run(new String[] {
            "--config", conf.toString(), "--port", "0", "--ssl_enabled", "true",
            "--certfile", tempDir.resolve("no.crt").toString(), "--keyfile", tempDir.resolve("no.key").toString()}));
    }

    @Test
    @DisplayName("Query command prints the server response")
    void queryCommand() throws Exception {
        Path corpus = tempDir.resolve("corpus.txt");
        Files.write(corpus, List.of("test string 1"), StandardCharsets.UTF_8);
        ServerConfig config = ServerConfig.builder(corpus).withPort(0).withRereadOnQuery(false).build();
        SearchAlgorithm algorithm = SearchAlgorithmRegistry.resolve(config, LoggerFactory.getLogger(MainTest.class));
        algorithm.reload();
        LineSearchServer server = LineSearchServer.builder().withConfig(config).withAlgorithm(algorithm).build();
        server.start();
        try {
            int status = Main.run(new String[] {
                "query", "--server", "127.0.0.1", "--port", String.valueOf(server.getLocalPort()),
                "--query", "test string 1"});

            assertEquals(Main.EXIT_OK, status);
            assertTrue(output().contains("Server Response: STRING EXISTS"), output());
        } finally {
            server.stop();
        }
    }

    @Test
    @DisplayName("Query command reads the client config, command-line values win")
    void queryCommandWithClientConfig() throws Exception {
        Path corpus = tempDir.resolve("corpus.txt");
        Files.write(corpus, List.of("test string 1", "test string 2"), StandardCharsets.UTF_8);
        ServerConfig config = ServerConfig.builder(corpus).withPort(0).withRereadOnQuery(false).build();
        SearchAlgorithm algorithm = SearchAlgorithmRegistry.resolve(config);
        algorithm.reload();
        LineSearchServer server = LineSearchServer.builder().withConfig(config).withAlgorithm(algorithm).build();
        server.start();
        try {
            Path ini = tempDir.resolve("client.ini");
            Files.writeString(ini, "[Client]\nserver=127.0.0.1\nport=" + server.getLocalPort()
                + "\nquery=test string 2\n");

            assertEquals(Main.EXIT_OK, Main.run(new String[] {"query", "--client_config", ini.toString()}));
            assertTrue(output().contains("Server Response: STRING EXISTS"), output());

            out.reset();
            assertEquals(Main.EXIT_OK, Main.run(new String[] {
                "query", "--client_config", ini.toString(), "--query", "test string 3"}));
            assertTrue(output().contains("Server Response: STRING NOT FOUND"), output());
        } finally {
            server.stop();
        }
    }

    @Test
    @DisplayName("A missing client config is fatal")
    void missingClientConfigIsFatal() {
        assertEquals(Main.EXIT_FATAL, Main.run(new String[] {
            "query", "--client_config", tempDir.resolve("nope.ini").toString(), "--query", "x"}));
    }

    @Test
    void queryCommandNeedsQuery() {
        assertEquals(Main.EXIT_USAGE, Main.run(new String[] {"query", "--server", "127.0.0.1"}));
    }

    @Test
    @DisplayName("Bench command writes both JSON reports")
    void benchCommand() {
        int status = Main.run(new String[] {
            "bench", "--output", tempDir.toString(), "--sizes", "20,40", "--runs", "1", "--query", "test string 3"});

        assertEquals(Main.EXIT_OK, status);
        assertTrue(Files.exists(tempDir.resolve("test_data_20.txt")));
        assertTrue(Files.exists(tempDir.resolve("speed_test_data_reread_true.json")));
        assertTrue(Files.exists(tempDir.resolve("speed_test_data_reread_false.json")));
    }

    @Test
    void benchRejectsBadSizes() {
        assertEquals(Main.EXIT_USAGE, Main.run(new String[] {"bench", "--sizes", "ten"}));
        assertEquals(Main.EXIT_USAGE, Main.run(new String[] {"bench", "--sizes", "0"}));
    }
}
