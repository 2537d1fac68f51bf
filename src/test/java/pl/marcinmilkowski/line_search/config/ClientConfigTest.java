package pl.marcinmilkowski.line_search.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ClientConfigTest {

    @TempDir
    Path tempDir;

    private Path ini(String content) throws Exception {
        Path file = tempDir.resolve("client.ini");
        Files.writeString(file, content);
        return file;
    }

    @Test
    @DisplayName("All [Client] keys are read")
    void readsClientSection() throws Exception {
        Path file = ini("[Client]\nserver = search.example.org\nport = 5555\nquery = test string 7\n"
            + "ssl_enabled = yes\ncert_file = ca.crt\n");

        ClientConfig config = ClientConfig.load(file);

        assertEquals("search.example.org", config.server());
        assertEquals(5555, config.port());
        assertEquals("test string 7", config.query());
        assertTrue(config.sslEnabled());
        assertEquals(Path.of("ca.crt"), config.caFile());
    }

    @Test
    @DisplayName("Only the port is mandatory")
    void defaultsAroundPort() throws Exception {
        ClientConfig config = ClientConfig.load(ini("[client]\nport=44446\n"));

        assertEquals(ClientConfig.DEFAULT_SERVER, config.server());
        assertEquals(44446, config.port());
        assertNull(config.query());
        assertFalse(config.sslEnabled());
        assertNull(config.caFile());
    }

    @Test
    void missingFileSectionOrPort() throws Exception {
        assertThrows(ConfigurationException.class, () -> ClientConfig.load(tempDir.resolve("nope.ini")));
        assertThrows(ConfigurationException.class, () -> ClientConfig.load(ini("[Server]\nport=1\n")));
        assertThrows(ConfigurationException.class, () -> ClientConfig.load(ini("[Client]\nserver=localhost\n")));
    }

    @Test
    void invalidValues() throws Exception {
        assertThrows(ConfigurationException.class, () -> ClientConfig.load(ini("[Client]\nport=abc\n")));
        assertThrows(ConfigurationException.class, () -> ClientConfig.load(ini("[Client]\nport=70000\n")));
        assertThrows(ConfigurationException.class,
            () -> ClientConfig.load(ini("[Client]\nport=1\nssl_enabled=maybe\n")));
    }

    @Test
    @DisplayName("Non-null overrides replace file values")
    void overrides() {
        ClientConfig base = new ClientConfig("10.0.0.1", 1000, "from file", true, Path.of("ca.crt"));

        ClientConfig merged = base.override(null, 2000, "from cli", false, null);

        assertEquals("10.0.0.1", merged.server());
        assertEquals(2000, merged.port());
        assertEquals("from cli", merged.query());
        assertFalse(merged.sslEnabled());
        assertEquals(Path.of("ca.crt"), merged.caFile());
        assertSame(base.query(), base.override(null, null, null, null, null).query());
    }
}
