package pl.marcinmilkowski.line_search.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Settings of the {@code query} command.
 *
 * Expected INI structure:
 * <pre>
 * [Client]
 * server=127.0.0.1
 * port=44445
 * query=test string 5000
 * ssl_enabled=false
 * cert_file=server.crt
 * </pre>
 *
 * {@code port} is mandatory in a file; everything else has a default. Values
 * given on the command line win over the file.
 *
 * @param server     host name or address of the server
 * @param port       server port
 * @param query      query to send, or {@code null} if none was configured
 * @param sslEnabled connect with TLS
 * @param caFile     PEM certificate to trust, or {@code null} for the JDK trust store
 */
public record ClientConfig(String server, int port, String query, boolean sslEnabled, Path caFile) {

    static final String CLIENT_SECTION = "Client";
    public static final String DEFAULT_SERVER = "127.0.0.1";

    public static final ClientConfig DEFAULTS =
        new ClientConfig(DEFAULT_SERVER, ServerConfig.DEFAULT_PORT, null, false, null);

    public ClientConfig {
        if (server == null || server.isBlank()) {
            throw new IllegalArgumentException("server must not be blank");
        }
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
    }

    /**
     * Read the {@code [Client]} section of an INI file.
     *
     * @throws ConfigurationException if the file or section is missing, or a value is invalid
     */
    public static ClientConfig load(Path path) throws ConfigurationException {
        if (!Files.isRegularFile(path)) {
            throw new ConfigurationException("Error reading client config file: " + path + " - File not found.");
        }
        IniFile ini;
        try {
            ini = IniFile.load(path);
        } catch (IOException e) {
            throw new ConfigurationException("Error reading client config file: " + path, e);
        }
        if (!ini.hasSection(CLIENT_SECTION)) {
            throw new ConfigurationException("Config file must have a [Client] section: " + path);
        }
        if (ini.get(CLIENT_SECTION, "port").filter(s -> !s.isBlank()).isEmpty()) {
            throw new ConfigurationException("Client config is missing 'port': " + path);
        }

        try {
            return new ClientConfig(
                ini.get(CLIENT_SECTION, "server").filter(s -> !s.isBlank()).orElse(DEFAULT_SERVER),
                ini.getInt(CLIENT_SECTION, "port", ServerConfig.DEFAULT_PORT),
                ini.get(CLIENT_SECTION, "query").orElse(null),
                ini.getBoolean(CLIENT_SECTION, "ssl_enabled", false),
                ini.get(CLIENT_SECTION, "cert_file").filter(s -> !s.isBlank()).map(Path::of).orElse(null));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(e.getMessage() + ": " + path, e);
        }
    }

    /**
     * Copy with the non-null arguments replacing the current values.
     */
    public ClientConfig override(String server, Integer port, String query, Boolean sslEnabled, Path caFile) {
        return new ClientConfig(
            server != null ? server : this.server,
            port != null ? port : this.port,
            query != null ? query : this.query,
            sslEnabled != null ? sslEnabled : this.sslEnabled,
            caFile != null ? caFile : this.caFile);
    }
}
