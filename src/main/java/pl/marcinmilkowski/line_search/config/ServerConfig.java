package pl.marcinmilkowski.line_search.config;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Immutable server configuration, resolved once before any socket is opened
 * and shared read-only by every component.
 *
 * @param port              TCP port to bind on all interfaces (0 = ephemeral)
 * @param sslEnabled        wrap accepted sockets in TLS
 * @param rereadOnQuery     rebuild the corpus before every query instead of once at startup
 * @param corpusPath        the target file queried by clients
 * @param certPath          PEM certificate chain (used when TLS is on)
 * @param keyPath           PEM private key (used when TLS is on)
 * @param algorithmName     registry name of the search strategy
 * @param maxWorkers        upper bound on concurrently handled connections
 * @param readTimeoutMillis idle-read timeout for the single request read
 * @param readChunkSize     bytes read per request; longer queries are truncated
 * @param backlog           listen backlog of the server socket
 */
public record ServerConfig(
    int port,
    boolean sslEnabled,
    boolean rereadOnQuery,
    Path corpusPath,
    Path certPath,
    Path keyPath,
    String algorithmName,
    int maxWorkers,
    int readTimeoutMillis,
    int readChunkSize,
    int backlog
) {
    public static final int DEFAULT_PORT = 44445;
    public static final String DEFAULT_CERT_FILE = "server.crt";
    public static final String DEFAULT_KEY_FILE = "server.key";
    public static final String DEFAULT_ALGORITHM = "linear";
    public static final int DEFAULT_MAX_WORKERS = 2048;
    public static final int DEFAULT_READ_TIMEOUT_MILLIS = 50;
    public static final int DEFAULT_READ_CHUNK_SIZE = 1024;
    public static final int DEFAULT_BACKLOG = 5;

    public ServerConfig {
        Objects.requireNonNull(corpusPath, "corpusPath");
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("Port out of range: " + port);
        }
        if (maxWorkers < 1) {
            throw new IllegalArgumentException("maxWorkers must be positive: " + maxWorkers);
        }
        if (readTimeoutMillis < 1) {
            throw new IllegalArgumentException("readTimeoutMillis must be positive: " + readTimeoutMillis);
        }
        if (readChunkSize < 1) {
            throw new IllegalArgumentException("readChunkSize must be positive: " + readChunkSize);
        }
        if (backlog < 1) {
            throw new IllegalArgumentException("backlog must be positive: " + backlog);
        }
        if (algorithmName == null || algorithmName.isBlank()) {
            algorithmName = DEFAULT_ALGORITHM;
        }
    }

    /**
     * Builder seeded with a corpus path and all other fields at their defaults.
     */
    public static Builder builder(Path corpusPath) {
        return new Builder(corpusPath);
    }

    /**
     * Builder seeded with every field of this configuration.
     */
    public Builder toBuilder() {
        return new Builder(corpusPath)
            .withPort(port)
            .withSslEnabled(sslEnabled)
            .withRereadOnQuery(rereadOnQuery)
            .withCertPath(certPath)
            .withKeyPath(keyPath)
            .withAlgorithmName(algorithmName)
            .withMaxWorkers(maxWorkers)
            .withReadTimeoutMillis(readTimeoutMillis)
            .withReadChunkSize(readChunkSize)
            .withBacklog(backlog);
    }

    /**
     * Builder for {@link ServerConfig}.
     */
    public static class Builder {
        private int port = DEFAULT_PORT;
        private boolean sslEnabled = false;
        private boolean rereadOnQuery = true;
        private Path corpusPath;
        private Path certPath = Path.of(DEFAULT_CERT_FILE);
        private Path keyPath = Path.of(DEFAULT_KEY_FILE);
        private String algorithmName = DEFAULT_ALGORITHM;
        private int maxWorkers = DEFAULT_MAX_WORKERS;
        private int readTimeoutMillis = DEFAULT_READ_TIMEOUT_MILLIS;
        private int readChunkSize = DEFAULT_READ_CHUNK_SIZE;
        private int backlog = DEFAULT_BACKLOG;

        private Builder(Path corpusPath) {
            this.corpusPath = corpusPath;
        }

        public Builder withPort(int port) {
            this.port = port;
            return this;
        }

        public Builder withSslEnabled(boolean sslEnabled) {
            this.sslEnabled = sslEnabled;
            return this;
        }

        public Builder withRereadOnQuery(boolean rereadOnQuery) {
            this.rereadOnQuery = rereadOnQuery;
            return this;
        }

        public Builder withCorpusPath(Path corpusPath) {
            this.corpusPath = corpusPath;
            return this;
        }

        public Builder withCertPath(Path certPath) {
            this.certPath = certPath;
            return this;
        }

        public Builder withKeyPath(Path keyPath) {
            this.keyPath = keyPath;
            return this;
        }

        public Builder withAlgorithmName(String algorithmName) {
            this.algorithmName = algorithmName;
            return this;
        }

        public Builder withMaxWorkers(int maxWorkers) {
            this.maxWorkers = maxWorkers;
            return this;
        }

        public Builder withReadTimeoutMillis(int readTimeoutMillis) {
            this.readTimeoutMillis = readTimeoutMillis;
            return this;
        }

        public Builder withReadChunkSize(int readChunkSize) {
            this.readChunkSize = readChunkSize;
            return this;
        }

        public Builder withBacklog(int backlog) {
            this.backlog = backlog;
            return this;
        }

        public ServerConfig build() {
            return new ServerConfig(port, sslEnabled, rereadOnQuery, corpusPath, certPath, keyPath,
                algorithmName, maxWorkers, readTimeoutMillis, readChunkSize, backlog);
        }
    }
}
