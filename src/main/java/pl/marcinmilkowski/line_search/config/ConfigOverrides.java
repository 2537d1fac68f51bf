package pl.marcinmilkowski.line_search.config;

import java.nio.file.Path;

/**
 * Command-line values that take precedence over both configuration files.
 * A {@code null} component means "not given on the command line".
 */
public record ConfigOverrides(
    Integer port,
    Boolean sslEnabled,
    Boolean rereadOnQuery,
    Path certPath,
    Path keyPath,
    String algorithmName
) {
    public static final ConfigOverrides NONE = new ConfigOverrides(null, null, null, null, null, null);

    ServerConfig.Builder applyTo(ServerConfig.Builder builder) {
        if (port != null) builder.withPort(port);
        if (sslEnabled != null) builder.withSslEnabled(sslEnabled);
        if (rereadOnQuery != null) builder.withRereadOnQuery(rereadOnQuery);
        if (certPath != null) builder.withCertPath(certPath);
        if (keyPath != null) builder.withKeyPath(keyPath);
        if (algorithmName != null && !algorithmName.isBlank()) builder.withAlgorithmName(algorithmName);
        return builder;
    }
}
