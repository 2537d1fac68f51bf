package pl.marcinmilkowski.line_search.config;

/**
 * A configuration source is missing, unreadable or holds an invalid value.
 * Always fatal before the server binds.
 */
public class ConfigurationException extends Exception {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
