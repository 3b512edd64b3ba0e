package work.rescuekit.config;

/**
 * Raised when a configuration file or command-line value cannot be used.
 */
public final class ConfigurationException extends RuntimeException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
