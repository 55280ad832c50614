package net.spookly.tierline.config;

/**
 * Fatal configuration problem detected while loading or validating the config.
 */
public class ConfigException extends RuntimeException {
    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
