package dev.haggis.common.config;

@SuppressWarnings("serial")
public final class ConfigurationException extends Exception {

    public ConfigurationException(final String message) {
        super(message);
    }

    public ConfigurationException(final String message, final Exception cause) {
        super(message, cause);
    }
}
