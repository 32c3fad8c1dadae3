package com.strataconf.core.error;

/**
 * Base class for every failure raised while assembling a configuration.
 *
 * <p>
 * Unchecked: configuration is read once at process start, and callers are
 * expected to let these propagate to the bootstrap code.
 * </p>
 *
 * @since 1.0.0
 */
public class ConfigurationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
