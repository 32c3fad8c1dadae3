package com.strataconf.core.error;

/**
 * Thrown when an existing document source cannot be read.
 *
 * @since 1.0.0
 */
public class ConfigurationReadException extends ConfigurationException {

    private static final long serialVersionUID = 1L;

    private final String sourceIdentity;

    public ConfigurationReadException(String sourceIdentity, Throwable cause) {
        super("Failed to read configuration from " + sourceIdentity, cause);
        this.sourceIdentity = sourceIdentity;
    }

    public String getSourceIdentity() {
        return sourceIdentity;
    }
}
