package com.strataconf.core.error;

import java.util.Set;

/**
 * Thrown when a configuration file has an extension with no registered parser.
 *
 * @since 1.0.0
 */
public class UnsupportedFormatException extends ConfigurationException {

    private static final long serialVersionUID = 1L;

    private final String path;
    private final Set<String> knownExtensions;

    public UnsupportedFormatException(String path, Set<String> knownExtensions) {
        super("Unknown extension for configuration file `" + path
                + "'. Supported: " + String.join(", ", knownExtensions));
        this.path = path;
        this.knownExtensions = Set.copyOf(knownExtensions);
    }

    public String getPath() {
        return path;
    }

    public Set<String> getKnownExtensions() {
        return knownExtensions;
    }
}
