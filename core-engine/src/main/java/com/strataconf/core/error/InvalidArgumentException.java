package com.strataconf.core.error;

/**
 * Thrown when a command-line token is neither {@code --load <path>} nor
 * {@code path=value}.
 *
 * @since 1.0.0
 */
public class InvalidArgumentException extends ConfigurationException {

    private static final long serialVersionUID = 1L;

    private final String token;

    public InvalidArgumentException(String token) {
        this(token, String.format("Unable to parse argument `%s'.", token));
    }

    public InvalidArgumentException(String token, String message) {
        super(message);
        this.token = token;
    }

    public String getToken() {
        return token;
    }
}
