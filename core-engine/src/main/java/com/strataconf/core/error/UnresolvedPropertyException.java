package com.strataconf.core.error;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Thrown when a {@code ${NAME}} expansion has no value and no default.
 *
 * @since 1.0.0
 */
public class UnresolvedPropertyException extends ConfigurationException {

    private static final long serialVersionUID = 1L;

    private final String propertyName;
    private final List<String> knownKeys;
    private final String source;

    public UnresolvedPropertyException(String propertyName, List<String> knownKeys, String source) {
        super(String.format("Unable to find expansion for property `%s'.", propertyName));
        this.propertyName = Objects.requireNonNull(propertyName, "Property name must not be null");
        this.knownKeys = List.copyOf(knownKeys);
        this.source = source;
    }

    /**
     * Return a copy of this exception that also records the document text in
     * which the reference appeared.
     *
     * @param source raw, pre-expansion document text
     * @return a new exception carrying {@code source}
     */
    public UnresolvedPropertyException withSource(String source) {
        UnresolvedPropertyException copy = new UnresolvedPropertyException(propertyName, knownKeys, source);
        copy.setStackTrace(getStackTrace());
        return copy;
    }

    public String getPropertyName() {
        return propertyName;
    }

    /**
     * @return every key that was available for lookup, in sorted order
     */
    public List<String> getKnownKeys() {
        return Collections.unmodifiableList(knownKeys);
    }

    public Optional<String> getSource() {
        return Optional.ofNullable(source);
    }
}
