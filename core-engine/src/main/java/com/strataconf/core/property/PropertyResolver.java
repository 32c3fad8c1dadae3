package com.strataconf.core.property;

import com.strataconf.core.error.UnresolvedPropertyException;

import java.util.Objects;
import java.util.Optional;

/**
 * Resolves property names against an {@link EnvironmentSnapshot}.
 *
 * @since 1.0.0
 */
public final class PropertyResolver {

    private final EnvironmentSnapshot snapshot;

    public PropertyResolver(EnvironmentSnapshot snapshot) {
        this.snapshot = Objects.requireNonNull(snapshot, "Environment snapshot must not be null");
    }

    /**
     * Look up a property.
     *
     * <p>
     * A non-null {@code defaultValue} is always an acceptable fallback, even
     * when empty.
     * </p>
     *
     * @param name         property name; must not be {@code null}
     * @param defaultValue value used when {@code name} is unknown; may be
     *                     {@code null}
     * @return the property value or the default
     * @throws UnresolvedPropertyException if the name is unknown and there is
     *                                     no default
     */
    public String resolve(String name, String defaultValue) {
        Objects.requireNonNull(name, "Property name must not be null");
        return snapshot.get(name)
                .or(() -> Optional.ofNullable(defaultValue))
                .orElseThrow(() -> new UnresolvedPropertyException(name, snapshot.keys(), null));
    }

    public EnvironmentSnapshot getSnapshot() {
        return snapshot;
    }
}
