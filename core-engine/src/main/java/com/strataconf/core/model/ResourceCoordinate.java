package com.strataconf.core.model;

import java.io.Serializable;
import java.util.Objects;
import java.util.Optional;

/**
 * One entry produced by resource enumeration: a profile, a variant, an
 * extension, and the logical resource name computed from them.
 *
 * <p>
 * A {@code null} profile denotes the global layer; a {@code null} variant
 * denotes the base (default) layer of a profile.
 * </p>
 *
 * @since 1.0.0
 */
public final class ResourceCoordinate implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String profile;
    private final String variant;
    private final String extension;
    private final String logicalName;

    public ResourceCoordinate(String profile, String variant, String extension, String logicalName) {
        this.profile = profile;
        this.variant = variant;
        this.extension = Objects.requireNonNull(extension, "Extension must not be null");
        this.logicalName = Objects.requireNonNull(logicalName, "Logical name must not be null");
    }

    public Optional<String> getProfile() {
        return Optional.ofNullable(profile);
    }

    public Optional<String> getVariant() {
        return Optional.ofNullable(variant);
    }

    public String getExtension() {
        return extension;
    }

    public String getLogicalName() {
        return logicalName;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ResourceCoordinate that))
            return false;
        return Objects.equals(profile, that.profile)
                && Objects.equals(variant, that.variant)
                && extension.equals(that.extension)
                && logicalName.equals(that.logicalName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(profile, variant, extension, logicalName);
    }

    @Override
    public String toString() {
        return "ResourceCoordinate{" +
                "profile=" + profile +
                ", variant=" + variant +
                ", extension='" + extension + '\'' +
                ", logicalName='" + logicalName + '\'' +
                '}';
    }
}
