package com.strataconf.core.resource;

import com.strataconf.core.model.ResourceCoordinate;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Computes the ordered list of resources to load.
 *
 * <h3>Order</h3>
 * <ol>
 * <li>profiles in caller order, then the {@code null} (global) profile</li>
 * <li>for each profile, variants in caller order; the {@code null} (base)
 * variant is placed first when the caller did not list it</li>
 * <li>for each variant, every extension, in the iteration order of the
 * supplied collection (which callers must not rely on)</li>
 * </ol>
 *
 * <p>
 * One entry is produced per (profile, variant, extension) triple, whether or
 * not a matching resource exists.
 * </p>
 *
 * @since 1.0.0
 */
public final class ResourceEnumerator {

    private ResourceEnumerator() {
        // utility class
    }

    /**
     * Enumerate resource coordinates.
     *
     * @param prefix     application prefix; may be {@code null}
     * @param profiles   caller profiles; must not be {@code null}
     * @param variants   caller variants; must not be {@code null}
     * @param extensions registered extensions; must not be {@code null}
     * @param template   path template; must not be {@code null}
     * @return unmodifiable, ordered list of coordinates
     */
    public static List<ResourceCoordinate> enumerate(String prefix,
            List<String> profiles,
            List<String> variants,
            Collection<String> extensions,
            ResourcePathTemplate template) {
        Objects.requireNonNull(profiles, "Profiles must not be null");
        Objects.requireNonNull(variants, "Variants must not be null");
        Objects.requireNonNull(extensions, "Extensions must not be null");
        Objects.requireNonNull(template, "Resource path template must not be null");

        List<ResourceCoordinate> coordinates = new ArrayList<>();
        for (String profile : effectiveProfiles(profiles)) {
            for (String variant : effectiveVariants(variants)) {
                for (String extension : extensions) {
                    String logicalName = template.resolve(prefix, profile, variant, extension);
                    coordinates.add(new ResourceCoordinate(profile, variant, extension, logicalName));
                }
            }
        }
        return Collections.unmodifiableList(coordinates);
    }

    /**
     * @return caller profiles without {@code null}, followed by {@code null}
     */
    static List<String> effectiveProfiles(List<String> profiles) {
        List<String> result = new ArrayList<>(profiles.size() + 1);
        for (String profile : profiles) {
            if (profile != null) {
                result.add(profile);
            }
        }
        result.add(null);
        return result;
    }

    /**
     * @return caller variants, with {@code null} prepended if missing
     */
    static List<String> effectiveVariants(List<String> variants) {
        for (String variant : variants) {
            if (variant == null) {
                return variants;
            }
        }
        List<String> result = new ArrayList<>(variants.size() + 1);
        result.add(null);
        result.addAll(variants);
        return result;
    }
}
