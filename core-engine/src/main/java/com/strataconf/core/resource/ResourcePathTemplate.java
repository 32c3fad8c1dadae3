package com.strataconf.core.resource;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds a logical resource name from its components.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface ResourcePathTemplate {

    /** Fixed final segment of every default resource name. */
    String SUFFIX = "configuration";

    /**
     * @param prefix    application prefix, or {@code null}
     * @param profile   profile, or {@code null} for the global layer
     * @param variant   variant, or {@code null} for the base layer
     * @param extension file extension without the dot
     * @return logical resource name
     */
    String resolve(String prefix, String profile, String variant, String extension);

    /**
     * The default template: {@code prefix-profile-variant-configuration.ext},
     * with {@code null} segments (and their dash) omitted.
     *
     * @return the default template
     */
    static ResourcePathTemplate defaultTemplate() {
        return (prefix, profile, variant, extension) -> {
            List<String> segments = new ArrayList<>(4);
            for (String segment : new String[] { prefix, profile, variant, SUFFIX }) {
                if (segment != null) {
                    segments.add(segment);
                }
            }
            return String.join("-", segments) + "." + extension;
        };
    }
}
