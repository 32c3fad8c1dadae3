package com.strataconf.core.property;

import com.strataconf.core.error.UnresolvedPropertyException;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Substitutes {@code ${NAME}} and {@code ${NAME:default}} references in raw
 * document text.
 *
 * <p>
 * Expansion is purely textual and happens before parsing, so references may
 * appear anywhere: inside quoted strings, in numeric positions, even in map
 * keys. References do not nest, and a reference never spans lines. The
 * reference body is split at the first {@code :} that is not its first
 * character.
 * </p>
 *
 * @since 1.0.0
 */
public final class PropertyExpander {

    private static final Pattern REFERENCE = Pattern.compile("\\$\\{((?!\\$\\{).*?)\\}");

    private PropertyExpander() {
        // utility class
    }

    /**
     * Expand every reference in {@code source}.
     *
     * @param source   raw document text; must not be {@code null}
     * @param resolver property lookup; must not be {@code null}
     * @return the expanded text
     * @throws UnresolvedPropertyException if a reference without default has
     *                                     no value; the exception carries
     *                                     {@code source}
     */
    public static String expand(String source, PropertyResolver resolver) {
        Objects.requireNonNull(source, "Source text must not be null");
        Objects.requireNonNull(resolver, "Property resolver must not be null");

        Matcher matcher = REFERENCE.matcher(source);
        StringBuilder result = new StringBuilder(source.length());
        while (matcher.find()) {
            String reference = matcher.group(1);
            int colon = reference.indexOf(':');
            String name = colon > 0 ? reference.substring(0, colon) : reference;
            String defaultValue = colon > 0 ? reference.substring(colon + 1) : null;

            String value;
            try {
                value = resolver.resolve(name, defaultValue);
            } catch (UnresolvedPropertyException e) {
                throw e.withSource(source);
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(result);
        return result.toString();
    }
}
