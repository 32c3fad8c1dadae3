package com.strataconf.core.parser;

import com.strataconf.core.error.UnsupportedFormatException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Factory for the default extension table and parser lookup by file name.
 *
 * <p>
 * This is the single point of extension when adding a new format: register
 * the extension here, or pass a custom table to the assembler.
 * </p>
 *
 * @since 1.0.0
 */
public final class DocumentParsers {

    public static final String YAML = "yaml";
    public static final String JSON = "json";

    private DocumentParsers() {
        // utility class
    }

    /**
     * Create the default extension table: {@code yaml} and {@code json}.
     *
     * <p>
     * Iteration order of an extension table is not part of the load-order
     * contract. The returned map is <strong>unmodifiable</strong>.
     * </p>
     *
     * @return unmodifiable extension to parser table
     */
    public static Map<String, DocumentParser> defaults() {
        Map<String, DocumentParser> parsers = new LinkedHashMap<>();
        parsers.put(YAML, new YamlDocumentParser());
        parsers.put(JSON, new JsonDocumentParser());
        return Collections.unmodifiableMap(parsers);
    }

    /**
     * Return the text after the last {@code .} of a path, or an empty string
     * if there is none.
     *
     * @param path file path or resource name; must not be {@code null}
     * @return the extension
     */
    public static String extensionOf(String path) {
        Objects.requireNonNull(path, "Path must not be null");
        int dot = path.lastIndexOf('.');
        return dot < 0 ? "" : path.substring(dot + 1);
    }

    /**
     * Pick the parser for a file from its extension.
     *
     * @param path    file path; must not be {@code null}
     * @param parsers extension table; must not be {@code null}
     * @return the registered parser
     * @throws UnsupportedFormatException if no parser is registered for the
     *                                    extension
     */
    public static DocumentParser forPath(String path, Map<String, DocumentParser> parsers) {
        Objects.requireNonNull(parsers, "Parser table must not be null");
        DocumentParser parser = parsers.get(extensionOf(path));
        if (parser == null) {
            throw new UnsupportedFormatException(path, parsers.keySet());
        }
        return parser;
    }
}
