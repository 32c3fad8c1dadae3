package com.strataconf.core.parser;

/**
 * Contract for all document parsers.
 *
 * <p>
 * Implementations receive text that has already been through property
 * expansion and return a tree of {@link java.util.Map}s,
 * {@link java.util.Collection}s and scalars. Parsers may be invoked from
 * several threads at once when documents are loaded in parallel, so they must
 * not keep per-call state in fields.
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface DocumentParser {

    /**
     * Parse a document.
     *
     * @param text expanded document text
     * @return the parsed tree, or {@code null} if the document is empty
     * @throws RuntimeException if the text is malformed; the loader wraps it
     *                          in a
     *                          {@link com.strataconf.core.error.DocumentParseException}
     */
    Object parse(String text);
}
