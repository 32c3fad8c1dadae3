package com.strataconf.core.model;

import com.strataconf.core.merge.Trees;

import java.util.Map;
import java.util.Objects;

/**
 * A single configuration layer after expansion and parsing.
 *
 * <p>
 * The content is copied into a deeply unmodifiable tree on construction, so a
 * document can be shared between merges without risk of being altered.
 * </p>
 *
 * @since 1.0.0
 */
public final class ParsedDocument {

    private final String sourceIdentity;
    private final Map<String, Object> content;

    public ParsedDocument(String sourceIdentity, Map<?, ?> content) {
        this.sourceIdentity = Objects.requireNonNull(sourceIdentity, "Source identity must not be null");
        this.content = Trees.freeze(Objects.requireNonNull(content, "Content must not be null"));
    }

    /**
     * @return URL or path the document was read from
     */
    public String getSourceIdentity() {
        return sourceIdentity;
    }

    public Map<String, Object> getContent() {
        return content;
    }

    @Override
    public String toString() {
        return "ParsedDocument{source='" + sourceIdentity + "', keys=" + content.keySet() + '}';
    }
}
