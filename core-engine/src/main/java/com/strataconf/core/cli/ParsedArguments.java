package com.strataconf.core.cli;

import com.strataconf.core.merge.Trees;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Result of parsing command-line tokens: extra files to load, in encounter
 * order, and the override tree built from {@code path=value} tokens.
 *
 * @since 1.0.0
 */
public final class ParsedArguments {

    private static final ParsedArguments EMPTY = new ParsedArguments(List.of(), Map.of());

    private final List<String> additionalFiles;
    private final Map<String, Object> overrides;

    public ParsedArguments(List<String> additionalFiles, Map<String, ?> overrides) {
        this.additionalFiles = List.copyOf(Objects.requireNonNull(additionalFiles, "Files must not be null"));
        this.overrides = Trees.freeze(Objects.requireNonNull(overrides, "Overrides must not be null"));
    }

    public static ParsedArguments empty() {
        return EMPTY;
    }

    public List<String> getAdditionalFiles() {
        return additionalFiles;
    }

    public Map<String, Object> getOverrides() {
        return overrides;
    }

    @Override
    public String toString() {
        return "ParsedArguments{additionalFiles=" + additionalFiles + ", overrides=" + overrides + '}';
    }
}
