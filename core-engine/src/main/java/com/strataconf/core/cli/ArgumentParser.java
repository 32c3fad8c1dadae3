package com.strataconf.core.cli;

import com.strataconf.core.error.InvalidArgumentException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses command-line tokens into additional files and value overrides.
 *
 * <p>
 * {@code web-server/port=8080} is equivalent to setting
 * {@code overrides["web-server"]["port"] = "8080"}. Values stay strings;
 * schema coercion converts them later. When two tokens name the same path
 * the later one wins.
 * </p>
 *
 * @since 1.0.0
 */
public final class ArgumentParser {

    /** Token that introduces an additional file. */
    public static final String LOAD = "--load";

    private static final Pattern ASSIGNMENT = Pattern.compile("([^=]+)=(.*)", Pattern.DOTALL);

    private ArgumentParser() {
        // utility class
    }

    /**
     * Parse tokens left to right.
     *
     * @param args command-line tokens; {@code null} is treated as empty
     * @return the files and overrides found
     * @throws InvalidArgumentException if a token cannot be parsed
     */
    public static ParsedArguments parse(List<String> args) {
        if (args == null || args.isEmpty()) {
            return ParsedArguments.empty();
        }

        List<String> files = new ArrayList<>();
        Map<String, Object> overrides = new LinkedHashMap<>();

        Iterator<String> tokens = args.iterator();
        while (tokens.hasNext()) {
            String token = Objects.requireNonNull(tokens.next(), "Argument must not be null");
            if (LOAD.equals(token)) {
                if (!tokens.hasNext()) {
                    throw new InvalidArgumentException(token, "Option `--load' requires a file path.");
                }
                files.add(tokens.next());
            } else {
                mergeValue(overrides, token);
            }
        }
        return new ParsedArguments(files, overrides);
    }

    /**
     * @see #parse(List)
     */
    public static ParsedArguments parse(String... args) {
        return parse(args == null ? null : Arrays.asList(args));
    }

    /**
     * Apply a single {@code path=value} token to a mutable override tree.
     *
     * @param overrides mutable tree to update
     * @param token     the token
     * @throws InvalidArgumentException if the token has no {@code =} or an
     *                                  empty path
     */
    static void mergeValue(Map<String, Object> overrides, String token) {
        Matcher matcher = ASSIGNMENT.matcher(token);
        if (!matcher.matches()) {
            throw new InvalidArgumentException(token);
        }
        String[] keys = matcher.group(1).split("/");
        if (keys.length == 0) {
            throw new InvalidArgumentException(token);
        }
        assocIn(overrides, keys, matcher.group(2));
    }

    private static void assocIn(Map<String, Object> root, String[] keys, String value) {
        Map<String, Object> current = root;
        for (int i = 0; i < keys.length - 1; i++) {
            current = childMap(current, keys[i]);
        }
        current.put(keys[keys.length - 1], value);
    }

    private static Map<String, Object> childMap(Map<String, Object> parent, String key) {
        Map<String, Object> child = new LinkedHashMap<>();
        // a scalar set by an earlier token is replaced by the deeper path
        if (parent.get(key) instanceof Map<?, ?> existing) {
            existing.forEach((k, v) -> child.put(String.valueOf(k), v));
        }
        parent.put(key, child);
        return child;
    }
}
