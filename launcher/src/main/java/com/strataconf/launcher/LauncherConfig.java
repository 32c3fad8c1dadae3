package com.strataconf.launcher;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Function;

/**
 * Typed, immutable settings for {@link StrataLauncher}.
 *
 * <p>
 * Values are resolved from environment variables so the launcher can be
 * driven from a shell, a container {@code -e} flag, or a deployment manifest.
 * </p>
 *
 * <h3>Variables</h3>
 * <ul>
 * <li>{@code STRATA_PREFIX}: resource prefix (required)</li>
 * <li>{@code STRATA_PROFILES}: comma-separated profiles, in load order</li>
 * <li>{@code STRATA_VARIANTS}: comma-separated variants; the token
 * {@code base} stands for the default variant (default {@code base,local})</li>
 * <li>{@code STRATA_SCHEMA_FILES}: comma-separated schema files</li>
 * <li>{@code STRATA_OUTPUT_FORMAT}: {@code json} or {@code yaml}
 * (default {@code json})</li>
 * <li>{@code STRATA_PARALLELISM}: concurrent resource loads (default 1)</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class LauncherConfig {

    /** Variant token that maps to the base ({@code null}) variant. */
    public static final String BASE_VARIANT = "base";

    /** Output formats understood by {@link ConfigurationWriter}. */
    public enum OutputFormat {
        JSON, YAML
    }

    private final String prefix;
    private final List<String> profiles;
    private final List<String> variants;
    private final List<String> schemaFiles;
    private final OutputFormat outputFormat;
    private final int parallelism;

    private LauncherConfig(Builder b) {
        this.prefix = b.prefix;
        this.profiles = List.copyOf(b.profiles);
        this.variants = Collections.unmodifiableList(new ArrayList<>(b.variants));
        this.schemaFiles = List.copyOf(b.schemaFiles);
        this.outputFormat = b.outputFormat;
        this.parallelism = b.parallelism;
    }

    // ---------------------------------------------------------------
    // Factory, resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link LauncherConfig} from the process environment.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if a value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static LauncherConfig fromEnvironment() {
        return fromEnvironment(System::getenv);
    }

    /**
     * Build a {@link LauncherConfig} from an arbitrary variable lookup.
     *
     * @param env variable lookup; returns {@code null} for unset names
     * @return fully populated configuration
     */
    public static LauncherConfig fromEnvironment(Function<String, String> env) {
        Objects.requireNonNull(env, "Environment lookup must not be null");
        try {
            return new Builder()
                    .prefix(env(env, "STRATA_PREFIX", null))
                    .profiles(list(env(env, "STRATA_PROFILES", "")))
                    .variants(variants(list(env(env, "STRATA_VARIANTS", BASE_VARIANT + ",local"))))
                    .schemaFiles(list(env(env, "STRATA_SCHEMA_FILES", "")))
                    .outputFormat(OutputFormat.valueOf(
                            env(env, "STRATA_OUTPUT_FORMAT", "json").toUpperCase(Locale.ROOT)))
                    .parallelism(Integer.parseInt(env(env, "STRATA_PARALLELISM", "1")))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getPrefix() {
        return prefix;
    }

    public List<String> getProfiles() {
        return profiles;
    }

    /**
     * @return variants in load order; {@code null} denotes the base variant
     */
    public List<String> getVariants() {
        return variants;
    }

    public List<String> getSchemaFiles() {
        return schemaFiles;
    }

    public OutputFormat getOutputFormat() {
        return outputFormat;
    }

    public int getParallelism() {
        return parallelism;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link LauncherConfig}.
     *
     * <p>
     * The {@link #build()} method checks that the prefix is not blank and
     * that parallelism is at least 1.
     * </p>
     */
    public static class Builder {
        private String prefix;
        private List<String> profiles = new ArrayList<>();
        private List<String> variants = new ArrayList<>(Arrays.asList(null, "local"));
        private List<String> schemaFiles = new ArrayList<>();
        private OutputFormat outputFormat = OutputFormat.JSON;
        private int parallelism = 1;

        public Builder prefix(String v) {
            this.prefix = v;
            return this;
        }

        public Builder profiles(List<String> v) {
            this.profiles = new ArrayList<>(v);
            return this;
        }

        public Builder variants(List<String> v) {
            this.variants = new ArrayList<>(v);
            return this;
        }

        public Builder schemaFiles(List<String> v) {
            this.schemaFiles = new ArrayList<>(v);
            return this;
        }

        public Builder outputFormat(OutputFormat v) {
            this.outputFormat = v;
            return this;
        }

        public Builder parallelism(int v) {
            this.parallelism = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link LauncherConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public LauncherConfig build() {
            if (prefix == null || prefix.isBlank()) {
                throw new IllegalArgumentException("STRATA_PREFIX must not be null or blank");
            }
            Objects.requireNonNull(outputFormat, "outputFormat required");
            if (parallelism < 1) {
                throw new IllegalArgumentException("parallelism must be >= 1, got: " + parallelism);
            }
            return new LauncherConfig(this);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(Function<String, String> env, String name, String defaultValue) {
        String value = env.apply(name);
        return (value != null && !value.isBlank()) ? value.trim() : defaultValue;
    }

    private static List<String> list(String value) {
        List<String> result = new ArrayList<>();
        for (String item : value.split(",")) {
            if (!item.isBlank()) {
                result.add(item.trim());
            }
        }
        return result;
    }

    private static List<String> variants(List<String> tokens) {
        List<String> result = new ArrayList<>(tokens.size());
        for (String token : tokens) {
            result.add(BASE_VARIANT.equals(token) ? null : token);
        }
        return result;
    }

    @Override
    public String toString() {
        return "LauncherConfig{" +
                "prefix='" + prefix + '\'' +
                ", profiles=" + profiles +
                ", variants=" + variants +
                ", schemaFiles=" + schemaFiles +
                ", outputFormat=" + outputFormat +
                ", parallelism=" + parallelism +
                '}';
    }
}
