package com.strataconf.core.assembly;

import com.strataconf.core.parser.DocumentParser;
import com.strataconf.core.parser.DocumentParsers;
import com.strataconf.core.property.EnvironmentSnapshot;
import com.strataconf.core.resource.ClasspathResourceLocator;
import com.strataconf.core.resource.ResourceLocator;
import com.strataconf.core.resource.ResourcePathTemplate;
import com.strataconf.core.schema.ConfigurationCoercer;
import com.strataconf.core.schema.JsonSchemaCoercer;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable description of one configuration assembly.
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #builder(String)}. Every option except the prefix has a
 * default; {@link Builder#build()} validates the inputs.
 * </p>
 *
 * <h3>Defaults</h3>
 * <ul>
 * <li>profiles: none (the global profile is always loaded)</li>
 * <li>variants: {@link #DEFAULT_VARIANTS}</li>
 * <li>extensions: {@link DocumentParsers#defaults()}</li>
 * <li>resource path template: {@link ResourcePathTemplate#defaultTemplate()}</li>
 * <li>resource locator: {@link ClasspathResourceLocator}</li>
 * <li>coercer: {@link JsonSchemaCoercer}</li>
 * <li>parallelism: 1</li>
 * <li>environment: captured from the process when assembly starts</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class AssemblyOptions {

    /**
     * The default variants, in order: the base variant ({@code null}), then
     * {@code "local"} for developer or deployment-specific overrides.
     */
    public static final List<String> DEFAULT_VARIANTS = Collections.unmodifiableList(Arrays.asList(null, "local"));

    private final String prefix;
    private final List<Map<String, Object>> schemas;
    private final Map<String, Object> overrides;
    private final List<String> profiles;
    private final List<String> variants;
    private final ResourcePathTemplate resourcePathTemplate;
    private final Map<String, DocumentParser> extensions;
    private final List<String> additionalFiles;
    private final List<String> args;
    private final Map<String, Object> properties;
    private final ResourceLocator resourceLocator;
    private final ConfigurationCoercer coercer;
    private final int parallelism;
    private final EnvironmentSnapshot environment;

    private AssemblyOptions(Builder b) {
        this.prefix = b.prefix;
        this.schemas = Collections.unmodifiableList(new ArrayList<>(b.schemas));
        this.overrides = Collections.unmodifiableMap(new LinkedHashMap<>(b.overrides));
        this.profiles = Collections.unmodifiableList(new ArrayList<>(b.profiles));
        this.variants = Collections.unmodifiableList(new ArrayList<>(b.variants));
        this.resourcePathTemplate = b.resourcePathTemplate;
        this.extensions = Collections.unmodifiableMap(new LinkedHashMap<>(b.extensions));
        this.additionalFiles = List.copyOf(b.additionalFiles);
        this.args = List.copyOf(b.args);
        this.properties = Collections.unmodifiableMap(new LinkedHashMap<>(b.properties));
        this.resourceLocator = b.resourceLocator;
        this.coercer = b.coercer;
        this.parallelism = b.parallelism;
        this.environment = b.environment;
    }

    public static Builder builder(String prefix) {
        return new Builder().prefix(prefix);
    }

    /**
     * @return a builder pre-populated with this instance's options
     */
    public Builder toBuilder() {
        Builder b = new Builder()
                .prefix(prefix)
                .schemas(schemas)
                .overrides(overrides)
                .profiles(profiles)
                .variants(variants)
                .resourcePathTemplate(resourcePathTemplate)
                .extensions(extensions)
                .additionalFiles(additionalFiles)
                .args(args)
                .properties(properties)
                .resourceLocator(resourceLocator)
                .coercer(coercer)
                .parallelism(parallelism);
        b.environment = environment;
        return b;
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getPrefix() {
        return prefix;
    }

    public List<Map<String, Object>> getSchemas() {
        return schemas;
    }

    public Map<String, Object> getOverrides() {
        return overrides;
    }

    public List<String> getProfiles() {
        return profiles;
    }

    public List<String> getVariants() {
        return variants;
    }

    public ResourcePathTemplate getResourcePathTemplate() {
        return resourcePathTemplate;
    }

    public Map<String, DocumentParser> getExtensions() {
        return extensions;
    }

    public List<String> getAdditionalFiles() {
        return additionalFiles;
    }

    public List<String> getArgs() {
        return args;
    }

    public Map<String, Object> getProperties() {
        return properties;
    }

    public ResourceLocator getResourceLocator() {
        return resourceLocator;
    }

    public ConfigurationCoercer getCoercer() {
        return coercer;
    }

    public int getParallelism() {
        return parallelism;
    }

    /**
     * @return an explicitly supplied environment, if any; otherwise the
     *         assembler captures one from the process
     */
    public Optional<EnvironmentSnapshot> getEnvironment() {
        return Optional.ofNullable(environment);
    }

    @Override
    public String toString() {
        return "AssemblyOptions{" +
                "prefix='" + prefix + '\'' +
                ", profiles=" + profiles +
                ", variants=" + variants +
                ", extensions=" + extensions.keySet() +
                ", schemas=" + schemas.size() +
                ", additionalFiles=" + additionalFiles +
                ", args=" + args.size() +
                ", parallelism=" + parallelism +
                '}';
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link AssemblyOptions}.
     *
     * <p>
     * {@link #build()} checks that the prefix is not blank, that there is at
     * least one extension, and that parallelism is at least 1.
     * </p>
     */
    public static class Builder {
        private String prefix;
        private List<Map<String, Object>> schemas = new ArrayList<>();
        private Map<String, Object> overrides = new LinkedHashMap<>();
        private List<String> profiles = new ArrayList<>();
        private List<String> variants = new ArrayList<>(DEFAULT_VARIANTS);
        private ResourcePathTemplate resourcePathTemplate = ResourcePathTemplate.defaultTemplate();
        private Map<String, DocumentParser> extensions = DocumentParsers.defaults();
        private List<String> additionalFiles = new ArrayList<>();
        private List<String> args = new ArrayList<>();
        private Map<String, Object> properties = new LinkedHashMap<>();
        private ResourceLocator resourceLocator;
        private ConfigurationCoercer coercer;
        private int parallelism = 1;
        private EnvironmentSnapshot environment;

        public Builder prefix(String v) {
            this.prefix = v;
            return this;
        }

        public Builder schemas(List<? extends Map<String, Object>> v) {
            this.schemas = new ArrayList<>(Objects.requireNonNull(v, "schemas"));
            return this;
        }

        public Builder schema(Map<String, Object> v) {
            this.schemas.add(Objects.requireNonNull(v, "schema"));
            return this;
        }

        public Builder overrides(Map<String, ?> v) {
            this.overrides = new LinkedHashMap<>(Objects.requireNonNull(v, "overrides"));
            return this;
        }

        public Builder profiles(List<String> v) {
            this.profiles = new ArrayList<>(Objects.requireNonNull(v, "profiles"));
            return this;
        }

        public Builder profiles(String... v) {
            return profiles(Arrays.asList(v));
        }

        public Builder variants(List<String> v) {
            this.variants = new ArrayList<>(Objects.requireNonNull(v, "variants"));
            return this;
        }

        public Builder variants(String... v) {
            return variants(Arrays.asList(v));
        }

        public Builder resourcePathTemplate(ResourcePathTemplate v) {
            this.resourcePathTemplate = v;
            return this;
        }

        public Builder extensions(Map<String, DocumentParser> v) {
            this.extensions = new LinkedHashMap<>(Objects.requireNonNull(v, "extensions"));
            return this;
        }

        /**
         * Register (or replace) the parser for one extension.
         */
        public Builder extension(String extension, DocumentParser parser) {
            Map<String, DocumentParser> copy = new LinkedHashMap<>(extensions);
            copy.put(Objects.requireNonNull(extension, "extension"), Objects.requireNonNull(parser, "parser"));
            this.extensions = copy;
            return this;
        }

        public Builder additionalFiles(List<String> v) {
            this.additionalFiles = new ArrayList<>(Objects.requireNonNull(v, "additionalFiles"));
            return this;
        }

        public Builder args(List<String> v) {
            this.args = new ArrayList<>(Objects.requireNonNull(v, "args"));
            return this;
        }

        public Builder args(String... v) {
            return args(Arrays.asList(v));
        }

        public Builder properties(Map<?, ?> v) {
            Objects.requireNonNull(v, "properties");
            Map<String, Object> copy = new LinkedHashMap<>();
            v.forEach((key, value) -> copy.put(String.valueOf(key), value));
            this.properties = copy;
            return this;
        }

        public Builder resourceLocator(ResourceLocator v) {
            this.resourceLocator = v;
            return this;
        }

        public Builder coercer(ConfigurationCoercer v) {
            this.coercer = v;
            return this;
        }

        public Builder parallelism(int v) {
            this.parallelism = v;
            return this;
        }

        /**
         * Use a fixed environment instead of capturing the process one.
         * Explicit {@link #properties(Map)} are still layered on top.
         */
        public Builder environment(EnvironmentSnapshot v) {
            this.environment = v;
            return this;
        }

        /**
         * Build and validate the options.
         *
         * @return validated {@link AssemblyOptions}
         * @throws IllegalArgumentException if any value is invalid
         */
        public AssemblyOptions build() {
            if (prefix == null || prefix.isBlank()) {
                throw new IllegalArgumentException("prefix must not be null or blank");
            }
            if (extensions.isEmpty()) {
                throw new IllegalArgumentException("at least one extension must be registered");
            }
            if (parallelism < 1) {
                throw new IllegalArgumentException("parallelism must be >= 1, got: " + parallelism);
            }
            if (resourcePathTemplate == null) {
                resourcePathTemplate = ResourcePathTemplate.defaultTemplate();
            }
            if (resourceLocator == null) {
                resourceLocator = new ClasspathResourceLocator();
            }
            if (coercer == null) {
                coercer = new JsonSchemaCoercer();
            }
            return new AssemblyOptions(this);
        }
    }
}
