package com.strataconf.core.assembly;

import com.strataconf.core.cli.ArgumentParser;
import com.strataconf.core.cli.ParsedArguments;
import com.strataconf.core.error.ConfigurationInvalidException;
import com.strataconf.core.merge.DeepMerger;
import com.strataconf.core.merge.Trees;
import com.strataconf.core.model.ParsedDocument;
import com.strataconf.core.model.ResourceCoordinate;
import com.strataconf.core.property.EnvironmentSnapshot;
import com.strataconf.core.property.PropertyResolver;
import com.strataconf.core.resource.DocumentLoader;
import com.strataconf.core.resource.ResourceEnumerator;
import com.strataconf.core.schema.CoercionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reads, merges, validates and coerces a configuration.
 *
 * <h3>Precedence</h3>
 * <p>
 * Layers are deep-merged in this order, later layers winning:
 * </p>
 * <ol>
 * <li>bundled resources, by profile, then variant, then extension (the
 * global profile last)</li>
 * <li>{@link AssemblyOptions#getAdditionalFiles() additional files}, in list
 * order</li>
 * <li>files named by {@code --load} arguments, in encounter order</li>
 * <li>{@link AssemblyOptions#getOverrides() explicit overrides}</li>
 * <li>{@code path=value} arguments</li>
 * </ol>
 *
 * <h3>Expansion</h3>
 * <p>
 * Every document is scanned for {@code ${NAME}} and {@code ${NAME:default}}
 * references before it is parsed. Names resolve against explicit properties,
 * then JVM system properties, then environment variables.
 * </p>
 *
 * <h3>Failure</h3>
 * <p>
 * Assembly is all-or-nothing. Any failure is raised as a
 * {@link com.strataconf.core.error.ConfigurationException}; no partial
 * configuration is ever returned.
 * </p>
 *
 * @since 1.0.0
 */
public final class ConfigurationAssembler {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigurationAssembler.class);

    private ConfigurationAssembler() {
        // utility class
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Assemble the configuration described by {@code options}.
     *
     * @param options assembly options; must not be {@code null}
     * @return unmodifiable, coerced configuration
     * @throws ConfigurationInvalidException if the merged configuration does
     *                                       not satisfy the merged schema
     * @throws com.strataconf.core.error.ConfigurationException on any other
     *                                       failure
     */
    public static Map<String, Object> assemble(AssemblyOptions options) {
        Objects.requireNonNull(options, "Assembly options must not be null");

        Map<String, Object> merged = mergeLayers(options);
        Map<String, Object> schema = DeepMerger.mergeAll(options.getSchemas());

        CoercionResult result = options.getCoercer().coerce(merged, schema);
        if (!result.isSuccess()) {
            throw new ConfigurationInvalidException(schema, merged, result.getErrors());
        }

        LOG.info("Assembled configuration `{}' with {} top-level key(s)",
                options.getPrefix(), result.getValue().size());
        return Trees.freeze(result.getValue());
    }

    /**
     * Read and merge every layer without validating or coercing.
     *
     * @param options assembly options; must not be {@code null}
     * @return unmodifiable merged configuration; values from
     *         {@code path=value} arguments are still strings
     */
    public static Map<String, Object> mergeLayers(AssemblyOptions options) {
        Objects.requireNonNull(options, "Assembly options must not be null");
        LOG.info("Reading configuration: {}", options);

        // Parse arguments first so a bad token fails before any I/O
        ParsedArguments arguments = ArgumentParser.parse(options.getArgs());

        PropertyResolver resolver = new PropertyResolver(environment(options));
        DocumentLoader loader = new DocumentLoader(resolver, options.getResourceLocator());

        List<ResourceCoordinate> coordinates = ResourceEnumerator.enumerate(
                options.getPrefix(),
                options.getProfiles(),
                options.getVariants(),
                options.getExtensions().keySet(),
                options.getResourcePathTemplate());

        List<ParsedDocument> documents = new ArrayList<>(
                loader.loadAll(coordinates, options.getExtensions(), options.getParallelism()));
        LOG.info("Loaded {} configuration resource(s) from {} candidate name(s)",
                documents.size(), coordinates.size());

        for (String path : options.getAdditionalFiles()) {
            loader.loadFile(path, options.getExtensions()).ifPresent(documents::add);
        }
        for (String path : arguments.getAdditionalFiles()) {
            loader.loadFile(path, options.getExtensions()).ifPresent(documents::add);
        }

        List<Map<String, ?>> layers = new ArrayList<>(documents.size() + 2);
        for (ParsedDocument document : documents) {
            layers.add(document.getContent());
        }
        layers.add(options.getOverrides());
        layers.add(arguments.getOverrides());

        return Trees.freeze(DeepMerger.mergeAll(layers));
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static EnvironmentSnapshot environment(AssemblyOptions options) {
        return options.getEnvironment()
                .map(snapshot -> EnvironmentSnapshot.of(snapshot.asMap(), null, options.getProperties()))
                .orElseGet(() -> EnvironmentSnapshot.capture(options.getProperties()));
    }
}
