package com.strataconf.core.resource;

import com.strataconf.core.error.ConfigurationException;
import com.strataconf.core.error.ConfigurationReadException;
import com.strataconf.core.error.DocumentParseException;
import com.strataconf.core.model.ParsedDocument;
import com.strataconf.core.model.ResourceCoordinate;
import com.strataconf.core.parser.DocumentParser;
import com.strataconf.core.parser.DocumentParsers;
import com.strataconf.core.property.PropertyExpander;
import com.strataconf.core.property.PropertyResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Reads, expands and parses configuration documents.
 *
 * <h3>Sources</h3>
 * <ul>
 * <li>{@link #load(String, DocumentParser)} resolves a logical name through
 * the configured {@link ResourceLocator}; a name with no match yields no
 * documents</li>
 * <li>{@link #loadFile(String, Map)} reads an explicit file, choosing the
 * parser from its extension; a missing file is skipped with a warning</li>
 * </ul>
 *
 * <h3>Failure</h3>
 * <p>
 * Any read or parse failure is fatal. A document whose top level is not a
 * mapping is a parse failure; an empty document is ignored.
 * </p>
 *
 * @since 1.0.0
 */
public final class DocumentLoader {

    private static final Logger LOG = LoggerFactory.getLogger(DocumentLoader.class);

    private final PropertyResolver resolver;
    private final ResourceLocator locator;

    public DocumentLoader(PropertyResolver resolver, ResourceLocator locator) {
        this.resolver = Objects.requireNonNull(resolver, "Property resolver must not be null");
        this.locator = Objects.requireNonNull(locator, "Resource locator must not be null");
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Load every document matching a logical name.
     *
     * @param logicalName resource name; must not be {@code null}
     * @param parser      parser for the documents; must not be {@code null}
     * @return parsed documents, in locator order; empty if none exist
     * @throws ConfigurationReadException if a source cannot be read
     * @throws DocumentParseException     if a source cannot be parsed
     */
    public List<ParsedDocument> load(String logicalName, DocumentParser parser) {
        Objects.requireNonNull(logicalName, "Logical name must not be null");
        Objects.requireNonNull(parser, "Parser must not be null");

        List<DocumentSource> sources;
        try {
            sources = locator.locate(logicalName);
        } catch (IOException e) {
            throw new ConfigurationReadException(logicalName, e);
        }

        List<ParsedDocument> documents = new ArrayList<>(sources.size());
        for (DocumentSource source : sources) {
            read(logicalName, source, parser).ifPresent(documents::add);
        }
        return documents;
    }

    /**
     * Load the documents of every coordinate, in coordinate order.
     *
     * <p>
     * With {@code parallelism > 1}, sources are fetched and parsed on a
     * bounded pool. The result is still in coordinate order.
     * </p>
     *
     * @param coordinates coordinates from {@link ResourceEnumerator}
     * @param parsers     extension table
     * @param parallelism maximum number of concurrent loads, at least 1
     * @return unmodifiable list of documents
     */
    public List<ParsedDocument> loadAll(List<ResourceCoordinate> coordinates,
            Map<String, DocumentParser> parsers,
            int parallelism) {
        Objects.requireNonNull(coordinates, "Coordinates must not be null");
        Objects.requireNonNull(parsers, "Parser table must not be null");
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be >= 1, got: " + parallelism);
        }

        if (parallelism == 1 || coordinates.size() < 2) {
            List<ParsedDocument> documents = new ArrayList<>();
            for (ResourceCoordinate coordinate : coordinates) {
                documents.addAll(load(coordinate.getLogicalName(), parserFor(coordinate, parsers)));
            }
            return Collections.unmodifiableList(documents);
        }
        return loadInParallel(coordinates, parsers, parallelism);
    }

    /**
     * Load an explicit file.
     *
     * @param path    file path; must not be {@code null}
     * @param parsers extension table used to pick the parser
     * @return the document, or empty if the file does not exist or is empty
     * @throws com.strataconf.core.error.UnsupportedFormatException if the
     *                                                              extension
     *                                                              is unknown
     */
    public Optional<ParsedDocument> loadFile(String path, Map<String, DocumentParser> parsers) {
        Objects.requireNonNull(path, "File path must not be null");
        DocumentParser parser = DocumentParsers.forPath(path, parsers);

        if (!Files.isRegularFile(Path.of(path))) {
            LOG.warn("Configuration file {} does not exist; skipping", path);
            return Optional.empty();
        }
        List<DocumentSource> sources = new FileSystemResourceLocator().locate(path);
        return sources.isEmpty() ? Optional.empty() : read(path, sources.get(0), parser);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private List<ParsedDocument> loadInParallel(List<ResourceCoordinate> coordinates,
            Map<String, DocumentParser> parsers,
            int parallelism) {
        ExecutorService executor = Executors.newFixedThreadPool(
                Math.min(parallelism, coordinates.size()), runnable -> {
                    Thread thread = new Thread(runnable, "config-loader");
                    thread.setDaemon(true);
                    return thread;
                });
        try {
            List<Future<List<ParsedDocument>>> futures = new ArrayList<>(coordinates.size());
            for (ResourceCoordinate coordinate : coordinates) {
                DocumentParser parser = parserFor(coordinate, parsers);
                futures.add(executor.submit(() -> load(coordinate.getLogicalName(), parser)));
            }

            // Collect in submission order, not completion order
            List<ParsedDocument> documents = new ArrayList<>();
            for (Future<List<ParsedDocument>> future : futures) {
                documents.addAll(future.get());
            }
            return Collections.unmodifiableList(documents);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ConfigurationException configurationException) {
                throw configurationException;
            }
            throw new ConfigurationException("Failed to load configuration documents", cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConfigurationException("Interrupted while loading configuration documents", e);
        } finally {
            executor.shutdownNow();
        }
    }

    private static DocumentParser parserFor(ResourceCoordinate coordinate, Map<String, DocumentParser> parsers) {
        return Objects.requireNonNull(parsers.get(coordinate.getExtension()),
                () -> "No parser registered for extension " + coordinate.getExtension());
    }

    private Optional<ParsedDocument> read(String logicalName, DocumentSource source, DocumentParser parser) {
        String identity = source.identity();
        LOG.debug("Reading configuration from `{}'", identity);

        String raw;
        try (InputStream in = source.open()) {
            raw = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigurationReadException(identity, e);
        }

        String expanded = PropertyExpander.expand(raw, resolver);

        Object parsed;
        try {
            parsed = parser.parse(expanded);
        } catch (RuntimeException e) {
            throw new DocumentParseException(logicalName, identity, e);
        }

        if (parsed == null) {
            LOG.debug("Configuration `{}' is empty", identity);
            return Optional.empty();
        }
        if (!(parsed instanceof Map<?, ?> content)) {
            throw new DocumentParseException(logicalName, identity,
                    "top level must be a mapping, got " + parsed.getClass().getSimpleName());
        }
        return Optional.of(new ParsedDocument(identity, content));
    }
}
