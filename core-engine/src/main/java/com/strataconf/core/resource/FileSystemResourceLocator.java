package com.strataconf.core.resource;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Resolves names as file system paths. A path that is not a regular file
 * yields no source.
 *
 * @since 1.0.0
 */
public class FileSystemResourceLocator implements ResourceLocator {

    private final Path baseDirectory;

    /**
     * Locator resolving relative names against the working directory.
     */
    public FileSystemResourceLocator() {
        this(Path.of(""));
    }

    public FileSystemResourceLocator(Path baseDirectory) {
        this.baseDirectory = Objects.requireNonNull(baseDirectory, "Base directory must not be null");
    }

    @Override
    public List<DocumentSource> locate(String logicalName) {
        Objects.requireNonNull(logicalName, "Logical name must not be null");
        Path path = baseDirectory.resolve(logicalName);
        if (!Files.isRegularFile(path)) {
            return List.of();
        }
        return List.of(new PathSource(path));
    }

    private static final class PathSource implements DocumentSource {

        private final Path path;

        private PathSource(Path path) {
            this.path = path;
        }

        @Override
        public String identity() {
            return path.toString();
        }

        @Override
        public InputStream open() throws IOException {
            return Files.newInputStream(path);
        }
    }
}
