package com.strataconf.launcher;

import com.strataconf.core.assembly.AssemblyOptions;
import com.strataconf.core.assembly.ConfigurationAssembler;
import com.strataconf.core.error.ConfigurationException;
import com.strataconf.core.error.ConfigurationInvalidException;
import com.strataconf.core.error.ConfigurationReadException;
import com.strataconf.core.error.DocumentParseException;
import com.strataconf.core.merge.Trees;
import com.strataconf.core.model.FieldError;
import com.strataconf.core.parser.DocumentParser;
import com.strataconf.core.parser.DocumentParsers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Command-line entry point: assembles a configuration and prints it.
 *
 * <h3>Usage</h3>
 *
 * <pre>
 *   STRATA_PREFIX=myapp STRATA_PROFILES=web,db \
 *     java -jar launcher.jar --load /etc/myapp/prod.yaml web/port=8443
 * </pre>
 *
 * <p>
 * Arguments are {@code --load <path>} and {@code path=value} overrides.
 * Settings come from environment variables via {@link LauncherConfig}. The
 * configuration is written to standard output; on failure the diagnostics
 * are logged and the process exits with status 1.
 * </p>
 *
 * @since 1.0.0
 */
public final class StrataLauncher {

    private static final Logger LOG = LoggerFactory.getLogger(StrataLauncher.class);

    private StrataLauncher() {
        // entry-point class, not instantiable
    }

    public static void main(String[] args) {
        int status = launch(System::getenv, Arrays.asList(args), System.out);
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * Resolve launcher settings from {@code env}, then {@link #run} with them.
     *
     * @param env  variable lookup; returns {@code null} for unset names
     * @param args command-line tokens
     * @param out  destination for the rendered configuration
     * @return process exit status: 0 on success, 1 on failure
     */
    static int launch(Function<String, String> env, List<String> args, PrintStream out) {
        // 1. Load launcher settings
        LauncherConfig config;
        try {
            config = LauncherConfig.fromEnvironment(env);
        } catch (IllegalArgumentException | IllegalStateException e) {
            LOG.error("Invalid launcher settings: {}", e.getMessage());
            return 1;
        }
        LOG.info("Starting configuration launcher with {}", config);

        // 2. Assemble and print
        return run(config, args, out);
    }

    /**
     * Assemble the configuration and write it to {@code out}.
     *
     * @param config launcher settings
     * @param args   command-line tokens
     * @param out    destination for the rendered configuration
     * @return process exit status: 0 on success, 1 on failure
     */
    static int run(LauncherConfig config, List<String> args, PrintStream out) {
        try {
            Map<String, Object> configuration = ConfigurationAssembler.assemble(buildOptions(config, args));
            out.print(new ConfigurationWriter(config.getOutputFormat()).write(configuration));
            out.flush();
            return 0;
        } catch (ConfigurationInvalidException e) {
            LOG.error("The configuration is not valid ({} error(s))", e.getErrors().size());
            for (FieldError error : e.getErrors()) {
                LOG.error("  {}", error);
            }
            return 1;
        } catch (ConfigurationException e) {
            LOG.error("Unable to assemble configuration: {}", e.getMessage(), e);
            return 1;
        }
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    static AssemblyOptions buildOptions(LauncherConfig config, List<String> args) {
        return AssemblyOptions.builder(config.getPrefix())
                .profiles(config.getProfiles())
                .variants(config.getVariants())
                .schemas(loadSchemas(config.getSchemaFiles()))
                .parallelism(config.getParallelism())
                .args(args)
                .build();
    }

    private static List<Map<String, Object>> loadSchemas(List<String> schemaFiles) {
        Map<String, DocumentParser> parsers = DocumentParsers.defaults();
        List<Map<String, Object>> schemas = new ArrayList<>(schemaFiles.size());
        for (String file : schemaFiles) {
            DocumentParser parser = DocumentParsers.forPath(file, parsers);
            String text;
            try {
                text = Files.readString(Path.of(file), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new ConfigurationReadException(file, e);
            }

            Object parsed;
            try {
                parsed = parser.parse(text);
            } catch (RuntimeException e) {
                throw new DocumentParseException(file, file, e);
            }
            if (!(parsed instanceof Map<?, ?> schema)) {
                throw new DocumentParseException(file, file, "a schema must be a mapping");
            }
            LOG.debug("Loaded schema fragment from {}", file);
            schemas.add(Trees.copyMap(schema));
        }
        return schemas;
    }
}
