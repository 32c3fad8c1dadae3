package com.strataconf.launcher;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

import java.io.UncheckedIOException;
import java.util.Map;
import java.util.Objects;

/**
 * Renders an assembled configuration as JSON (Jackson) or YAML (SnakeYAML).
 *
 * @since 1.0.0
 */
public class ConfigurationWriter {

    private final LauncherConfig.OutputFormat format;
    private final ObjectMapper mapper;

    public ConfigurationWriter(LauncherConfig.OutputFormat format) {
        this.format = Objects.requireNonNull(format, "Output format must not be null");
        this.mapper = new ObjectMapper();
        mapper.configure(SerializationFeature.INDENT_OUTPUT, true);
    }

    /**
     * @param configuration configuration tree
     * @return rendered text, ending with a newline
     */
    public String write(Map<String, Object> configuration) {
        Objects.requireNonNull(configuration, "Configuration must not be null");
        if (format == LauncherConfig.OutputFormat.YAML) {
            DumperOptions options = new DumperOptions();
            options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
            options.setPrettyFlow(true);
            return new Yaml(options).dump(configuration);
        }
        try {
            return mapper.writeValueAsString(configuration) + System.lineSeparator();
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to render configuration as JSON", e);
        }
    }
}
