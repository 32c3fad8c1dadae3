package com.strataconf.core.parser;

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

/**
 * Parses YAML documents with SnakeYAML.
 *
 * <p>
 * Only standard YAML tags are honoured ({@link SafeConstructor}) and
 * duplicate keys are rejected. A {@link Yaml} instance is not thread-safe, so
 * one is created per call.
 * </p>
 *
 * @since 1.0.0
 */
public class YamlDocumentParser implements DocumentParser {

    @Override
    public Object parse(String text) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new SafeConstructor(options));
        return yaml.load(text);
    }
}
