package com.strataconf.core.parser;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.UncheckedIOException;

/**
 * Parses JSON documents with Jackson into plain maps, lists and scalars.
 * A file holds exactly one value; trailing content is rejected.
 *
 * @since 1.0.0
 */
public class JsonDocumentParser implements DocumentParser {

    private final ObjectMapper mapper;

    public JsonDocumentParser() {
        this.mapper = new ObjectMapper();
        mapper.configure(JsonParser.Feature.STRICT_DUPLICATE_DETECTION, true);
        mapper.configure(JsonParser.Feature.ALLOW_COMMENTS, true);
        // one document per file; anything after the first value is an error
        mapper.configure(DeserializationFeature.FAIL_ON_TRAILING_TOKENS, true);
    }

    @Override
    public Object parse(String text) {
        if (text.isBlank()) {
            return null;
        }
        try {
            return mapper.readValue(text, Object.class);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
}
