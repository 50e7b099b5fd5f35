package com.astwriter.core.json;

import com.astwriter.core.writer.SourceMap;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Serializes a {@link SourceMap} as a JSON array in {@link SourceMap#entries()} order.
 *
 * <pre>{@code
 * [ {
 *   "id" : 3,
 *   "nodeType" : "BinaryOperation",
 *   "src" : "0:9",
 *   "offset" : 0,
 *   "length" : 9
 * } ]
 * }</pre>
 */
public class SourceMapJsonWriter {

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * Builds the JSON tree of {@code sourceMap}.
     *
     * @param sourceMap map to serialize
     * @return JSON array
     */
    public ArrayNode toTree(SourceMap sourceMap) {
        ArrayNode array = JSON_MAPPER.createArrayNode();
        for (SourceMap.Entry entry : sourceMap.entries()) {
            ObjectNode element = array.addObject();
            element.put("id", entry.node().id());
            element.put("nodeType", entry.node().nodeType());
            element.put("src", entry.range().toSrc());
            element.put("offset", entry.range().offset());
            element.put("length", entry.range().length());
        }
        return array;
    }

    /**
     * Serializes {@code sourceMap} to pretty-printed JSON.
     *
     * @param sourceMap map to serialize
     * @return JSON text
     */
    public String toJson(SourceMap sourceMap) {
        try {
            return JSON_MAPPER.writeValueAsString(toTree(sourceMap));
        } catch (JsonProcessingException e) {
            // Tree nodes built above always serialize
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Writes {@code sourceMap} to {@code path} as UTF-8 JSON.
     *
     * @param sourceMap map to serialize
     * @param path target file
     * @throws IOException if the file cannot be written
     */
    public void write(SourceMap sourceMap, Path path) throws IOException {
        Files.writeString(path, toJson(sourceMap), StandardCharsets.UTF_8);
    }
}
