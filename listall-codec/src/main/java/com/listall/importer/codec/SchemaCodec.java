/*
 * Copyright (c) 2025 ListAll Import Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.listall.importer.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.exc.StreamReadException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.listall.importer.api.exceptions.ImportException;
import com.listall.importer.api.model.ExportData;
import com.listall.importer.api.model.Item;
import com.listall.importer.api.model.ItemImage;
import com.listall.importer.api.model.ItemList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Decodes and encodes the JSON transport format ({@link ExportData}).
 *
 * <p>Decoding is strict about shape: required fields must be present and
 * non-null, scalars are not coerced (a quoted number is not an int, a number is
 * not a UUID), dates are ISO-8601 and image payloads base64. Unknown properties
 * are ignored. Failures are reported as:
 * <ul>
 *   <li>{@code INVALID_DATA} - empty payload</li>
 *   <li>{@code INVALID_FORMAT} - not well-formed JSON</li>
 *   <li>{@code DECODING_FAILED} - well-formed JSON that does not fit the schema,
 *       with the JSON path of the offending field in the reason</li>
 * </ul>
 */
public class SchemaCodec {

    private static final Logger logger = LoggerFactory.getLogger(SchemaCodec.class);

    private final ObjectMapper objectMapper;

    public SchemaCodec() {
        this(createObjectMapper());
    }

    public SchemaCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Builds the mapper used for the transport format.
     */
    public static ObjectMapper createObjectMapper() {
        return JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(MapperFeature.ALLOW_COERCION_OF_SCALARS)
                .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT)
                .build();
    }

    /**
     * Decodes a JSON payload.
     *
     * @param payload raw JSON bytes
     * @return the decoded export data, every required field present
     * @throws ImportException if the payload is empty, malformed or off-schema
     */
    public ExportData decode(byte[] payload) {
        if (payload == null || new String(payload, StandardCharsets.UTF_8).isBlank()) {
            throw ImportException.invalidData();
        }

        ExportData data;
        try {
            data = objectMapper.readValue(payload, ExportData.class);
        } catch (StreamReadException e) {
            logger.debug("Payload is not well-formed JSON: {}", e.getOriginalMessage());
            throw ImportException.invalidFormat(e);
        } catch (JsonMappingException e) {
            if (e.getCause() instanceof StreamReadException syntax) {
                // syntax error raised while a property was being bound
                logger.debug("Payload is not well-formed JSON: {}", syntax.getOriginalMessage());
                throw ImportException.invalidFormat(syntax);
            }
            String reason = describe(e);
            logger.debug("Payload does not match the export schema: {}", reason);
            throw ImportException.decodingFailed(reason, e);
        } catch (IOException e) {
            throw ImportException.invalidFormat(e);
        }

        if (data == null) {
            throw ImportException.decodingFailed("Expected a JSON object but found null");
        }
        checkRequired(data);
        return data;
    }

    /**
     * Encodes export data as JSON. Cannot fail for a graph built from the
     * domain records.
     *
     * @param data the data to encode
     * @return UTF-8 JSON bytes
     */
    public byte[] encode(ExportData data) {
        try {
            return objectMapper.writeValueAsBytes(data);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Export data could not be serialized", e);
        }
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    private void checkRequired(ExportData data) {
        require(data.version(), "version");
        require(data.exportDate(), "exportDate");
        require(data.lists(), "lists");

        List<ItemList> lists = data.lists();
        for (int l = 0; l < lists.size(); l++) {
            ItemList list = lists.get(l);
            String listPath = "lists[" + l + "]";
            require(list, listPath);
            require(list.id(), listPath + ".id");
            require(list.name(), listPath + ".name");
            require(list.createdAt(), listPath + ".createdAt");
            require(list.modifiedAt(), listPath + ".modifiedAt");

            for (int i = 0; i < list.items().size(); i++) {
                Item item = list.items().get(i);
                String itemPath = listPath + ".items[" + i + "]";
                require(item, itemPath);
                require(item.id(), itemPath + ".id");
                require(item.title(), itemPath + ".title");
                require(item.createdAt(), itemPath + ".createdAt");
                require(item.modifiedAt(), itemPath + ".modifiedAt");

                for (int g = 0; g < item.images().size(); g++) {
                    ItemImage image = item.images().get(g);
                    String imagePath = itemPath + ".images[" + g + "]";
                    require(image, imagePath);
                    require(image.id(), imagePath + ".id");
                    require(image.imageData(), imagePath + ".imageData");
                    require(image.createdAt(), imagePath + ".createdAt");
                }
            }
        }
    }

    private static void require(Object value, String path) {
        if (value == null) {
            throw ImportException.decodingFailed("Missing value for '" + path + "'");
        }
    }

    private static String describe(JsonMappingException e) {
        String path = e.getPath().stream()
                .map(ref -> ref.getFieldName() != null ? "." + ref.getFieldName() : "[" + ref.getIndex() + "]")
                .collect(Collectors.joining());
        if (path.startsWith(".")) {
            path = path.substring(1);
        }
        String message = e.getOriginalMessage();
        return path.isEmpty() ? message : path + ": " + message;
    }
}
