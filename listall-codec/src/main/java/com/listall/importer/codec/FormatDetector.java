/*
 * Copyright (c) 2025 ListAll Import Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.listall.importer.codec;

import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;

/**
 * Classifies a raw payload as structured JSON or free text.
 *
 * <p>A payload is {@link InputFormat#STRUCTURED} when it parses as a JSON object
 * with a {@code version} key. A payload that merely looks like a JSON object
 * (first non-blank character is <code>{</code>) is also routed to the schema
 * decoder, so a broken export is reported with its decode error instead of
 * being imported line by line as text.
 */
public class FormatDetector {

    private static final Logger logger = LoggerFactory.getLogger(FormatDetector.class);

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private final ObjectMapper objectMapper;

    public FormatDetector() {
        this(new ObjectMapper());
    }

    public FormatDetector(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Detects the payload format. Never throws.
     *
     * @param payload raw bytes, may be null or empty
     * @return the detected format
     */
    public InputFormat detect(byte[] payload) {
        if (payload == null || payload.length == 0) {
            return InputFormat.FREE_TEXT;
        }

        String text = new String(payload, StandardCharsets.UTF_8);
        if (!text.isEmpty() && text.charAt(0) == BYTE_ORDER_MARK) {
            text = text.substring(1);
        }
        String leading = text.stripLeading();
        if (leading.isEmpty()) {
            return InputFormat.FREE_TEXT;
        }

        if (hasVersionKey(text)) {
            return InputFormat.STRUCTURED;
        }
        return leading.charAt(0) == '{' ? InputFormat.STRUCTURED : InputFormat.FREE_TEXT;
    }

    private boolean hasVersionKey(String text) {
        try {
            JsonNode node = objectMapper.readTree(text);
            return node != null && node.isObject() && node.has("version");
        } catch (JacksonException e) {
            logger.debug("Payload is not a JSON document: {}", e.getOriginalMessage());
            return false;
        }
    }
}
