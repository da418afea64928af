/*
 * Copyright (c) 2025 ListAll Import Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.listall.importer.codec;

import com.listall.importer.api.exceptions.ImportException;
import com.listall.importer.api.model.ExportData;
import com.listall.importer.api.model.Item;
import com.listall.importer.api.model.ItemList;
import com.listall.importer.codec.text.ParsedItem;
import com.listall.importer.codec.text.TextHeuristicParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Reads a raw payload into a candidate entity graph, whatever its format.
 *
 * <p>Structured payloads are decoded by {@link SchemaCodec}. Free text is parsed
 * line by line and wrapped into a single list named after the caller's
 * {@code textListName}; every list and item of that graph gets a fresh id.
 */
public class ImportPayloadReader {

    private static final Logger logger = LoggerFactory.getLogger(ImportPayloadReader.class);

    private final FormatDetector formatDetector;
    private final TextHeuristicParser textParser;
    private final SchemaCodec schemaCodec;
    private final Clock clock;
    private final Supplier<UUID> idGenerator;

    public ImportPayloadReader(SchemaCodec schemaCodec, Clock clock, Supplier<UUID> idGenerator) {
        this(new FormatDetector(schemaCodec.getObjectMapper()), new TextHeuristicParser(),
                schemaCodec, clock, idGenerator);
    }

    public ImportPayloadReader(FormatDetector formatDetector,
                               TextHeuristicParser textParser,
                               SchemaCodec schemaCodec,
                               Clock clock,
                               Supplier<UUID> idGenerator) {
        this.formatDetector = formatDetector;
        this.textParser = textParser;
        this.schemaCodec = schemaCodec;
        this.clock = clock;
        this.idGenerator = idGenerator;
    }

    /**
     * Reads the payload.
     *
     * @param payload      raw bytes
     * @param textListName name of the list that receives free-text items
     * @return the candidate graph
     * @throws ImportException {@code INVALID_DATA} for empty input or text
     *                         without a single item, or any decode error
     */
    public ExportData read(byte[] payload, String textListName) {
        if (payload == null || payload.length == 0) {
            throw ImportException.invalidData();
        }

        InputFormat format = formatDetector.detect(payload);
        logger.debug("Detected {} payload of {} bytes", format, payload.length);

        return switch (format) {
            case STRUCTURED -> schemaCodec.decode(payload);
            case FREE_TEXT -> readText(new String(payload, StandardCharsets.UTF_8), textListName);
        };
    }

    private ExportData readText(String text, String textListName) {
        List<ParsedItem> parsed = textParser.parse(text);
        if (parsed.isEmpty()) {
            throw ImportException.invalidData();
        }

        Instant now = clock.instant();
        List<Item> items = new ArrayList<>(parsed.size());
        for (int i = 0; i < parsed.size(); i++) {
            ParsedItem p = parsed.get(i);
            items.add(new Item(idGenerator.get(), p.title(), null, p.quantity(), i,
                    p.isCrossedOut(), now, now, List.of()));
        }

        ItemList list = new ItemList(idGenerator.get(), textListName, 0, false, now, now, items);
        return new ExportData(ExportData.CURRENT_VERSION, now, List.of(list));
    }
}
