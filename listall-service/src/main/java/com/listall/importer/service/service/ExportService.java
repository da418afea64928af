/*
 * Copyright (c) 2025 ListAll Import Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.listall.importer.service.service;

import com.listall.importer.api.EntityStore;
import com.listall.importer.api.model.ExportData;
import com.listall.importer.api.model.ItemList;
import com.listall.importer.codec.SchemaCodec;
import com.listall.importer.codec.export.ExportFormatter;
import com.listall.importer.codec.export.ExportOptions;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;

/**
 * Service for exporting the store's lists.
 *
 * <p>The JSON export is the same transport format the importer reads.
 */
@ApplicationScoped
public class ExportService {

    private static final Logger logger = LoggerFactory.getLogger(ExportService.class);

    @Inject
    EntityStore entityStore;

    @Inject
    SchemaCodec schemaCodec;

    @Inject
    ExportFormatter exportFormatter;

    @Inject
    Clock clock;

    public ExportService() {
    }

    public ExportService(EntityStore entityStore, SchemaCodec schemaCodec, ExportFormatter exportFormatter, Clock clock) {
        this.entityStore = entityStore;
        this.schemaCodec = schemaCodec;
        this.exportFormatter = exportFormatter;
        this.clock = clock;
    }

    /**
     * Export every list with items and images as JSON.
     */
    public byte[] exportJson() {
        ExportData data = ExportData.of(entityStore.findAllLists(), clock);
        logger.info("Exporting {} lists ({} items) as JSON", data.lists().size(), data.totalItems());
        return schemaCodec.encode(data);
    }

    public String exportPlainText() {
        return exportPlainText(ExportOptions.defaults());
    }

    public String exportPlainText(ExportOptions options) {
        List<ItemList> lists = entityStore.findAllLists();
        logger.info("Exporting {} lists as plain text", lists.size());
        return exportFormatter.toPlainText(lists, options);
    }

    public String exportCsv() {
        List<ItemList> lists = entityStore.findAllLists();
        logger.info("Exporting {} lists as CSV", lists.size());
        return exportFormatter.toCsv(lists);
    }
}
