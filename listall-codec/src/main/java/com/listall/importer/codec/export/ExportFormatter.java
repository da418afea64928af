/*
 * Copyright (c) 2025 ListAll Import Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.listall.importer.codec.export;

import com.listall.importer.api.model.Item;
import com.listall.importer.api.model.ItemList;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import java.io.IOException;
import java.io.StringWriter;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.List;

/**
 * Renders lists as human-readable plain text or as CSV.
 *
 * <h2>Plain text</h2>
 * <pre>
 * Groceries
 * =========
 *
 * 1. [ ] Milk
 * 2. [✓] Bread (×2)
 * </pre>
 *
 * <h2>CSV</h2>
 * One row per item under the header
 * {@code List Name,Item Title,Description,Quantity,Crossed Out,Created Date}.
 */
public class ExportFormatter {

    private static final CSVFormat CSV_FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader("List Name", "Item Title", "Description", "Quantity", "Crossed Out", "Created Date")
            .setRecordSeparator('\n')
            .build();

    private static final Comparator<ItemList> LIST_ORDER = Comparator.comparingInt(ItemList::orderNumber);
    private static final Comparator<Item> ITEM_ORDER = Comparator.comparingInt(Item::orderNumber);

    public String toPlainText(List<ItemList> lists, ExportOptions options) {
        StringBuilder text = new StringBuilder();
        List<ItemList> sorted = lists.stream().sorted(LIST_ORDER).toList();
        for (int l = 0; l < sorted.size(); l++) {
            if (l > 0) {
                text.append('\n');
            }
            appendList(text, sorted.get(l), options);
        }
        return text.toString();
    }

    private void appendList(StringBuilder text, ItemList list, ExportOptions options) {
        text.append(list.name()).append('\n');
        text.append("=".repeat(list.name().length())).append('\n');
        if (options.includeDates()) {
            text.append("Created: ").append(formatDate(list.createdAt())).append('\n');
        }
        text.append('\n');

        List<Item> items = list.items().stream()
                .filter(item -> options.includeCrossedOutItems() || !item.isCrossedOut())
                .sorted(ITEM_ORDER)
                .toList();

        if (items.isEmpty()) {
            text.append("(No items)\n");
            return;
        }

        for (int i = 0; i < items.size(); i++) {
            Item item = items.get(i);
            text.append(i + 1).append(". ")
                    .append(item.isCrossedOut() ? "[✓] " : "[ ] ")
                    .append(item.title());
            if (options.includeQuantities() && item.quantity() > 1) {
                text.append(" (×").append(item.quantity()).append(')');
            }
            text.append('\n');

            if (options.includeDescriptions() && item.description() != null && !item.description().isEmpty()) {
                text.append("   ").append(item.description()).append('\n');
            }
            if (options.includeDates()) {
                text.append("   Created: ").append(formatDate(item.createdAt())).append('\n');
            }
        }
    }

    public String toCsv(List<ItemList> lists) {
        StringWriter csv = new StringWriter();
        try (CSVPrinter printer = new CSVPrinter(csv, CSV_FORMAT)) {
            for (ItemList list : lists.stream().sorted(LIST_ORDER).toList()) {
                for (Item item : list.items().stream().sorted(ITEM_ORDER).toList()) {
                    printer.printRecord(
                            list.name(),
                            item.title(),
                            item.description(),
                            item.quantity(),
                            item.isCrossedOut() ? "Yes" : "No",
                            formatDate(item.createdAt()));
                }
            }
        } catch (IOException e) {
            throw new IllegalStateException("CSV export could not be written", e);
        }
        return csv.toString();
    }

    private static String formatDate(Instant instant) {
        return instant != null ? DateTimeFormatter.ISO_INSTANT.format(instant) : "";
    }
}
