/*
 * Copyright (c) 2025 ListAll Import Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.listall.importer.codec.validation;

import com.listall.importer.api.model.ExportData;
import com.listall.importer.api.model.Item;
import com.listall.importer.api.model.ItemList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Pre-flight checks on a decoded entity graph.
 *
 * <p>All checks run and every failure is collected:
 * <ul>
 *   <li>{@code version} is present and supported</li>
 *   <li>{@code exportDate} is present</li>
 *   <li>list names are non-empty after trimming</li>
 *   <li>item titles are non-empty after trimming</li>
 *   <li>item quantities are at least 1</li>
 * </ul>
 */
public class ExportDataValidator {

    private static final Logger logger = LoggerFactory.getLogger(ExportDataValidator.class);

    public static final int MIN_QUANTITY = 1;

    public List<ValidationError> validate(ExportData data) {
        List<ValidationError> errors = new ArrayList<>();

        if (data.version() == null || data.version().isBlank()) {
            errors.add(new ValidationError("version", "Version is missing"));
        } else if (!ExportData.CURRENT_VERSION.equals(data.version())) {
            errors.add(new ValidationError("version", "Unsupported version: " + data.version()));
        }

        if (data.exportDate() == null) {
            errors.add(new ValidationError("exportDate", "Export date is missing"));
        }

        List<ItemList> lists = data.lists() != null ? data.lists() : List.of();
        for (int l = 0; l < lists.size(); l++) {
            validateList(lists.get(l), "lists[" + l + "]", errors);
        }

        if (!errors.isEmpty()) {
            logger.debug("Validation found {} problems", errors.size());
        }
        return errors;
    }

    private void validateList(ItemList list, String path, List<ValidationError> errors) {
        if (isBlank(list.name())) {
            errors.add(new ValidationError(path + ".name", "List name cannot be empty"));
        }

        String listLabel = isBlank(list.name()) ? path : "'" + list.name() + "'";
        List<Item> items = list.items();
        for (int i = 0; i < items.size(); i++) {
            Item item = items.get(i);
            String itemPath = path + ".items[" + i + "]";
            if (isBlank(item.title())) {
                errors.add(new ValidationError(itemPath + ".title",
                        "Item title cannot be empty in list " + listLabel));
            }
            if (item.quantity() < MIN_QUANTITY) {
                errors.add(new ValidationError(itemPath + ".quantity",
                        "Item quantity must be at least " + MIN_QUANTITY + " in list " + listLabel
                                + " (was " + item.quantity() + ")"));
            }
        }
    }

    public static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
