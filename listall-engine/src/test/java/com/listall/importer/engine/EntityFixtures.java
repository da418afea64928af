package com.listall.importer.engine;

import com.listall.importer.api.model.ExportData;
import com.listall.importer.api.model.Item;
import com.listall.importer.api.model.ItemImage;
import com.listall.importer.api.model.ItemList;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Builders for entity graphs used across engine tests.
 */
public final class EntityFixtures {

    public static final Instant CREATED = Instant.parse("2025-01-01T00:00:00Z");
    public static final Instant MODIFIED = Instant.parse("2025-02-01T00:00:00Z");

    private EntityFixtures() {
    }

    public static Item item(String title) {
        return item(UUID.randomUUID(), title, 1);
    }

    public static Item item(UUID id, String title, int quantity) {
        return new Item(id, title, null, quantity, 0, false, CREATED, CREATED, List.of());
    }

    public static ItemImage image(byte... data) {
        return new ItemImage(UUID.randomUUID(), data, 0, CREATED);
    }

    public static ItemList list(String name, Item... items) {
        return list(UUID.randomUUID(), name, items);
    }

    public static ItemList list(UUID id, String name, Item... items) {
        return new ItemList(id, name, 0, false, CREATED, CREATED, List.of(items));
    }

    public static ExportData export(ItemList... lists) {
        return new ExportData(ExportData.CURRENT_VERSION, MODIFIED, List.of(lists));
    }
}
