/*
 * Copyright (c) 2025 ListAll Import Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.listall.importer.api;

import com.listall.importer.api.model.Item;
import com.listall.importer.api.model.ItemList;

import java.util.List;
import java.util.UUID;
import java.util.function.Function;

/**
 * Repository holding the authoritative lists, items and images.
 *
 * <p>The importer only reads a full snapshot and writes through the create,
 * update and delete operations below. Implementations may be backed by:
 * <ul>
 *   <li>In-memory maps (development, tests)</li>
 *   <li>A JDBC database (H2, PostgreSQL)</li>
 * </ul>
 *
 * <p><b>Thread Safety:</b> Implementations must be thread-safe.
 *
 * <p>Failures are reported as
 * {@link com.listall.importer.api.exceptions.EntityStoreException}.
 */
public interface EntityStore {

    /**
     * Get every list with its items and their images.
     *
     * @return lists in the store's stable encounter order
     */
    List<ItemList> findAllLists();

    /**
     * Insert a list. Only the list's own fields are written; items are
     * created separately with {@link #createItem(UUID, Item)}.
     *
     * @param list the list to create, its id must not exist yet
     */
    void createList(ItemList list);

    /**
     * Overwrite the mutable fields of an existing list.
     *
     * @param list the list carrying the new values
     */
    void updateList(ItemList list);

    /**
     * Delete a list together with its items and their images.
     *
     * @param listId the list id
     * @return true if the list existed
     */
    boolean deleteList(UUID listId);

    /**
     * Insert an item, with its images, into an existing list.
     *
     * @param listId id of the parent list
     * @param item   the item to create, its id must not exist yet
     */
    void createItem(UUID listId, Item item);

    /**
     * Overwrite an existing item. Images are replaced by the item's images.
     *
     * @param listId id of the parent list
     * @param item   the item carrying the new values
     */
    void updateItem(UUID listId, Item item);

    /**
     * Run a unit of work so that either all of its writes become visible or
     * none do.
     *
     * <p>The default runs the work directly against this store, which gives
     * best-effort semantics only. Transactional stores override it.
     *
     * @param work the work, receiving the store view to write through
     * @return the work's result
     */
    default <T> T inTransaction(Function<EntityStore, T> work) {
        return work.apply(this);
    }
}
