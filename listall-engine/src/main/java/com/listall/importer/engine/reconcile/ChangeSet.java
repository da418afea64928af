/*
 * Copyright (c) 2025 ListAll Import Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.listall.importer.engine.reconcile;

import com.listall.importer.api.model.ConflictDetail;
import com.listall.importer.api.model.ImportPreview;
import com.listall.importer.api.model.ImportResult;
import com.listall.importer.api.model.Item;
import com.listall.importer.api.model.ItemList;
import com.listall.importer.api.model.MergeStrategy;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * In-memory plan of the writes an import would perform.
 *
 * <p>Built by {@link ReconciliationEngine} without touching the store. A preview
 * reports it; a commit hands it to the commit coordinator. Both paths see the
 * same instance shape, so their counters cannot diverge.
 *
 * <p>Lists to create carry no items: every item write, including the items of
 * new lists, is an {@link ItemChange} naming its parent list.
 */
public final class ChangeSet {

    /**
     * An item to write into a list.
     *
     * @param listId id of the parent list as it will exist after the commit
     * @param item   the item to create or the updated item
     */
    public record ItemChange(UUID listId, Item item) {
    }

    private final MergeStrategy strategy;
    private final List<UUID> listsToDelete;
    private final List<ItemList> listsToCreate;
    private final List<ItemList> listsToUpdate;
    private final List<ItemChange> itemsToCreate;
    private final List<ItemChange> itemsToUpdate;
    private final List<ConflictDetail> conflicts;
    private final List<String> errors;

    private ChangeSet(Builder builder) {
        this.strategy = builder.strategy;
        this.listsToDelete = List.copyOf(builder.listsToDelete);
        this.listsToCreate = List.copyOf(builder.listsToCreate);
        this.listsToUpdate = List.copyOf(builder.listsToUpdate);
        this.itemsToCreate = List.copyOf(builder.itemsToCreate);
        this.itemsToUpdate = List.copyOf(builder.itemsToUpdate);
        this.conflicts = List.copyOf(builder.conflicts);
        this.errors = List.copyOf(builder.errors);
    }

    public static Builder builder(MergeStrategy strategy) {
        return new Builder(strategy);
    }

    public MergeStrategy getStrategy() {
        return strategy;
    }

    /** Ids of existing lists removed before anything is created. Only used by replace. */
    public List<UUID> getListsToDelete() {
        return listsToDelete;
    }

    public List<ItemList> getListsToCreate() {
        return listsToCreate;
    }

    public List<ItemList> getListsToUpdate() {
        return listsToUpdate;
    }

    public List<ItemChange> getItemsToCreate() {
        return itemsToCreate;
    }

    public List<ItemChange> getItemsToUpdate() {
        return itemsToUpdate;
    }

    public List<ConflictDetail> getConflicts() {
        return conflicts;
    }

    public List<String> getErrors() {
        return errors;
    }

    public boolean isEmpty() {
        return listsToDelete.isEmpty() && listsToCreate.isEmpty() && listsToUpdate.isEmpty()
                && itemsToCreate.isEmpty() && itemsToUpdate.isEmpty();
    }

    public ImportPreview toPreview() {
        return new ImportPreview(listsToCreate.size(), listsToUpdate.size(),
                itemsToCreate.size(), itemsToUpdate.size(), conflicts, errors);
    }

    public ImportResult toResult() {
        return new ImportResult(listsToCreate.size(), listsToUpdate.size(),
                itemsToCreate.size(), itemsToUpdate.size(), conflicts, errors);
    }

    @Override
    public String toString() {
        return "ChangeSet{strategy=" + strategy
                + ", delete=" + listsToDelete.size()
                + ", createLists=" + listsToCreate.size()
                + ", updateLists=" + listsToUpdate.size()
                + ", createItems=" + itemsToCreate.size()
                + ", updateItems=" + itemsToUpdate.size()
                + ", conflicts=" + conflicts.size()
                + ", errors=" + errors.size() + "}";
    }

    /**
     * Accumulates entries during a traversal.
     */
    public static final class Builder {
        private final MergeStrategy strategy;
        private final List<UUID> listsToDelete = new ArrayList<>();
        private final List<ItemList> listsToCreate = new ArrayList<>();
        private final List<ItemList> listsToUpdate = new ArrayList<>();
        private final List<ItemChange> itemsToCreate = new ArrayList<>();
        private final List<ItemChange> itemsToUpdate = new ArrayList<>();
        private final List<ConflictDetail> conflicts = new ArrayList<>();
        private final List<String> errors = new ArrayList<>();

        private Builder(MergeStrategy strategy) {
            this.strategy = strategy;
        }

        public Builder deleteList(UUID listId) {
            listsToDelete.add(listId);
            return this;
        }

        public Builder createList(ItemList list) {
            listsToCreate.add(list.withoutItems());
            return this;
        }

        public Builder updateList(ItemList list) {
            listsToUpdate.add(list.withoutItems());
            return this;
        }

        public Builder createItem(UUID listId, Item item) {
            itemsToCreate.add(new ItemChange(listId, item));
            return this;
        }

        public Builder updateItem(UUID listId, Item item) {
            itemsToUpdate.add(new ItemChange(listId, item));
            return this;
        }

        public Builder conflict(ConflictDetail conflict) {
            conflicts.add(conflict);
            return this;
        }

        public Builder error(String error) {
            errors.add(error);
            return this;
        }

        public ChangeSet build() {
            return new ChangeSet(this);
        }
    }
}
