/*
 * Copyright (c) 2025 ListAll Import Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.listall.importer.service.repository;

import com.listall.importer.api.EntityStore;
import com.listall.importer.api.exceptions.EntityStoreException;
import com.listall.importer.api.model.Item;
import com.listall.importer.api.model.ItemList;
import jakarta.annotation.Priority;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Alternative;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;

/**
 * In-memory implementation of EntityStore.
 *
 * <p>Lists are kept in insertion order; each list holds its items, which hold
 * their images. Everything is lost on restart.
 *
 * <p><b>Thread Safety:</b> All operations are synchronized on the store.
 *
 * <p><b>Transactions:</b> {@link #inTransaction} runs the work against a private
 * copy and swaps the copy in only if the work returns normally.
 *
 * <p><b>Activation:</b> Disabled by default. Use JdbcEntityStore instead.
 */
@Alternative
@Priority(1)
@ApplicationScoped
public class InMemoryEntityStore implements EntityStore {

    private Map<UUID, ItemList> lists = new LinkedHashMap<>();

    public InMemoryEntityStore() {
    }

    private InMemoryEntityStore(Map<UUID, ItemList> lists) {
        this.lists = new LinkedHashMap<>(lists);
    }

    @Override
    public synchronized List<ItemList> findAllLists() {
        return List.copyOf(lists.values());
    }

    @Override
    public synchronized void createList(ItemList list) {
        if (lists.containsKey(list.id())) {
            throw new EntityStoreException("List already exists: " + list.id());
        }
        lists.put(list.id(), list.withoutItems());
    }

    @Override
    public synchronized void updateList(ItemList list) {
        ItemList current = require(list.id());
        lists.put(list.id(), list.withItems(current.items()));
    }

    @Override
    public synchronized boolean deleteList(UUID listId) {
        return lists.remove(listId) != null;
    }

    @Override
    public synchronized void createItem(UUID listId, Item item) {
        ItemList list = require(listId);
        boolean taken = lists.values().stream()
                .flatMap(l -> l.items().stream())
                .anyMatch(existing -> existing.id().equals(item.id()));
        if (taken) {
            throw new EntityStoreException("Item already exists: " + item.id());
        }
        List<Item> items = new ArrayList<>(list.items());
        items.add(item);
        lists.put(listId, list.withItems(items));
    }

    @Override
    public synchronized void updateItem(UUID listId, Item item) {
        ItemList list = require(listId);
        List<Item> items = new ArrayList<>(list.items());
        for (int i = 0; i < items.size(); i++) {
            if (items.get(i).id().equals(item.id())) {
                items.set(i, item);
                lists.put(listId, list.withItems(items));
                return;
            }
        }
        throw new EntityStoreException("Item " + item.id() + " not found in list " + listId);
    }

    @Override
    public synchronized <T> T inTransaction(Function<EntityStore, T> work) {
        InMemoryEntityStore staged = new InMemoryEntityStore(lists);
        T result = work.apply(staged);
        lists = staged.lists;
        return result;
    }

    /**
     * Remove everything. Used by tests.
     */
    public synchronized void clear() {
        lists.clear();
    }

    private ItemList require(UUID listId) {
        ItemList list = lists.get(listId);
        if (list == null) {
            throw new EntityStoreException("List not found: " + listId);
        }
        return list;
    }
}
