/*
 * Copyright (c) 2025 ListAll Import Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.listall.importer.engine.reconcile;

import com.listall.importer.api.CancellationToken;
import com.listall.importer.api.ImportProgressListener;
import com.listall.importer.api.exceptions.ImportException;
import com.listall.importer.api.model.ConflictDetail;
import com.listall.importer.api.model.ConflictDetail.ConflictType;
import com.listall.importer.api.model.ExportData;
import com.listall.importer.api.model.Item;
import com.listall.importer.api.model.ItemImage;
import com.listall.importer.api.model.ItemList;
import com.listall.importer.api.model.MergeStrategy;
import com.listall.importer.codec.validation.ExportDataValidator;
import com.listall.importer.engine.progress.ProgressReporter;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Diffs an incoming entity graph against a snapshot of the store and produces
 * a {@link ChangeSet}.
 *
 * <p>The engine itself is stateless. Every call runs its own {@link Traversal},
 * which moves through {@link State#NOT_STARTED}, {@link State#TRAVERSING} and
 * ends in {@link State#COMPLETED} or {@link State#ABORTED}. The snapshot is
 * never modified.
 *
 * <p>Strategy semantics:
 * <ul>
 *   <li>{@link MergeStrategy#REPLACE} - every existing list is deleted, incoming
 *       entities are created with their own ids</li>
 *   <li>{@link MergeStrategy#MERGE} - lists match by id, then by trimmed
 *       case-insensitive name; items match by id inside a matched list.
 *       Nothing is deleted</li>
 *   <li>{@link MergeStrategy#APPEND} - everything is created under fresh ids</li>
 * </ul>
 *
 * <p>An entity that cannot be written (blank name or title, quantity below one,
 * duplicate id) is skipped with a message in the change set's errors; the rest
 * of the import goes on.
 */
public class ReconciliationEngine {

    private static final Logger logger = LoggerFactory.getLogger(ReconciliationEngine.class);

    public enum State {
        NOT_STARTED,
        TRAVERSING,
        COMPLETED,
        ABORTED
    }

    private final Tracer tracer;
    private final Supplier<UUID> idGenerator;

    public ReconciliationEngine(Tracer tracer) {
        this(tracer, UUID::randomUUID);
    }

    public ReconciliationEngine(Tracer tracer, Supplier<UUID> idGenerator) {
        this.tracer = tracer;
        this.idGenerator = idGenerator;
    }

    /**
     * Reconciles the incoming graph against the snapshot.
     *
     * @param existing snapshot of the store, in its encounter order
     * @param incoming decoded payload
     * @param strategy how to combine the two
     * @param listener receives progress updates
     * @param token    checked before each top-level list
     * @return the planned writes
     * @throws ImportException {@code CANCELLED} if the token fires mid-traversal
     */
    public ChangeSet reconcile(List<ItemList> existing,
                               ExportData incoming,
                               MergeStrategy strategy,
                               ImportProgressListener listener,
                               CancellationToken token) {
        Span span = tracer.spanBuilder("reconcile").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("strategy", strategy.name());
            span.setAttribute("existingListCount", existing.size());
            span.setAttribute("incomingListCount", incoming.lists().size());

            Traversal traversal = new Traversal(existing, incoming.lists(), strategy, listener, token);
            ChangeSet changeSet = traversal.run();

            span.setAttribute("conflictCount", changeSet.getConflicts().size());
            span.setAttribute("errorCount", changeSet.getErrors().size());
            logger.debug("Reconciled with {}: {}", strategy, changeSet);
            return changeSet;
        } catch (ImportException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * One walk over the incoming lists. Holds all mutable bookkeeping of a call.
     */
    private final class Traversal {
        private final List<ItemList> existing;
        private final List<ItemList> incoming;
        private final MergeStrategy strategy;
        private final CancellationToken token;
        private final ProgressReporter progress;
        private final ChangeSet.Builder changes;

        private final Map<UUID, ItemList> existingById = new LinkedHashMap<>();
        private final Map<UUID, UUID> existingItemOwner = new HashMap<>();
        private final Set<UUID> seenListIds = new HashSet<>();
        private final Set<UUID> seenItemIds = new HashSet<>();

        private State state = State.NOT_STARTED;

        Traversal(List<ItemList> existing, List<ItemList> incoming, MergeStrategy strategy,
                  ImportProgressListener listener, CancellationToken token) {
            this.existing = existing;
            this.incoming = incoming;
            this.strategy = strategy;
            this.token = token != null ? token : CancellationToken.none();
            this.changes = ChangeSet.builder(strategy);

            int totalItems = incoming.stream().mapToInt(l -> l.items().size()).sum();
            this.progress = new ProgressReporter(listener, incoming.size(), totalItems);

            for (ItemList list : existing) {
                existingById.put(list.id(), list);
                for (Item item : list.items()) {
                    existingItemOwner.put(item.id(), list.id());
                }
            }
        }

        ChangeSet run() {
            if (state != State.NOT_STARTED) {
                throw new IllegalStateException("Traversal already " + state);
            }
            state = State.TRAVERSING;

            if (strategy == MergeStrategy.REPLACE) {
                existing.forEach(list -> changes.deleteList(list.id()));
            }

            for (int position = 0; position < incoming.size(); position++) {
                if (token.isCancellationRequested()) {
                    state = State.ABORTED;
                    logger.info("Import cancelled after {} of {} lists", position, incoming.size());
                    throw ImportException.cancelled();
                }

                ItemList list = incoming.get(position);
                switch (strategy) {
                    case REPLACE -> createAsIs(list, position);
                    case MERGE -> merge(list, position);
                    case APPEND -> append(list, position);
                }
                progress.listProcessed();
            }

            state = State.COMPLETED;
            progress.complete();
            return changes.build();
        }

        private void createAsIs(ItemList list, int position) {
            if (!acceptList(list, position, true)) {
                return;
            }
            changes.createList(list);
            for (int i = 0; i < list.items().size(); i++) {
                Item item = list.items().get(i);
                if (acceptItem(list, item, i, true)) {
                    changes.createItem(list.id(), item);
                }
                progress.itemProcessed();
            }
        }

        private void append(ItemList list, int position) {
            if (!acceptList(list, position, false)) {
                return;
            }
            UUID listId = idGenerator.get();
            changes.createList(list.withId(listId));
            for (int i = 0; i < list.items().size(); i++) {
                Item item = list.items().get(i);
                if (acceptItem(list, item, i, false)) {
                    changes.createItem(listId, withFreshIds(item));
                }
                progress.itemProcessed();
            }
        }

        private void merge(ItemList list, int position) {
            if (!acceptList(list, position, true)) {
                return;
            }

            ItemList current = findMatch(list);
            if (current == null) {
                changes.createList(list);
                mergeItems(list, list.id(), Map.of());
                return;
            }

            ItemList updated = new ItemList(current.id(), list.name(), list.orderNumber(), list.isArchived(),
                    current.createdAt(), list.modifiedAt(), List.of());
            changes.updateList(updated);
            if (listChanged(current, list)) {
                changes.conflict(listConflict(current, list));
            }

            Map<UUID, Item> currentItems = new HashMap<>();
            current.items().forEach(item -> currentItems.put(item.id(), item));
            mergeItems(list, current.id(), currentItems);
        }

        private void mergeItems(ItemList list, UUID targetListId, Map<UUID, Item> currentItems) {
            for (int i = 0; i < list.items().size(); i++) {
                Item item = list.items().get(i);
                if (acceptItem(list, item, i, true)) {
                    Item current = currentItems.get(item.id());
                    if (current != null) {
                        changes.updateItem(targetListId, updatedItem(current, item));
                        if (itemChanged(current, item)) {
                            changes.conflict(itemConflict(current, item));
                        }
                    } else if (existingItemOwner.containsKey(item.id())) {
                        skip(String.format(
                                "Item '%s' in list '%s' already exists in another list; skipped",
                                item.title(), list.name()));
                    } else {
                        changes.createItem(targetListId, item);
                    }
                }
                progress.itemProcessed();
            }
        }

        /**
         * Id match first; otherwise the first list, in snapshot order, whose
         * trimmed name equals the incoming one ignoring case. Several incoming
         * lists may resolve to the same existing list.
         */
        private ItemList findMatch(ItemList list) {
            ItemList byId = existingById.get(list.id());
            if (byId != null) {
                return byId;
            }
            String name = list.name().strip();
            for (ItemList candidate : existingById.values()) {
                if (candidate.name().strip().equalsIgnoreCase(name)) {
                    return candidate;
                }
            }
            return null;
        }

        private boolean acceptList(ItemList list, int position, boolean checkIds) {
            String problem = null;
            if (ExportDataValidator.isBlank(list.name())) {
                problem = String.format("List at position %d has an empty name; skipped", position + 1);
            } else if (checkIds && !seenListIds.add(list.id())) {
                problem = String.format("List '%s' repeats id %s; skipped", list.name(), list.id());
            }
            if (problem == null) {
                return true;
            }
            skip(problem);
            progress.itemsProcessed(list.items().size());
            return false;
        }

        private boolean acceptItem(ItemList list, Item item, int position, boolean checkIds) {
            String problem = null;
            if (ExportDataValidator.isBlank(item.title())) {
                problem = String.format("Item at position %d in list '%s' has an empty title; skipped",
                        position + 1, list.name());
            } else if (item.quantity() < ExportDataValidator.MIN_QUANTITY) {
                problem = String.format("Item '%s' in list '%s' has quantity %d; skipped",
                        item.title(), list.name(), item.quantity());
            } else if (checkIds && !seenItemIds.add(item.id())) {
                problem = String.format("Item '%s' in list '%s' repeats id %s; skipped",
                        item.title(), list.name(), item.id());
            }
            if (problem == null) {
                return true;
            }
            skip(problem);
            return false;
        }

        private void skip(String problem) {
            logger.warn("Skipping entity: {}", problem);
            changes.error(problem);
        }

        private Item withFreshIds(Item item) {
            List<ItemImage> images = item.images().stream()
                    .map(image -> image.withId(idGenerator.get()))
                    .toList();
            return item.withId(idGenerator.get()).withImages(images);
        }
    }

    private static Item updatedItem(Item current, Item incoming) {
        List<ItemImage> images = incoming.images().isEmpty() ? current.images() : incoming.images();
        return new Item(current.id(), incoming.title(), incoming.description(), incoming.quantity(),
                incoming.orderNumber(), incoming.isCrossedOut(), current.createdAt(), incoming.modifiedAt(), images);
    }

    private static boolean listChanged(ItemList current, ItemList incoming) {
        return !current.name().equals(incoming.name())
                || current.orderNumber() != incoming.orderNumber()
                || current.isArchived() != incoming.isArchived();
    }

    private static boolean itemChanged(Item current, Item incoming) {
        return !current.title().equals(incoming.title())
                || !Objects.equals(current.description(), incoming.description())
                || current.quantity() != incoming.quantity()
                || current.orderNumber() != incoming.orderNumber()
                || current.isCrossedOut() != incoming.isCrossedOut();
    }

    private static ConflictDetail listConflict(ItemList current, ItemList incoming) {
        if (!current.name().equals(incoming.name())) {
            return new ConflictDetail(ConflictType.LIST_MODIFIED, current.name(), current.id(),
                    current.name(), incoming.name(),
                    String.format("List name will change from '%s' to '%s'", current.name(), incoming.name()));
        }
        return new ConflictDetail(ConflictType.LIST_MODIFIED, current.name(), current.id(),
                summarize(current), summarize(incoming),
                String.format("List '%s' will be updated", current.name()));
    }

    private static ConflictDetail itemConflict(Item current, Item incoming) {
        String message = current.title().equals(incoming.title())
                ? String.format("Item '%s' will be updated", current.title())
                : String.format("Item title will change from '%s' to '%s'", current.title(), incoming.title());
        return new ConflictDetail(ConflictType.ITEM_MODIFIED, current.title(), current.id(),
                summarize(current), summarize(incoming), message);
    }

    private static String summarize(ItemList list) {
        return String.format("%s (order: %d%s)", list.name(), list.orderNumber(), list.isArchived() ? ", archived" : "");
    }

    private static String summarize(Item item) {
        return String.format("%s (qty: %d%s)", item.title(), item.quantity(), item.isCrossedOut() ? ", crossed out" : "");
    }
}
