/*
 * Copyright (c) 2025 ListAll Import Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.listall.importer.engine.commit;

import com.listall.importer.api.EntityStore;
import com.listall.importer.api.exceptions.ImportException;
import com.listall.importer.api.model.ImportResult;
import com.listall.importer.api.model.ItemList;
import com.listall.importer.engine.reconcile.ChangeSet;
import com.listall.importer.engine.reconcile.ChangeSet.ItemChange;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.UUID;

/**
 * Applies a {@link ChangeSet} to an {@link EntityStore} as one unit of work.
 *
 * <p>Writes go through {@link EntityStore#inTransaction}: deletions first, then
 * list creations, list updates, item creations and item updates. Any store
 * failure surfaces as {@code REPOSITORY_ERROR}; whether earlier writes survive
 * it is up to the store's transaction support.
 */
public class CommitCoordinator {

    private static final Logger logger = LoggerFactory.getLogger(CommitCoordinator.class);

    private final EntityStore entityStore;
    private final Tracer tracer;

    public CommitCoordinator(EntityStore entityStore, Tracer tracer) {
        this.entityStore = entityStore;
        this.tracer = tracer;
    }

    public ImportResult commit(ChangeSet changeSet) {
        Span span = tracer.spanBuilder("commit-change-set").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("strategy", changeSet.getStrategy().name());
            if (changeSet.isEmpty()) {
                logger.debug("Nothing to write");
                return changeSet.toResult();
            }

            int writes = entityStore.inTransaction(store -> apply(store, changeSet));
            span.setAttribute("writeCount", writes);
            logger.info("Committed {} writes ({})", writes, changeSet);
            return changeSet.toResult();
        } catch (ImportException e) {
            span.recordException(e);
            throw e;
        } catch (RuntimeException e) {
            span.recordException(e);
            logger.error("Commit failed, store rejected the change set", e);
            String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            throw ImportException.repositoryError(reason, e);
        } finally {
            span.end();
        }
    }

    private static int apply(EntityStore store, ChangeSet changeSet) {
        int writes = 0;
        for (UUID listId : changeSet.getListsToDelete()) {
            store.deleteList(listId);
            writes++;
        }
        for (ItemList list : changeSet.getListsToCreate()) {
            store.createList(list);
            writes++;
        }
        for (ItemList list : changeSet.getListsToUpdate()) {
            store.updateList(list);
            writes++;
        }
        for (ItemChange change : changeSet.getItemsToCreate()) {
            store.createItem(change.listId(), change.item());
            writes++;
        }
        for (ItemChange change : changeSet.getItemsToUpdate()) {
            store.updateItem(change.listId(), change.item());
            writes++;
        }
        return writes;
    }
}
