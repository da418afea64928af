/*
 * Copyright (c) 2025 ListAll Import Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.listall.importer.service.repository;

import com.listall.importer.api.EntityStore;
import com.listall.importer.api.exceptions.EntityStoreException;
import com.listall.importer.api.model.Item;
import com.listall.importer.api.model.ItemImage;
import com.listall.importer.api.model.ItemList;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;

/**
 * JDBC-based implementation of EntityStore using H2 or PostgreSQL.
 *
 * <p>Plain JDBC with statements kept in {@code sql/queries.sql}. Each call
 * outside a transaction runs on its own auto-commit connection.
 * {@link #inTransaction} binds one connection with auto-commit off to a store
 * view, commits when the work returns and rolls back when it throws.
 *
 * <p><b>Thread Safety:</b> All operations are thread-safe through database ACID properties.
 */
@ApplicationScoped
public class JdbcEntityStore implements EntityStore {

    private static final Logger logger = LoggerFactory.getLogger(JdbcEntityStore.class);

    private static final Map<String, String> SQL = SqlLoader.loadQueries("sql/queries.sql");
    private static final String SCHEMA_RESOURCE = "sql/schema.sql";

    @FunctionalInterface
    interface SqlWork<T> {
        T run(Connection conn) throws SQLException;
    }

    @FunctionalInterface
    private interface BoundWork<T> {
        T run() throws SQLException;
    }

    @Inject
    DataSource dataSource;

    public JdbcEntityStore() {
    }

    public JdbcEntityStore(DataSource dataSource) {
        this.dataSource = dataSource;
        initSchema();
    }

    /**
     * Create the schema if it does not exist yet.
     */
    @PostConstruct
    void initSchema() {
        logger.info("Initializing entity store schema...");
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            for (String sql : SqlLoader.loadStatements(SCHEMA_RESOURCE)) {
                stmt.execute(sql);
            }
        } catch (SQLException e) {
            logger.error("Failed to initialize database schema", e);
            throw new EntityStoreException("Failed to initialize database schema", e);
        }
        logger.info("Entity store schema initialized");
    }

    @Override
    public List<ItemList> findAllLists() {
        return execute("find all lists", this::selectAll);
    }

    @Override
    public void createList(ItemList list) {
        execute("create list " + list.id(), conn -> insertList(conn, list));
    }

    @Override
    public void updateList(ItemList list) {
        execute("update list " + list.id(), conn -> updateList(conn, list));
    }

    @Override
    public boolean deleteList(UUID listId) {
        return execute("delete list " + listId, conn -> deleteList(conn, listId));
    }

    @Override
    public void createItem(UUID listId, Item item) {
        execute("create item " + item.id(), conn -> insertItem(conn, listId, item));
    }

    @Override
    public void updateItem(UUID listId, Item item) {
        execute("update item " + item.id(), conn -> updateItem(conn, listId, item));
    }

    @Override
    public <T> T inTransaction(Function<EntityStore, T> work) {
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            T result;
            try {
                result = work.apply(new BoundStore(conn));
                conn.commit();
            } catch (RuntimeException | SQLException e) {
                rollback(conn, e);
                throw e;
            }
            conn.setAutoCommit(true);
            return result;
        } catch (SQLException e) {
            logger.error("Transaction failed", e);
            throw new EntityStoreException("Transaction failed", e);
        }
    }

    private void rollback(Connection conn, Exception cause) {
        logger.warn("Rolling back transaction: {}", cause.getMessage());
        try {
            conn.rollback();
        } catch (SQLException e) {
            cause.addSuppressed(e);
        }
    }

    private <T> T execute(String operation, SqlWork<T> work) {
        try (Connection conn = dataSource.getConnection()) {
            return work.run(conn);
        } catch (SQLException e) {
            logger.error("Failed to {}", operation, e);
            throw new EntityStoreException("Failed to " + operation, e);
        }
    }

    /**
     * Store view writing through a single transactional connection.
     */
    private final class BoundStore implements EntityStore {
        private final Connection conn;

        BoundStore(Connection conn) {
            this.conn = conn;
        }

        @Override
        public List<ItemList> findAllLists() {
            return bound("find all lists", () -> selectAll(conn));
        }

        @Override
        public void createList(ItemList list) {
            bound("create list " + list.id(), () -> insertList(conn, list));
        }

        @Override
        public void updateList(ItemList list) {
            bound("update list " + list.id(), () -> JdbcEntityStore.this.updateList(conn, list));
        }

        @Override
        public boolean deleteList(UUID listId) {
            return bound("delete list " + listId, () -> JdbcEntityStore.this.deleteList(conn, listId));
        }

        @Override
        public void createItem(UUID listId, Item item) {
            bound("create item " + item.id(), () -> insertItem(conn, listId, item));
        }

        @Override
        public void updateItem(UUID listId, Item item) {
            bound("update item " + item.id(), () -> JdbcEntityStore.this.updateItem(conn, listId, item));
        }

        @Override
        public <T> T inTransaction(Function<EntityStore, T> work) {
            return work.apply(this);
        }

        private <T> T bound(String operation, BoundWork<T> work) {
            try {
                return work.run();
            } catch (SQLException e) {
                throw new EntityStoreException("Failed to " + operation, e);
            }
        }
    }

    // Reads

    private List<ItemList> selectAll(Connection conn) throws SQLException {
        Map<UUID, List<ItemImage>> images = new HashMap<>();
        try (PreparedStatement stmt = conn.prepareStatement(SQL.get("select_all_images"));
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                images.computeIfAbsent(rs.getObject("item_id", UUID.class), k -> new ArrayList<>())
                        .add(mapImage(rs));
            }
        }

        Map<UUID, List<Item>> items = new HashMap<>();
        try (PreparedStatement stmt = conn.prepareStatement(SQL.get("select_all_items"));
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                items.computeIfAbsent(rs.getObject("list_id", UUID.class), k -> new ArrayList<>())
                        .add(mapItem(rs, images));
            }
        }

        List<ItemList> lists = new ArrayList<>();
        try (PreparedStatement stmt = conn.prepareStatement(SQL.get("select_all_lists"));
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                lists.add(mapList(rs, items));
            }
        }
        return lists;
    }

    // Writes

    private Void insertList(Connection conn, ItemList list) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(SQL.get("insert_list"))) {
            int idx = 1;
            stmt.setObject(idx++, list.id());
            stmt.setString(idx++, list.name());
            stmt.setInt(idx++, list.orderNumber());
            stmt.setBoolean(idx++, list.isArchived());
            setInstant(stmt, idx++, list.createdAt());
            setInstant(stmt, idx, list.modifiedAt());
            stmt.executeUpdate();
        }
        return null;
    }

    private Void updateList(Connection conn, ItemList list) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(SQL.get("update_list"))) {
            int idx = 1;
            stmt.setString(idx++, list.name());
            stmt.setInt(idx++, list.orderNumber());
            stmt.setBoolean(idx++, list.isArchived());
            setInstant(stmt, idx++, list.createdAt());
            setInstant(stmt, idx++, list.modifiedAt());
            stmt.setObject(idx, list.id());
            if (stmt.executeUpdate() == 0) {
                throw new EntityStoreException("List not found: " + list.id());
            }
        }
        return null;
    }

    private boolean deleteList(Connection conn, UUID listId) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(SQL.get("delete_list"))) {
            stmt.setObject(1, listId);
            return stmt.executeUpdate() > 0;
        }
    }

    private Void insertItem(Connection conn, UUID listId, Item item) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(SQL.get("insert_item"))) {
            int idx = 1;
            stmt.setObject(idx++, item.id());
            stmt.setObject(idx++, listId);
            stmt.setString(idx++, item.title());
            setStringOrNull(stmt, idx++, item.description());
            stmt.setInt(idx++, item.quantity());
            stmt.setInt(idx++, item.orderNumber());
            stmt.setBoolean(idx++, item.isCrossedOut());
            setInstant(stmt, idx++, item.createdAt());
            setInstant(stmt, idx, item.modifiedAt());
            stmt.executeUpdate();
        }
        insertImages(conn, item);
        return null;
    }

    private Void updateItem(Connection conn, UUID listId, Item item) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(SQL.get("update_item"))) {
            int idx = 1;
            stmt.setString(idx++, item.title());
            setStringOrNull(stmt, idx++, item.description());
            stmt.setInt(idx++, item.quantity());
            stmt.setInt(idx++, item.orderNumber());
            stmt.setBoolean(idx++, item.isCrossedOut());
            setInstant(stmt, idx++, item.createdAt());
            setInstant(stmt, idx++, item.modifiedAt());
            stmt.setObject(idx++, item.id());
            stmt.setObject(idx, listId);
            if (stmt.executeUpdate() == 0) {
                throw new EntityStoreException("Item " + item.id() + " not found in list " + listId);
            }
        }
        try (PreparedStatement stmt = conn.prepareStatement(SQL.get("delete_images_by_item"))) {
            stmt.setObject(1, item.id());
            stmt.executeUpdate();
        }
        insertImages(conn, item);
        return null;
    }

    private void insertImages(Connection conn, Item item) throws SQLException {
        if (item.images().isEmpty()) {
            return;
        }
        try (PreparedStatement stmt = conn.prepareStatement(SQL.get("insert_image"))) {
            for (ItemImage image : item.images()) {
                int idx = 1;
                stmt.setObject(idx++, image.id());
                stmt.setObject(idx++, item.id());
                stmt.setBytes(idx++, image.imageData());
                stmt.setInt(idx++, image.orderNumber());
                setInstant(stmt, idx, image.createdAt());
                stmt.addBatch();
            }
            stmt.executeBatch();
        }
    }

    // Mapping helpers

    private ItemList mapList(ResultSet rs, Map<UUID, List<Item>> items) throws SQLException {
        UUID id = rs.getObject("id", UUID.class);
        return new ItemList(
                id,
                rs.getString("name"),
                rs.getInt("order_number"),
                rs.getBoolean("is_archived"),
                getInstant(rs, "created_at"),
                getInstant(rs, "modified_at"),
                items.getOrDefault(id, List.of())
        );
    }

    private Item mapItem(ResultSet rs, Map<UUID, List<ItemImage>> images) throws SQLException {
        UUID id = rs.getObject("id", UUID.class);
        return new Item(
                id,
                rs.getString("title"),
                rs.getString("description"),
                rs.getInt("quantity"),
                rs.getInt("order_number"),
                rs.getBoolean("is_crossed_out"),
                getInstant(rs, "created_at"),
                getInstant(rs, "modified_at"),
                images.getOrDefault(id, List.of())
        );
    }

    private ItemImage mapImage(ResultSet rs) throws SQLException {
        return new ItemImage(
                rs.getObject("id", UUID.class),
                rs.getBytes("image_data"),
                rs.getInt("order_number"),
                getInstant(rs, "created_at")
        );
    }

    private static void setInstant(PreparedStatement stmt, int index, Instant value) throws SQLException {
        stmt.setObject(index, OffsetDateTime.ofInstant(value, ZoneOffset.UTC));
    }

    private static Instant getInstant(ResultSet rs, String column) throws SQLException {
        return rs.getObject(column, OffsetDateTime.class).toInstant();
    }

    private static void setStringOrNull(PreparedStatement stmt, int index, String value) throws SQLException {
        if (value == null) {
            stmt.setNull(index, Types.CLOB);
        } else {
            stmt.setString(index, value);
        }
    }
}
