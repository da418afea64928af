package com.listall.importer.service.repository;

import com.listall.importer.api.EntityStore;
import com.listall.importer.api.exceptions.EntityStoreException;
import com.listall.importer.api.model.ItemList;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JdbcEntityStoreTest extends AbstractEntityStoreTest {

    private JdbcDataSource dataSource;

    @Override
    EntityStore createStore() {
        dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:store-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        dataSource.setUser("sa");
        return new JdbcEntityStore(dataSource);
    }

    @Test
    @DisplayName("Should keep existing data when the schema is initialized again")
    void shouldReinitializeSchema() {
        store.createList(list("Groceries", 0));

        EntityStore reopened = new JdbcEntityStore(dataSource);

        assertThat(reopened.findAllLists()).extracting(ItemList::name).containsExactly("Groceries");
    }

    @Test
    @DisplayName("Should roll back when a store write fails inside the transaction")
    void shouldRollBackOnStoreFailure() {
        store.createList(list("Kept", 0));

        assertThatThrownBy(() -> store.inTransaction(tx -> {
            tx.createList(list("New", 1));
            tx.createItem(UUID.randomUUID(), item("Orphan"));
            return null;
        })).isInstanceOf(EntityStoreException.class);

        assertThat(store.findAllLists()).extracting(ItemList::name).containsExactly("Kept");
    }
}
