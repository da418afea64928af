package com.listall.importer.service;

import com.listall.importer.api.EntityStore;
import com.listall.importer.api.exceptions.EntityStoreException;
import com.listall.importer.api.exceptions.ImportException;
import com.listall.importer.api.exceptions.ImportException.ErrorType;
import com.listall.importer.api.model.ImportOptions;
import com.listall.importer.api.model.ImportPreview;
import com.listall.importer.api.model.ImportResult;
import com.listall.importer.api.model.Item;
import com.listall.importer.api.model.ItemList;
import com.listall.importer.codec.SchemaCodec;
import com.listall.importer.codec.export.ExportFormatter;
import com.listall.importer.engine.ImportEngine;
import com.listall.importer.service.repository.InMemoryEntityStore;
import com.listall.importer.service.repository.JdbcEntityStore;
import com.listall.importer.service.service.ExportService;
import io.opentelemetry.api.OpenTelemetry;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Import and export running against real stores.
 */
class ImportFlowTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-06-01T12:00:00Z"), ZoneOffset.UTC);

    private final SchemaCodec codec = new SchemaCodec();

    private InMemoryEntityStore store;
    private ImportEngine engine;
    private ExportService exportService;

    @BeforeEach
    void setUp() {
        store = new InMemoryEntityStore();
        engine = engineFor(store);
        exportService = new ExportService(store, codec, new ExportFormatter(), CLOCK);
    }

    private ImportEngine engineFor(EntityStore entityStore) {
        return new ImportEngine(entityStore, codec, OpenTelemetry.noop().getTracer("test"), CLOCK, UUID::randomUUID);
    }

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    private static final String EMPTY_EXPORT = """
            {"version": "1.0", "exportDate": "2025-03-01T10:15:30Z", "lists": []}
            """;

    @Test
    @DisplayName("Should empty the store when replacing with an empty export")
    void shouldReplaceWithEmptyExport() {
        engine.commit(bytes("Milk\nEggs"), ImportOptions.defaults());
        engine.commit(bytes("Nails"), ImportOptions.defaults().withTextListName("Hardware"));

        ImportResult result = engine.commit(bytes(EMPTY_EXPORT), ImportOptions.replace());

        assertThat(result.listsCreated()).isZero();
        assertThat(result.wasSuccessful()).isTrue();
        assertThat(store.findAllLists()).isEmpty();
    }

    @Test
    @DisplayName("Should add a new copy on every append")
    void shouldAppendCopies() {
        byte[] export = bytes("Milk\nEggs\nBread");
        engine.commit(export, ImportOptions.replace());
        byte[] json = exportService.exportJson();

        engine.commit(json, ImportOptions.append());
        engine.commit(json, ImportOptions.append());

        List<ItemList> lists = store.findAllLists();
        assertThat(lists).hasSize(3);
        assertThat(lists.stream().flatMap(list -> list.items().stream()).map(Item::id))
                .hasSize(9)
                .doesNotHaveDuplicates();
    }

    @Test
    @DisplayName("Should keep lists the payload does not mention when merging")
    void shouldMergeWithoutDeleting() {
        engine.commit(bytes("Milk"), ImportOptions.defaults().withTextListName("Groceries"));
        engine.commit(bytes("Nails"), ImportOptions.defaults().withTextListName("Hardware"));

        ImportResult result = engine.commit(bytes("Eggs"), ImportOptions.defaults().withTextListName("groceries"));

        assertThat(result.listsUpdated()).isEqualTo(1);
        assertThat(store.findAllLists()).extracting(ItemList::name).containsExactly("groceries", "Hardware");
        assertThat(store.findAllLists().get(0).items()).extracting(Item::title).containsExactly("Milk", "Eggs");
    }

    @Test
    @DisplayName("Should preview exactly what a commit then does")
    void shouldPreviewLikeCommit() {
        engine.commit(bytes("Milk\nEggs"), ImportOptions.defaults().withTextListName("Groceries"));
        byte[] json = exportService.exportJson();
        byte[] payload = bytes(new String(json, StandardCharsets.UTF_8).replace("\"Milk\"", "\"Oat milk\""));

        ImportPreview preview = engine.preview(payload, ImportOptions.defaults());
        List<ItemList> before = store.findAllLists();
        ImportResult result = engine.commit(payload, ImportOptions.defaults());

        assertThat(before).hasSize(1);
        assertThat(result.listsCreated()).isEqualTo(preview.listsToCreate());
        assertThat(result.listsUpdated()).isEqualTo(preview.listsToUpdate());
        assertThat(result.itemsCreated()).isEqualTo(preview.itemsToCreate());
        assertThat(result.itemsUpdated()).isEqualTo(preview.itemsToUpdate());
        assertThat(result.conflicts()).isEqualTo(preview.conflicts());
        assertThat(preview.conflicts()).singleElement()
                .satisfies(conflict -> assertThat(conflict.message())
                        .isEqualTo("Item title will change from 'Milk' to 'Oat milk'"));
    }

    @Test
    @DisplayName("Should restore the same graph from its own JSON export")
    void shouldRoundTripThroughExport() {
        engine.commit(bytes("• Milk\n[x] Bread (×2)\n1. Eggs"), ImportOptions.defaults().withTextListName("Weekly"));
        List<ItemList> original = store.findAllLists();
        byte[] json = exportService.exportJson();

        InMemoryEntityStore other = new InMemoryEntityStore();
        engineFor(other).commit(json, ImportOptions.replace());

        assertThat(other.findAllLists()).isEqualTo(original);
    }

    @Test
    @DisplayName("Should leave the in-memory store untouched when a replace fails mid-commit")
    void shouldRollBackInMemoryReplace() {
        engine.commit(bytes("Milk"), ImportOptions.defaults().withTextListName("Groceries"));
        List<ItemList> before = store.findAllLists();

        assertReplaceFails(new FailOnItemCreate(store));

        assertThat(store.findAllLists()).isEqualTo(before);
    }

    @Test
    @DisplayName("Should leave the database untouched when a replace fails mid-commit")
    void shouldRollBackJdbcReplace() {
        JdbcDataSource dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:flow-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        JdbcEntityStore jdbcStore = new JdbcEntityStore(dataSource);
        engineFor(jdbcStore).commit(bytes("Milk"), ImportOptions.defaults().withTextListName("Groceries"));
        List<ItemList> before = jdbcStore.findAllLists();

        assertReplaceFails(new FailOnItemCreate(jdbcStore));

        assertThat(jdbcStore.findAllLists()).isEqualTo(before);
    }

    private void assertReplaceFails(EntityStore failing) {
        assertThatThrownBy(() -> engineFor(failing).commit(bytes("Nails\nScrews"),
                ImportOptions.replace().withTextListName("Hardware")))
                .isInstanceOfSatisfying(ImportException.class,
                        e -> assertThat(e.getType()).isEqualTo(ErrorType.REPOSITORY_ERROR))
                .hasMessageContaining("simulated failure");
    }

    /**
     * Store wrapper whose transactional view refuses item inserts.
     */
    private static final class FailOnItemCreate implements EntityStore {
        private final EntityStore delegate;

        FailOnItemCreate(EntityStore delegate) {
            this.delegate = delegate;
        }

        @Override
        public List<ItemList> findAllLists() {
            return delegate.findAllLists();
        }

        @Override
        public void createList(ItemList list) {
            delegate.createList(list);
        }

        @Override
        public void updateList(ItemList list) {
            delegate.updateList(list);
        }

        @Override
        public boolean deleteList(UUID listId) {
            return delegate.deleteList(listId);
        }

        @Override
        public void createItem(UUID listId, Item item) {
            throw new EntityStoreException("simulated failure");
        }

        @Override
        public void updateItem(UUID listId, Item item) {
            delegate.updateItem(listId, item);
        }

        @Override
        public <T> T inTransaction(Function<EntityStore, T> work) {
            return delegate.inTransaction(tx -> work.apply(new FailOnItemCreate(tx)));
        }
    }
}
