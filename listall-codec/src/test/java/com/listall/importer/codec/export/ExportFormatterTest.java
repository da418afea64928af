package com.listall.importer.codec.export;

import com.listall.importer.api.model.Item;
import com.listall.importer.api.model.ItemList;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class ExportFormatterTest {

    private static final Instant CREATED = Instant.parse("2025-02-01T08:00:00Z");

    private final ExportFormatter formatter = new ExportFormatter();

    private static Item item(String title, String description, int quantity, int order, boolean crossedOut) {
        return new Item(UUID.randomUUID(), title, description, quantity, order, crossedOut, CREATED, CREATED, List.of());
    }

    private static ItemList list(String name, int order, Item... items) {
        return new ItemList(UUID.randomUUID(), name, order, false, CREATED, CREATED, List.of(items));
    }

    private final List<ItemList> lists = List.of(
            list("Hardware", 1),
            list("Groceries", 0,
                    item("Bread", null, 2, 1, true),
                    item("Milk", "oat, unsweetened", 1, 0, false)));

    @Nested
    @DisplayName("Plain text")
    class PlainText {

        @Test
        @DisplayName("Should render lists and items in order")
        void shouldRenderDefaults() {
            assertThat(formatter.toPlainText(lists, ExportOptions.defaults())).isEqualTo("""
                    Groceries
                    =========

                    1. [ ] Milk
                       oat, unsweetened
                    2. [✓] Bread (×2)

                    Hardware
                    ========

                    (No items)
                    """);
        }

        @Test
        @DisplayName("Should drop crossed-out items, descriptions and quantities when minimal")
        void shouldRenderMinimal() {
            assertThat(formatter.toPlainText(lists.subList(1, 2), ExportOptions.minimal())).isEqualTo("""
                    Groceries
                    =========

                    1. [ ] Milk
                    """);
        }

        @Test
        @DisplayName("Should add creation dates when asked")
        void shouldRenderDates() {
            String text = formatter.toPlainText(List.of(list("A", 0, item("x", null, 1, 0, false))),
                    new ExportOptions(true, true, true, true));

            assertThat(text).isEqualTo("""
                    A
                    =
                    Created: 2025-02-01T08:00:00Z

                    1. [ ] x
                       Created: 2025-02-01T08:00:00Z
                    """);
        }
    }

    @Nested
    @DisplayName("CSV")
    class Csv {

        @Test
        @DisplayName("Should write one row per item with quoting")
        void shouldRenderRows() {
            assertThat(formatter.toCsv(lists)).isEqualTo("""
                    List Name,Item Title,Description,Quantity,Crossed Out,Created Date
                    Groceries,Milk,"oat, unsweetened",1,No,2025-02-01T08:00:00Z
                    Groceries,Bread,,2,Yes,2025-02-01T08:00:00Z
                    """);
        }

        @Test
        @DisplayName("Should quote embedded quotes and line breaks")
        void shouldQuoteSpecialCharacters() {
            ItemList notes = list("Notes", 0, item("say \"hi\"", "two\nlines", 1, 0, false));

            assertThat(formatter.toCsv(List.of(notes))).isEqualTo(
                    "List Name,Item Title,Description,Quantity,Crossed Out,Created Date\n"
                            + "Notes,\"say \"\"hi\"\"\",\"two\nlines\",1,No,2025-02-01T08:00:00Z\n");
        }

        @Test
        @DisplayName("Should write only the header for no items")
        void shouldRenderHeaderOnly() {
            assertThat(formatter.toCsv(List.of()))
                    .isEqualTo("List Name,Item Title,Description,Quantity,Crossed Out,Created Date\n");
        }
    }
}
