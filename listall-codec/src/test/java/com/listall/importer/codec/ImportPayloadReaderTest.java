package com.listall.importer.codec;

import com.listall.importer.api.exceptions.ImportException;
import com.listall.importer.api.exceptions.ImportException.ErrorType;
import com.listall.importer.api.model.ExportData;
import com.listall.importer.api.model.Item;
import com.listall.importer.api.model.ItemList;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ImportPayloadReaderTest {

    private static final Instant NOW = Instant.parse("2025-04-01T12:00:00Z");

    private ImportPayloadReader reader;

    @BeforeEach
    void setUp() {
        reader = new ImportPayloadReader(new SchemaCodec(), Clock.fixed(NOW, ZoneOffset.UTC), UUID::randomUUID);
    }

    @Test
    @DisplayName("Should wrap free text into one list named by the caller")
    void shouldWrapTextIntoList() {
        ExportData data = reader.read("• Milk\n[x] Bread (×2)\n1. Eggs".getBytes(StandardCharsets.UTF_8), "Shopping");

        assertThat(data.version()).isEqualTo(ExportData.CURRENT_VERSION);
        assertThat(data.exportDate()).isEqualTo(NOW);
        assertThat(data.lists()).singleElement().satisfies(list -> {
            assertThat(list.name()).isEqualTo("Shopping");
            assertThat(list.createdAt()).isEqualTo(NOW);
            assertThat(list.items()).extracting(Item::title).containsExactly("Milk", "Bread", "Eggs");
            assertThat(list.items()).extracting(Item::orderNumber).containsExactly(0, 1, 2);
            assertThat(list.items()).extracting(Item::quantity).containsExactly(1, 2, 1);
            assertThat(list.items()).extracting(Item::isCrossedOut).containsExactly(false, true, false);
        });
    }

    @Test
    @DisplayName("Should give every parsed entity its own id")
    void shouldAssignFreshIds() {
        ItemList list = reader.read("a\nb\nc".getBytes(StandardCharsets.UTF_8), "x").lists().get(0);

        assertThat(list.items()).extracting(Item::id).doesNotHaveDuplicates().doesNotContain(list.id());
    }

    @Test
    @DisplayName("Should delegate structured payloads to the codec")
    void shouldDecodeJson() {
        String json = """
                {"version": "1.0", "exportDate": "2025-03-01T10:15:30Z", "lists": []}
                """;

        ExportData data = reader.read(json.getBytes(StandardCharsets.UTF_8), "ignored");

        assertThat(data.lists()).isEmpty();
        assertThat(data.exportDate()).isEqualTo(Instant.parse("2025-03-01T10:15:30Z"));
    }

    @Test
    @DisplayName("Should reject empty input and text without items")
    void shouldRejectEmptyInput() {
        assertThatThrownBy(() -> reader.read(new byte[0], "x"))
                .isInstanceOf(ImportException.class)
                .satisfies(e -> assertThat(((ImportException) e).getType()).isEqualTo(ErrorType.INVALID_DATA));
        assertThatThrownBy(() -> reader.read("\n • \n [x] \n".getBytes(StandardCharsets.UTF_8), "x"))
                .isInstanceOf(ImportException.class)
                .satisfies(e -> assertThat(((ImportException) e).getType()).isEqualTo(ErrorType.INVALID_DATA));
    }
}
