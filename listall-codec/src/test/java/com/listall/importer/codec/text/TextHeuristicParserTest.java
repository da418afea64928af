package com.listall.importer.codec.text;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TextHeuristicParserTest {

    private final TextHeuristicParser parser = new TextHeuristicParser();

    @Test
    @DisplayName("Should parse bullets, checkboxes and numbering in one text")
    void shouldParseMixedText() {
        List<ParsedItem> items = parser.parse("• Milk\n[x] Bread (×2)\n1. Eggs");

        assertThat(items).containsExactly(
                new ParsedItem("Milk", false, 1),
                new ParsedItem("Bread", true, 2),
                new ParsedItem("Eggs", false, 1));
    }

    @Test
    @DisplayName("Should skip blank lines and accept any line terminator")
    void shouldSkipBlankLines() {
        List<ParsedItem> items = parser.parse("Milk\r\n\r\n   \nBread\rEggs\n");

        assertThat(items).extracting(ParsedItem::title).containsExactly("Milk", "Bread", "Eggs");
    }

    @Test
    @DisplayName("Should return nothing for null or empty text")
    void shouldHandleEmptyText() {
        assertThat(parser.parse(null)).isEmpty();
        assertThat(parser.parse("")).isEmpty();
        assertThat(parser.parse("\n\n")).isEmpty();
    }

    @Nested
    @DisplayName("Prefixes")
    class Prefixes {

        @ParameterizedTest
        @ValueSource(strings = {"•", "-", "*", "✓", "✔", "☐", "☑", "▪", "▸", "→"})
        @DisplayName("Should strip every bullet marker")
        void shouldStripBullets(String marker) {
            assertThat(parser.parseLine(marker + " Apples"))
                    .contains(new ParsedItem("Apples", false, 1));
        }

        @ParameterizedTest
        @ValueSource(strings = {"1. Apples", "12) Apples", "3: Apples", "4.Apples"})
        @DisplayName("Should strip numbering")
        void shouldStripNumbering(String line) {
            assertThat(parser.parseLine(line)).contains(new ParsedItem("Apples", false, 1));
        }

        @ParameterizedTest
        @CsvSource({"'[x] Apples', true", "'[X] Apples', true", "'[✓] Apples', true",
                "'[ ] Apples', false", "'[] Apples', false"})
        @DisplayName("Should read checkbox state")
        void shouldReadCheckbox(String line, boolean crossedOut) {
            assertThat(parser.parseLine(line)).contains(new ParsedItem("Apples", crossedOut, 1));
        }

        @Test
        @DisplayName("Should strip only the first prefix")
        void shouldStripOnlyOnePrefix() {
            assertThat(parser.parseLine("- [x] Apples")).contains(new ParsedItem("[x] Apples", false, 1));
            assertThat(parser.parseLine("1. - Apples")).contains(new ParsedItem("- Apples", false, 1));
        }

        @Test
        @DisplayName("Should keep lines without a recognized prefix verbatim")
        void shouldKeepPlainLine() {
            assertThat(parser.parseLine("  Olive oil, extra virgin  "))
                    .contains(new ParsedItem("Olive oil, extra virgin", false, 1));
        }
    }

    @Nested
    @DisplayName("Quantity suffix")
    class QuantitySuffix {

        @Test
        @DisplayName("Should read the quantity and strip it from the title")
        void shouldReadQuantity() {
            assertThat(parser.parseLine("Bread (×12)")).contains(new ParsedItem("Bread", false, 12));
        }

        @ParameterizedTest
        @ValueSource(strings = {"Bread (×0)", "Bread (×99999999999999)"})
        @DisplayName("Should fall back to one for unusable quantities")
        void shouldFallBackToOne(String line) {
            assertThat(parser.parseLine(line)).contains(new ParsedItem("Bread", false, 1));
        }

        @Test
        @DisplayName("Should only read the suffix at the end of the line")
        void shouldIgnoreInnerParentheses() {
            assertThat(parser.parseLine("Bread (×2) rolls")).contains(new ParsedItem("Bread (×2) rolls", false, 1));
            assertThat(parser.parseLine("Bread (x2)")).contains(new ParsedItem("Bread (x2)", false, 1));
        }
    }

    @ParameterizedTest
    @ValueSource(strings = {"•", "- ", "[x]", "1.", "(×3)", "   "})
    @DisplayName("Should drop lines that are only decoration")
    void shouldDropDecorationOnly(String line) {
        assertThat(parser.parseLine(line)).isEmpty();
    }
}
