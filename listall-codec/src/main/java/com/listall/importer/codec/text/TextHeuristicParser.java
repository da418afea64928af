/*
 * Copyright (c) 2025 ListAll Import Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.listall.importer.codec.text;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns loosely formatted text into candidate items, one per non-blank line.
 *
 * <p>Each line is trimmed, then at most one leading decoration is removed, tried
 * in this order:
 * <ol>
 *   <li>a bullet marker: {@code • - * ✓ ✔ ☐ ☑ ▪ ▸ →}</li>
 *   <li>a numbered prefix: {@code 1.}, {@code 2)}, {@code 3:}</li>
 *   <li>a checkbox: {@code [ ]}, {@code []}, {@code [x]}, {@code [X]}, {@code [✓]};
 *       a ticked box marks the item as crossed out</li>
 * </ol>
 * A trailing quantity {@code (×N)} is then stripped independently. What remains
 * is the title.
 *
 * <h2>Example</h2>
 * <pre>
 * • Milk            -> ("Milk", false, 1)
 * [x] Bread (×2)    -> ("Bread", true, 2)
 * 1. Eggs           -> ("Eggs", false, 1)
 * </pre>
 */
public class TextHeuristicParser {

    private static final Logger logger = LoggerFactory.getLogger(TextHeuristicParser.class);

    static final List<String> BULLET_MARKERS =
            List.of("•", "-", "*", "✓", "✔", "☐", "☑", "▪", "▸", "→");

    private static final Pattern LINE_BREAK = Pattern.compile("\\R");
    private static final Pattern NUMBERED_PREFIX = Pattern.compile("^\\d+[.):]\\s*");
    private static final Pattern CHECKBOX_PREFIX = Pattern.compile("^\\[([ xX✓]?)]\\s*");
    private static final Pattern QUANTITY_SUFFIX = Pattern.compile("\\s*\\(×(\\d+)\\)\\s*$");

    private static final int DEFAULT_QUANTITY = 1;

    /**
     * Parses every line of the text.
     *
     * @param text multi-line text, may be null
     * @return items in source order
     */
    public List<ParsedItem> parse(String text) {
        List<ParsedItem> items = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return items;
        }
        for (String line : LINE_BREAK.split(text)) {
            parseLine(line).ifPresent(items::add);
        }
        logger.debug("Parsed {} items from free text", items.size());
        return items;
    }

    /**
     * Parses a single line.
     *
     * @param rawLine the line, without its terminator
     * @return the item, or empty for a blank line or a line that is only decoration
     */
    public Optional<ParsedItem> parseLine(String rawLine) {
        String line = rawLine.strip();
        if (line.isEmpty()) {
            return Optional.empty();
        }

        boolean crossedOut = false;
        String bullet = leadingBullet(line);
        if (bullet != null) {
            line = line.substring(bullet.length());
        } else {
            Matcher numbered = NUMBERED_PREFIX.matcher(line);
            if (numbered.lookingAt()) {
                line = line.substring(numbered.end());
            } else {
                Matcher checkbox = CHECKBOX_PREFIX.matcher(line);
                if (checkbox.lookingAt()) {
                    crossedOut = isTicked(checkbox.group(1));
                    line = line.substring(checkbox.end());
                }
            }
        }

        int quantity = DEFAULT_QUANTITY;
        Matcher suffix = QUANTITY_SUFFIX.matcher(line);
        if (suffix.find()) {
            quantity = parseQuantity(suffix.group(1));
            line = line.substring(0, suffix.start());
        }

        String title = line.strip();
        if (title.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new ParsedItem(title, crossedOut, quantity));
    }

    private static String leadingBullet(String line) {
        for (String marker : BULLET_MARKERS) {
            if (line.startsWith(marker)) {
                return marker;
            }
        }
        return null;
    }

    private static boolean isTicked(String boxContent) {
        return "x".equals(boxContent) || "X".equals(boxContent) || "✓".equals(boxContent);
    }

    private static int parseQuantity(String digits) {
        try {
            int quantity = Integer.parseInt(digits);
            return quantity >= 1 ? quantity : DEFAULT_QUANTITY;
        } catch (NumberFormatException e) {
            logger.debug("Quantity '{}' out of range, using {}", digits, DEFAULT_QUANTITY);
            return DEFAULT_QUANTITY;
        }
    }
}
