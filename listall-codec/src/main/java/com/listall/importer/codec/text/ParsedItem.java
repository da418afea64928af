/*
 * Copyright (c) 2025 ListAll Import Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.listall.importer.codec.text;

/**
 * One item recovered from a line of free text.
 *
 * @param title        the item title, Unicode preserved
 * @param isCrossedOut true when the line carried a ticked checkbox
 * @param quantity     quantity from a trailing {@code (×N)}, 1 otherwise
 */
public record ParsedItem(String title, boolean isCrossedOut, int quantity) {
}
