/*
 * Copyright (c) 2025 ListAll Import Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.listall.importer.service.repository;

import com.listall.importer.api.exceptions.EntityStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads SQL from classpath resources so statements live in .sql files rather
 * than in Java strings.
 *
 * <p><b>Query Format:</b>
 * <pre>
 * -- @name: query_name
 * SELECT * FROM item_list WHERE id = ?;
 * </pre>
 */
public final class SqlLoader {

    private static final Logger logger = LoggerFactory.getLogger(SqlLoader.class);

    private static final String NAME_MARKER = "-- @name:";

    private SqlLoader() {
    }

    /**
     * Load named queries from a resource file.
     *
     * @param resourcePath path to SQL file (e.g., "sql/queries.sql")
     * @return map of query names to SQL strings, without trailing semicolons
     */
    public static Map<String, String> loadQueries(String resourcePath) {
        Map<String, String> queries = new HashMap<>();
        String currentName = null;
        StringBuilder current = new StringBuilder();

        for (String raw : readLines(resourcePath)) {
            String line = raw.trim();
            if (line.startsWith(NAME_MARKER)) {
                put(queries, currentName, current);
                currentName = line.substring(NAME_MARKER.length()).trim();
                current = new StringBuilder();
            } else if (!line.startsWith("--") && !line.isEmpty() && currentName != null) {
                if (current.length() > 0) {
                    current.append(' ');
                }
                current.append(line);
            }
        }
        put(queries, currentName, current);

        logger.info("Loaded {} SQL queries from {}", queries.size(), resourcePath);
        return queries;
    }

    /**
     * Load a schema file as individual statements.
     *
     * @param resourcePath path to SQL file (e.g., "sql/schema.sql")
     * @return the statements in file order
     */
    public static List<String> loadStatements(String resourcePath) {
        StringBuilder script = new StringBuilder();
        for (String line : readLines(resourcePath)) {
            if (!line.trim().startsWith("--")) {
                script.append(line).append('\n');
            }
        }

        List<String> statements = new ArrayList<>();
        for (String statement : script.toString().split(";")) {
            if (!statement.isBlank()) {
                statements.add(statement.trim());
            }
        }
        logger.info("Loaded {} schema statements from {}", statements.size(), resourcePath);
        return statements;
    }

    private static void put(Map<String, String> queries, String name, StringBuilder sql) {
        if (name == null || sql.length() == 0) {
            return;
        }
        String text = sql.toString().trim();
        if (text.endsWith(";")) {
            text = text.substring(0, text.length() - 1).trim();
        }
        queries.put(name, text);
    }

    private static List<String> readLines(String resourcePath) {
        InputStream is = SqlLoader.class.getClassLoader().getResourceAsStream(resourcePath);
        if (is == null) {
            throw new EntityStoreException("SQL resource not found: " + resourcePath);
        }
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8))) {
            return reader.lines().toList();
        } catch (IOException e) {
            logger.error("Failed to read SQL from {}", resourcePath, e);
            throw new EntityStoreException("Failed to read SQL from " + resourcePath, e);
        }
    }
}
