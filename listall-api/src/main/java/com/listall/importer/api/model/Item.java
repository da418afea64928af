/*
 * Copyright (c) 2025 ListAll Import Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.listall.importer.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * A single entry of a list.
 *
 * <p>{@code description} is nullable: an absent description is not the same
 * thing as an empty one. {@code images} defaults to an empty list.
 */
public record Item(
        @JsonProperty(value = "id", required = true) UUID id,
        @JsonProperty(value = "title", required = true) String title,
        @JsonProperty("description") String description,
        @JsonProperty(value = "quantity", required = true) int quantity,
        @JsonProperty(value = "orderNumber", required = true) int orderNumber,
        @JsonProperty(value = "isCrossedOut", required = true) boolean isCrossedOut,
        @JsonProperty(value = "createdAt", required = true) Instant createdAt,
        @JsonProperty(value = "modifiedAt", required = true) Instant modifiedAt,
        @JsonProperty("images") List<ItemImage> images
) {

    public Item {
        images = images != null ? List.copyOf(images) : List.of();
    }

    public Optional<String> descriptionValue() {
        return Optional.ofNullable(description);
    }

    public Item withId(UUID newId) {
        return new Item(newId, title, description, quantity, orderNumber, isCrossedOut,
                createdAt, modifiedAt, images);
    }

    public Item withImages(List<ItemImage> newImages) {
        return new Item(id, title, description, quantity, orderNumber, isCrossedOut,
                createdAt, modifiedAt, newImages);
    }
}
