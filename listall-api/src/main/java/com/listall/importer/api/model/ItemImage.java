/*
 * Copyright (c) 2025 ListAll Import Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.listall.importer.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;
import java.util.UUID;

/**
 * An image attached to an item.
 *
 * <p>The payload is opaque to the importer and travels as base64 in the JSON
 * transport form. Equality compares the payload by content.
 */
public record ItemImage(
        @JsonProperty(value = "id", required = true) UUID id,
        @JsonProperty(value = "imageData", required = true) byte[] imageData,
        @JsonProperty(value = "orderNumber", required = true) int orderNumber,
        @JsonProperty(value = "createdAt", required = true) Instant createdAt
) {

    public ItemImage withId(UUID newId) {
        return new ItemImage(newId, imageData, orderNumber, createdAt);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ItemImage other)) return false;
        return orderNumber == other.orderNumber
                && Objects.equals(id, other.id)
                && Arrays.equals(imageData, other.imageData)
                && Objects.equals(createdAt, other.createdAt);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(id, orderNumber, createdAt);
        return 31 * result + Arrays.hashCode(imageData);
    }

    @Override
    public String toString() {
        return "ItemImage[id=" + id
                + ", imageData=" + (imageData != null ? imageData.length + " bytes" : "null")
                + ", orderNumber=" + orderNumber
                + ", createdAt=" + createdAt + "]";
    }
}
