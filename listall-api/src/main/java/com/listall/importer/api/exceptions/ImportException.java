/*
 * Copyright (c) 2025 ListAll Import Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.listall.importer.api.exceptions;

import java.util.Objects;
import java.util.Optional;

/**
 * Terminal failure of an import call.
 *
 * <p>Unchecked, like the compiler exceptions elsewhere in the code base. The
 * {@link ErrorType} tells callers which stage failed; {@link #reason()} carries
 * the detail for the types that have one.
 */
public class ImportException extends RuntimeException {

    public enum ErrorType {
        /** Empty or unreadable raw input. */
        INVALID_DATA,
        /** Structured-looking input that is not well-formed JSON. */
        INVALID_FORMAT,
        /** Well-formed JSON that does not match the transport schema. */
        DECODING_FAILED,
        /** Pre-flight validation rejected the decoded data. */
        VALIDATION_FAILED,
        /** The entity store failed while reading the snapshot or committing. */
        REPOSITORY_ERROR,
        /** The caller cancelled the operation before it completed. */
        CANCELLED
    }

    private final ErrorType type;
    private final String reason;

    private ImportException(ErrorType type, String reason, String message, Throwable cause) {
        super(message, cause);
        this.type = Objects.requireNonNull(type, "type");
        this.reason = reason;
    }

    public static ImportException invalidData() {
        return new ImportException(ErrorType.INVALID_DATA, null,
                "The provided data is invalid or corrupted", null);
    }

    public static ImportException invalidFormat(Throwable cause) {
        return new ImportException(ErrorType.INVALID_FORMAT, null,
                "The file format is not supported", cause);
    }

    public static ImportException decodingFailed(String reason) {
        return decodingFailed(reason, null);
    }

    public static ImportException decodingFailed(String reason, Throwable cause) {
        return new ImportException(ErrorType.DECODING_FAILED, reason,
                "Failed to decode data: " + reason, cause);
    }

    public static ImportException validationFailed(String reason) {
        return new ImportException(ErrorType.VALIDATION_FAILED, reason,
                "Data validation failed: " + reason, null);
    }

    public static ImportException repositoryError(String reason, Throwable cause) {
        return new ImportException(ErrorType.REPOSITORY_ERROR, reason,
                "Failed to save data: " + reason, cause);
    }

    public static ImportException cancelled() {
        return new ImportException(ErrorType.CANCELLED, null, "The import was cancelled", null);
    }

    public ErrorType getType() {
        return type;
    }

    public Optional<String> reason() {
        return Optional.ofNullable(reason);
    }
}
