package com.botwire.api.transport;

import java.util.Objects;

/**
 * A file uploaded as a multipart part.
 *
 * @param fieldName form field that carries the file, e.g. {@code "photo"}
 * @param fileName  file name sent to the platform
 * @param content   raw bytes
 * @param mimeType  MIME type; null falls back to {@code application/octet-stream}
 */
public record InputFile(String fieldName, String fileName, byte[] content, String mimeType) {

    public InputFile {
        Objects.requireNonNull(fieldName, "fieldName");
        Objects.requireNonNull(content, "content");
        if (fileName == null || fileName.isBlank()) {
            fileName = fieldName;
        }
    }
}
