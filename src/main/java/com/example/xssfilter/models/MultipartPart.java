package com.example.xssfilter.models;

import java.util.Arrays;
import java.util.Objects;

/**
 * One section of a {@code multipart/form-data} body. File content is opaque binary and is
 * never handed to the sanitizer.
 */
public sealed interface MultipartPart permits MultipartPart.FilePart, MultipartPart.FieldPart {

    String DEFAULT_FILE_CONTENT_TYPE = "application/octet-stream";

    String fieldName();

    record FilePart(String fieldName, String fileName, String contentType, byte[] rawBytes)
            implements MultipartPart {

        public FilePart {
            Objects.requireNonNull(fieldName, "fieldName");
            Objects.requireNonNull(fileName, "fileName");
            Objects.requireNonNull(rawBytes, "rawBytes");
            if (contentType == null || contentType.isBlank()) {
                contentType = DEFAULT_FILE_CONTENT_TYPE;
            }
        }

        @Override
        public boolean equals(Object other) {
            return other instanceof FilePart that
                    && fieldName.equals(that.fieldName)
                    && fileName.equals(that.fileName)
                    && contentType.equals(that.contentType)
                    && Arrays.equals(rawBytes, that.rawBytes);
        }

        @Override
        public int hashCode() {
            return Objects.hash(fieldName, fileName, contentType, Arrays.hashCode(rawBytes));
        }

        @Override
        public String toString() {
            return "FilePart[fieldName=" + fieldName + ", fileName=" + fileName
                    + ", contentType=" + contentType + ", size=" + rawBytes.length + "]";
        }
    }

    record FieldPart(String fieldName, String text) implements MultipartPart {

        public FieldPart {
            Objects.requireNonNull(fieldName, "fieldName");
            Objects.requireNonNull(text, "text");
        }
    }
}
