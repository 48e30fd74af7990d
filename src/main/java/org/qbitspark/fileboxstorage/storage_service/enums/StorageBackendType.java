package org.qbitspark.fileboxstorage.storage_service.enums;

import org.qbitspark.fileboxstorage.globeadvice.exceptions.UnsupportedBackendException;

import java.util.Locale;

public enum StorageBackendType {
    LOCAL,
    S3,
    MINIO;

    public static StorageBackendType fromConfig(String value) {
        if (value == null || value.isBlank()) {
            throw new UnsupportedBackendException("storage type is not configured");
        }
        try {
            return StorageBackendType.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new UnsupportedBackendException("unsupported storage type: " + value);
        }
    }
}
