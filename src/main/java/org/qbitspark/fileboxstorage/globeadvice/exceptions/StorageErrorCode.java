package org.qbitspark.fileboxstorage.globeadvice.exceptions;

import lombok.Getter;

@Getter
public enum StorageErrorCode {
    UNSUPPORTED_BACKEND("unsupported storage type"),
    NOT_FOUND("file not found"),
    PERMISSION_DENIED("permission denied"),
    STORAGE_FULL("storage is full"),
    INVALID_KEY("invalid key"),
    UPLOAD_FAILED("upload failed"),
    DOWNLOAD_FAILED("download failed"),
    DELETE_FAILED("delete failed"),
    CORRUPTION("stored content does not match its recorded hash"),
    SHARE_EXPIRED("share has expired"),
    SHARE_EXHAUSTED("share download limit reached"),
    SHARE_REVOKED("share has been revoked"),
    SHARE_FORBIDDEN("share password mismatch"),
    INVALID_OPERATION("invalid operation"),
    CANCELLED("operation cancelled");

    private final String description;

    StorageErrorCode(String description) {
        this.description = description;
    }
}
