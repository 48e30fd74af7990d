package org.qbitspark.fileboxstorage.globeadvice.exceptions;

public class ItemNotFoundException extends StorageException {

    public ItemNotFoundException(String message) {
        super(StorageErrorCode.NOT_FOUND, message);
    }

    public ItemNotFoundException(String message, String operation, String key, Throwable cause) {
        super(StorageErrorCode.NOT_FOUND, message, operation, key, cause);
    }
}
