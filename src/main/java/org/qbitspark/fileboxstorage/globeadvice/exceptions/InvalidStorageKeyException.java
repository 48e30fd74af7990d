package org.qbitspark.fileboxstorage.globeadvice.exceptions;

public class InvalidStorageKeyException extends StorageException {

    public InvalidStorageKeyException(String message) {
        super(StorageErrorCode.INVALID_KEY, message);
    }

    public InvalidStorageKeyException(String message, String operation, String key, Throwable cause) {
        super(StorageErrorCode.INVALID_KEY, message, operation, key, cause);
    }
}
