package org.qbitspark.fileboxstorage.globeadvice.exceptions;

public class DeleteFailedException extends StorageException {

    public DeleteFailedException(String message) {
        super(StorageErrorCode.DELETE_FAILED, message);
    }

    public DeleteFailedException(String message, String operation, String key, Throwable cause) {
        super(StorageErrorCode.DELETE_FAILED, message, operation, key, cause);
    }
}
