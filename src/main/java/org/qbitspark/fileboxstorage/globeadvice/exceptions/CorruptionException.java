package org.qbitspark.fileboxstorage.globeadvice.exceptions;

public class CorruptionException extends StorageException {

    public CorruptionException(String message) {
        super(StorageErrorCode.CORRUPTION, message);
    }

    public CorruptionException(String message, String operation, String key, Throwable cause) {
        super(StorageErrorCode.CORRUPTION, message, operation, key, cause);
    }
}
