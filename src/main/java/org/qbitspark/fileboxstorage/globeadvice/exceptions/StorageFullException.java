package org.qbitspark.fileboxstorage.globeadvice.exceptions;

public class StorageFullException extends StorageException {

    public StorageFullException(String message) {
        super(StorageErrorCode.STORAGE_FULL, message);
    }
}
