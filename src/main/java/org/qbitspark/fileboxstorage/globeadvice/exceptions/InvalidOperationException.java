package org.qbitspark.fileboxstorage.globeadvice.exceptions;

public class InvalidOperationException extends StorageException {

    public InvalidOperationException(String message) {
        super(StorageErrorCode.INVALID_OPERATION, message);
    }
}
