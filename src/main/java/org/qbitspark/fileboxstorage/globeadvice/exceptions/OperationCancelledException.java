package org.qbitspark.fileboxstorage.globeadvice.exceptions;

public class OperationCancelledException extends StorageException {

    public OperationCancelledException(String message) {
        super(StorageErrorCode.CANCELLED, message);
    }

    public OperationCancelledException(String message, String operation, String key, Throwable cause) {
        super(StorageErrorCode.CANCELLED, message, operation, key, cause);
    }
}
