package org.qbitspark.fileboxstorage.globeadvice.exceptions;

public class UnsupportedBackendException extends StorageException {

    public UnsupportedBackendException(String message) {
        super(StorageErrorCode.UNSUPPORTED_BACKEND, message);
    }
}
