package org.qbitspark.fileboxstorage.globeadvice.exceptions;

public class PermissionDeniedException extends StorageException {

    public PermissionDeniedException(String message) {
        super(StorageErrorCode.PERMISSION_DENIED, message);
    }
}
