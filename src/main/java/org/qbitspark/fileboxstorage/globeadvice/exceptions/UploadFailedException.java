package org.qbitspark.fileboxstorage.globeadvice.exceptions;

public class UploadFailedException extends StorageException {

    public UploadFailedException(String message) {
        super(StorageErrorCode.UPLOAD_FAILED, message);
    }

    public UploadFailedException(String message, String operation, String key, Throwable cause) {
        super(StorageErrorCode.UPLOAD_FAILED, message, operation, key, cause);
    }
}
