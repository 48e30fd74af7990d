package org.qbitspark.fileboxstorage.globeadvice.exceptions;

public class DownloadFailedException extends StorageException {

    public DownloadFailedException(String message) {
        super(StorageErrorCode.DOWNLOAD_FAILED, message);
    }

    public DownloadFailedException(String message, String operation, String key, Throwable cause) {
        super(StorageErrorCode.DOWNLOAD_FAILED, message, operation, key, cause);
    }
}
