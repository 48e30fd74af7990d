package org.qbitspark.fileboxstorage.globeadvice.exceptions;

public class ShareExpiredException extends StorageException {

    public ShareExpiredException(String message) {
        super(StorageErrorCode.SHARE_EXPIRED, message);
    }
}
