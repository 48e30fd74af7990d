package org.qbitspark.fileboxstorage.globeadvice.exceptions;

public class ShareForbiddenException extends StorageException {

    public ShareForbiddenException(String message) {
        super(StorageErrorCode.SHARE_FORBIDDEN, message);
    }
}
