package org.qbitspark.fileboxstorage.globeadvice.exceptions;

public class ShareRevokedException extends StorageException {

    public ShareRevokedException(String message) {
        super(StorageErrorCode.SHARE_REVOKED, message);
    }
}
