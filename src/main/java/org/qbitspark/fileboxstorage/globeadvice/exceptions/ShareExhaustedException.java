package org.qbitspark.fileboxstorage.globeadvice.exceptions;

public class ShareExhaustedException extends StorageException {

    public ShareExhaustedException(String message) {
        super(StorageErrorCode.SHARE_EXHAUSTED, message);
    }
}
