package org.qbitspark.fileboxstorage.share_service.enums;

public enum ShareAccessType {
    VIEW,
    DOWNLOAD,
    EDIT;

    public boolean allowsDownload() {
        return this == DOWNLOAD || this == EDIT;
    }
}
