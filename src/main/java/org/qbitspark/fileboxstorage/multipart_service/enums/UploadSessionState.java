package org.qbitspark.fileboxstorage.multipart_service.enums;

public enum UploadSessionState {
    INITIATED,
    PARTS_UPLOADING,
    COMPLETED,
    ABORTED;

    public boolean isTerminal() {
        return this == COMPLETED || this == ABORTED;
    }
}
