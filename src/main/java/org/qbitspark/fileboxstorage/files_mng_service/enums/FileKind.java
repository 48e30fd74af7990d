package org.qbitspark.fileboxstorage.files_mng_service.enums;

public enum FileKind {
    FILE,
    DIRECTORY
}
