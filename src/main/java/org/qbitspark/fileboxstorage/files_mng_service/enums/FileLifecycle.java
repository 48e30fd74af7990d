package org.qbitspark.fileboxstorage.files_mng_service.enums;

public enum FileLifecycle {
    ACTIVE,
    TOMBSTONED
}
