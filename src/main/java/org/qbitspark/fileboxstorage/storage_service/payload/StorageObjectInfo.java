package org.qbitspark.fileboxstorage.storage_service.payload;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StorageObjectInfo {
    private String key;
    private long size;
    private Instant lastModified;
    private boolean directory;
    private String mimeType;
    private String etag;
}
