package org.qbitspark.fileboxstorage.storage_service.payload;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Identifies one uploaded part of a multipart upload. The etag is what the backend returned for
 * the part and must be echoed back unchanged on completion.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UploadedPart {
    private int partNumber;
    private String etag;
    private long size;
}
