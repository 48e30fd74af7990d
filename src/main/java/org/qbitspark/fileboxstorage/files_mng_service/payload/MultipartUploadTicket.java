package org.qbitspark.fileboxstorage.files_mng_service.payload;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MultipartUploadTicket {
    private String uploadId;
    private UUID fileId;
    private Instant expiresAt;
    private long minimumPartSize;
}
