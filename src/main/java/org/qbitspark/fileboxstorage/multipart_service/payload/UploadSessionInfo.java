package org.qbitspark.fileboxstorage.multipart_service.payload;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.qbitspark.fileboxstorage.multipart_service.enums.UploadSessionState;
import org.qbitspark.fileboxstorage.storage_service.payload.UploadedPart;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UploadSessionInfo {
    private String uploadId;
    private String key;
    private UUID fileId;
    private UploadSessionState state;
    private Instant createdAt;
    private Instant expiresAt;
    private List<UploadedPart> parts;
}
