package org.qbitspark.fileboxstorage.share_service.payload;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.qbitspark.fileboxstorage.share_service.entity.ShareEntity;
import org.qbitspark.fileboxstorage.share_service.enums.ShareAccessType;

import java.time.LocalDateTime;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ShareAccessGrant {
    private UUID shareId;
    private UUID fileId;
    private ShareAccessType accessType;
    private int downloadCount;
    private Integer maxDownloads;
    private LocalDateTime expiresAt;

    public static ShareAccessGrant from(ShareEntity share) {
        return ShareAccessGrant.builder()
                .shareId(share.getId())
                .fileId(share.getFileId())
                .accessType(share.getAccessType())
                .downloadCount(share.getDownloadCount())
                .maxDownloads(share.getMaxDownloads())
                .expiresAt(share.getExpiresAt())
                .build();
    }

    public boolean canDownload() {
        return accessType != null && accessType.allowsDownload();
    }
}
