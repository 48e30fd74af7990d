package org.qbitspark.fileboxstorage.quota_service.payload;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QuotaUsage {
    private UUID userId;
    private long storageQuota;
    private long usedStorage;
    private long reservedStorage;
    private long availableStorage;
}
