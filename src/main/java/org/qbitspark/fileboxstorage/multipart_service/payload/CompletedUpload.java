package org.qbitspark.fileboxstorage.multipart_service.payload;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.qbitspark.fileboxstorage.quota_service.payload.QuotaReservation;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompletedUpload {
    private String uploadId;
    private String key;
    private long totalSize;
    private int partCount;
    private QuotaReservation reservation;
}
