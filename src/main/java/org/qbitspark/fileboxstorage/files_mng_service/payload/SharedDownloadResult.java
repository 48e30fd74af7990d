package org.qbitspark.fileboxstorage.files_mng_service.payload;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SharedDownloadResult {
    private UUID fileId;
    private String fileName;
    private String mimeType;
    private long bytesTransferred;
    private int downloadCount;
}
