package org.qbitspark.fileboxstorage.files_mng_service.payload;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeletionResult {
    private int deletedItems;
    private long releasedBytes;
    private List<String> orphanedKeys;
}
