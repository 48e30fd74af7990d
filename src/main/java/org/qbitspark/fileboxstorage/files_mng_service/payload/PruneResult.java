package org.qbitspark.fileboxstorage.files_mng_service.payload;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Outcome of removing version content. Keys listed in {@code orphanedKeys} lost their metadata but
 * could not be deleted from the backend and need a manual sweep.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PruneResult {
    private List<Integer> removedVersions;
    private long releasedBytes;
    private List<String> orphanedKeys;
}
