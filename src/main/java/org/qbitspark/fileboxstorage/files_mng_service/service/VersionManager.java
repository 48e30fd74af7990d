package org.qbitspark.fileboxstorage.files_mng_service.service;

import org.qbitspark.fileboxstorage.files_mng_service.entity.FileEntity;
import org.qbitspark.fileboxstorage.files_mng_service.entity.FileVersionEntity;
import org.qbitspark.fileboxstorage.files_mng_service.payload.PruneResult;
import org.qbitspark.fileboxstorage.files_mng_service.payload.RecordVersionRequest;
import org.qbitspark.fileboxstorage.files_mng_service.payload.VersionContent;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.CorruptionException;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.InvalidOperationException;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.ItemNotFoundException;

import java.util.List;
import java.util.UUID;

/**
 * Owns the version history of files. Every mutation for one file runs in a critical section
 * keyed by the file id, so version numbers stay contiguous from 1 under concurrent writers.
 */
public interface VersionManager {

    /**
     * Assigns the next version number and makes it current. Content under a {@code temp/} key is
     * moved to its permanent version key first.
     */
    FileVersionEntity recordVersion(RecordVersionRequest request)
            throws ItemNotFoundException, InvalidOperationException;

    /**
     * Points the file at an earlier version. No content is copied and no new version is created.
     */
    FileEntity rollback(UUID fileId, int versionNumber) throws ItemNotFoundException, InvalidOperationException;

    /**
     * @throws org.qbitspark.fileboxstorage.globeadvice.exceptions.CorruptionException when the
     *         stored object no longer matches what was recorded
     */
    VersionContent openVersion(UUID fileId, int versionNumber) throws ItemNotFoundException, CorruptionException;

    VersionContent openCurrentVersion(UUID fileId) throws ItemNotFoundException, CorruptionException;

    List<FileVersionEntity> listVersions(UUID fileId);

    FileVersionEntity getVersion(UUID fileId, int versionNumber) throws ItemNotFoundException;

    /**
     * Drops all but the newest {@code keepLast} versions. The current version always survives.
     */
    PruneResult pruneVersions(UUID fileId, int keepLast) throws InvalidOperationException;

    /**
     * Drops every version of the file, metadata first, then content.
     */
    PruneResult purgeVersions(UUID fileId);
}
