package org.qbitspark.fileboxstorage.files_mng_service.service;

import org.qbitspark.fileboxstorage.files_mng_service.entity.FileEntity;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.InvalidOperationException;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.ItemNotFoundException;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.PermissionDeniedException;

import java.util.List;
import java.util.UUID;

/**
 * Keeps each owner's tree acyclic and sibling names unique among active entries.
 * A null parent id means the owner's root.
 */
public interface FileTreeService {

    FileEntity createDirectory(UUID userId, UUID parentId, String name)
            throws ItemNotFoundException, PermissionDeniedException, InvalidOperationException;

    FileEntity createFile(UUID userId, UUID parentId, String name, String mimeType)
            throws ItemNotFoundException, PermissionDeniedException, InvalidOperationException;

    /**
     * @throws org.qbitspark.fileboxstorage.globeadvice.exceptions.InvalidOperationException if the
     *         target is the node itself, one of its descendants, or already holds the name
     */
    FileEntity move(UUID userId, UUID nodeId, UUID newParentId)
            throws ItemNotFoundException, PermissionDeniedException, InvalidOperationException;

    FileEntity rename(UUID userId, UUID nodeId, String newName)
            throws ItemNotFoundException, PermissionDeniedException, InvalidOperationException;

    /**
     * Tombstones the node and its whole subtree.
     */
    void softDelete(UUID userId, UUID nodeId) throws ItemNotFoundException, PermissionDeniedException;

    /**
     * Brings back the node and the descendants removed together with it.
     */
    FileEntity restore(UUID userId, UUID nodeId)
            throws ItemNotFoundException, PermissionDeniedException, InvalidOperationException;

    List<FileEntity> listChildren(UUID userId, UUID parentId, boolean includeTombstoned)
            throws ItemNotFoundException, PermissionDeniedException;

    FileEntity getNode(UUID userId, UUID nodeId, boolean includeTombstoned)
            throws ItemNotFoundException, PermissionDeniedException;
}
