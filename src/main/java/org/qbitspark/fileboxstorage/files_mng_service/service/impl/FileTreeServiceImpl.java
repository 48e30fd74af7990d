package org.qbitspark.fileboxstorage.files_mng_service.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.qbitspark.fileboxstorage.files_mng_service.entity.FileEntity;
import org.qbitspark.fileboxstorage.files_mng_service.enums.FileKind;
import org.qbitspark.fileboxstorage.files_mng_service.enums.FileLifecycle;
import org.qbitspark.fileboxstorage.files_mng_service.repo.FileRepository;
import org.qbitspark.fileboxstorage.files_mng_service.service.FileTreeService;
import org.qbitspark.fileboxstorage.globe_utils.KeyedLocks;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.InvalidOperationException;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.ItemNotFoundException;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.PermissionDeniedException;
import org.qbitspark.fileboxstorage.storage_service.utils.StorageKeys;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class FileTreeServiceImpl implements FileTreeService {

    private static final int MAX_NAME_LENGTH = 255;

    private final FileRepository fileRepository;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    // Tree mutations of one owner are serialized so name checks and inserts cannot interleave
    private final KeyedLocks ownerLocks = new KeyedLocks(256);

    @Override
    public FileEntity createDirectory(UUID userId, UUID parentId, String name)
            throws ItemNotFoundException, PermissionDeniedException, InvalidOperationException {
        return createNode(userId, parentId, name, FileKind.DIRECTORY, null);
    }

    @Override
    public FileEntity createFile(UUID userId, UUID parentId, String name, String mimeType)
            throws ItemNotFoundException, PermissionDeniedException, InvalidOperationException {
        return createNode(userId, parentId, name, FileKind.FILE,
                mimeType != null ? mimeType : StorageKeys.mimeTypeOf(name));
    }

    private FileEntity createNode(UUID userId, UUID parentId, String name, FileKind kind, String mimeType) {
        Objects.requireNonNull(userId, "userId");
        validateName(name);
        return ownerLocks.withLock(userId, () -> transactionTemplate.execute(status -> {
            FileEntity parent = parentId == null ? null : loadDirectory(userId, parentId);
            ensureNameAvailable(userId, parent, name, null);

            FileEntity node = new FileEntity();
            node.setUserId(userId);
            node.setParent(parent);
            node.setName(name);
            node.setLogicalPath(childPath(parent, name));
            node.setKind(kind);
            node.setMimeType(mimeType);
            node.setLifecycle(FileLifecycle.ACTIVE);
            FileEntity saved = fileRepository.save(node);
            log.info("Created {} {} for user {}", kind, saved.getLogicalPath(), userId);
            return saved;
        }));
    }

    @Override
    public FileEntity move(UUID userId, UUID nodeId, UUID newParentId)
            throws ItemNotFoundException, PermissionDeniedException, InvalidOperationException {
        return ownerLocks.withLock(userId, () -> transactionTemplate.execute(status -> {
            FileEntity node = loadOwned(userId, nodeId, false);
            FileEntity newParent = newParentId == null ? null : loadDirectory(userId, newParentId);
            if (newParent != null) {
                ensureNotWithin(node, newParent);
            }
            if (Objects.equals(node.getParentId(), newParentId)) {
                return node;
            }
            ensureNameAvailable(userId, newParent, node.getName(), node.getFileId());

            String oldPath = node.getLogicalPath();
            node.setParent(newParent);
            rewritePaths(node);
            log.info("Moved {} to {}", oldPath, node.getLogicalPath());
            return node;
        }));
    }

    @Override
    public FileEntity rename(UUID userId, UUID nodeId, String newName)
            throws ItemNotFoundException, PermissionDeniedException, InvalidOperationException {
        validateName(newName);
        return ownerLocks.withLock(userId, () -> transactionTemplate.execute(status -> {
            FileEntity node = loadOwned(userId, nodeId, false);
            if (node.getName().equals(newName)) {
                return node;
            }
            ensureNameAvailable(userId, node.getParent(), newName, node.getFileId());

            String oldPath = node.getLogicalPath();
            node.setName(newName);
            rewritePaths(node);
            log.info("Renamed {} to {}", oldPath, node.getLogicalPath());
            return node;
        }));
    }

    @Override
    public void softDelete(UUID userId, UUID nodeId) throws ItemNotFoundException, PermissionDeniedException {
        ownerLocks.runWithLock(userId, () -> transactionTemplate.executeWithoutResult(status -> {
            FileEntity node = loadOwned(userId, nodeId, false);
            LocalDateTime now = LocalDateTime.now(clock);
            tombstoneSubtree(node, now);
            log.info("Moved {} to trash", node.getLogicalPath());
        }));
    }

    private void tombstoneSubtree(FileEntity node, LocalDateTime when) {
        node.tombstone(when);
        fileRepository.save(node);
        if (node.isDirectory()) {
            for (FileEntity child : fileRepository.findByParent_FileIdAndLifecycle(node.getFileId(), FileLifecycle.ACTIVE)) {
                tombstoneSubtree(child, when);
            }
        }
    }

    @Override
    public FileEntity restore(UUID userId, UUID nodeId)
            throws ItemNotFoundException, PermissionDeniedException, InvalidOperationException {
        return ownerLocks.withLock(userId, () -> transactionTemplate.execute(status -> {
            FileEntity node = loadOwned(userId, nodeId, true);
            if (node.isActive()) {
                throw new InvalidOperationException("item is not in the trash");
            }
            FileEntity parent = node.getParent();
            if (parent != null && !parent.isActive()) {
                throw new InvalidOperationException("restore the parent folder " + parent.getLogicalPath() + " first");
            }
            ensureNameAvailable(userId, parent, node.getName(), node.getFileId());
            reviveSubtree(node, node.getDeletedAt());
            log.info("Restored {}", node.getLogicalPath());
            return node;
        }));
    }

    // Only descendants tombstoned in the same delete come back
    private void reviveSubtree(FileEntity node, LocalDateTime deletedAt) {
        node.revive();
        fileRepository.save(node);
        if (node.isDirectory()) {
            for (FileEntity child : fileRepository.findByParent_FileIdAndLifecycle(node.getFileId(), FileLifecycle.TOMBSTONED)) {
                if (Objects.equals(child.getDeletedAt(), deletedAt)) {
                    reviveSubtree(child, deletedAt);
                }
            }
        }
    }

    @Override
    public List<FileEntity> listChildren(UUID userId, UUID parentId, boolean includeTombstoned)
            throws ItemNotFoundException, PermissionDeniedException {
        if (parentId == null) {
            return includeTombstoned
                    ? fileRepository.findByUserIdAndParentIsNull(userId)
                    : fileRepository.findByUserIdAndParentIsNullAndLifecycle(userId, FileLifecycle.ACTIVE);
        }
        FileEntity parent = loadOwned(userId, parentId, includeTombstoned);
        return includeTombstoned
                ? fileRepository.findByParent_FileId(parent.getFileId())
                : fileRepository.findByParent_FileIdAndLifecycle(parent.getFileId(), FileLifecycle.ACTIVE);
    }

    @Override
    public FileEntity getNode(UUID userId, UUID nodeId, boolean includeTombstoned)
            throws ItemNotFoundException, PermissionDeniedException {
        return loadOwned(userId, nodeId, includeTombstoned);
    }

    /**
     * Walks from the prospective parent up to the root; meeting the node means the move would
     * create a cycle.
     */
    private void ensureNotWithin(FileEntity node, FileEntity newParent) {
        Set<UUID> visited = new HashSet<>();
        FileEntity cursor = newParent;
        while (cursor != null) {
            if (cursor.getFileId().equals(node.getFileId())) {
                throw new InvalidOperationException("cannot move " + node.getLogicalPath()
                        + " into itself or one of its descendants");
            }
            if (!visited.add(cursor.getFileId())) {
                throw new InvalidOperationException("folder hierarchy above " + newParent.getLogicalPath()
                        + " contains a cycle");
            }
            cursor = cursor.getParent();
        }
    }

    private void ensureNameAvailable(UUID userId, FileEntity parent, String name, UUID self) {
        Optional<FileEntity> holder = parent == null
                ? fileRepository.findFirstByUserIdAndParentIsNullAndNameAndLifecycle(userId, name, FileLifecycle.ACTIVE)
                : fileRepository.findFirstByUserIdAndParent_FileIdAndNameAndLifecycle(userId, parent.getFileId(), name, FileLifecycle.ACTIVE);
        if (holder.isPresent() && !holder.get().getFileId().equals(self)) {
            throw new InvalidOperationException("an item named '" + name + "' already exists in "
                    + (parent == null ? "/" : parent.getLogicalPath()));
        }
    }

    private void rewritePaths(FileEntity node) {
        node.setLogicalPath(childPath(node.getParent(), node.getName()));
        fileRepository.save(node);
        if (node.isDirectory()) {
            for (FileEntity child : fileRepository.findByParent_FileId(node.getFileId())) {
                rewritePaths(child);
            }
        }
    }

    private FileEntity loadDirectory(UUID userId, UUID directoryId) {
        FileEntity directory = loadOwned(userId, directoryId, false);
        if (!directory.isDirectory()) {
            throw new InvalidOperationException(directory.getLogicalPath() + " is not a folder");
        }
        return directory;
    }

    private FileEntity loadOwned(UUID userId, UUID nodeId, boolean includeTombstoned) {
        FileEntity node = fileRepository.findById(nodeId)
                .orElseThrow(() -> new ItemNotFoundException("item " + nodeId + " not found"));
        if (!includeTombstoned && !node.isActive()) {
            throw new ItemNotFoundException("item " + nodeId + " not found");
        }
        if (!node.getUserId().equals(userId)) {
            throw new PermissionDeniedException("item " + nodeId + " belongs to another user");
        }
        return node;
    }

    private static String childPath(FileEntity parent, String name) {
        return parent == null ? "/" + name : parent.getLogicalPath() + "/" + name;
    }

    private static void validateName(String name) {
        if (name == null || name.isBlank()) {
            throw new InvalidOperationException("name must not be empty");
        }
        if (name.length() > MAX_NAME_LENGTH) {
            throw new InvalidOperationException("name is longer than " + MAX_NAME_LENGTH + " characters");
        }
        if (name.contains("/") || name.contains("\\") || name.indexOf('\0') >= 0
                || ".".equals(name) || "..".equals(name)) {
            throw new InvalidOperationException("'" + name + "' is not a valid name");
        }
    }
}
