package org.qbitspark.fileboxstorage.files_mng_service.repo;

import jakarta.persistence.LockModeType;
import org.qbitspark.fileboxstorage.files_mng_service.entity.FileEntity;
import org.qbitspark.fileboxstorage.files_mng_service.enums.FileLifecycle;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface FileRepository extends JpaRepository<FileEntity, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select f from FileEntity f where f.fileId = :fileId")
    Optional<FileEntity> findByIdForUpdate(@Param("fileId") UUID fileId);

    Optional<FileEntity> findByFileIdAndLifecycle(UUID fileId, FileLifecycle lifecycle);

    List<FileEntity> findByUserIdAndLifecycleAndDeletedAtBefore(UUID userId, FileLifecycle lifecycle,
                                                                LocalDateTime cutoff);

    // Children of a directory, every lifecycle
    List<FileEntity> findByParent_FileId(UUID parentId);

    List<FileEntity> findByParent_FileIdAndLifecycle(UUID parentId, FileLifecycle lifecycle);

    List<FileEntity> findByUserIdAndParentIsNull(UUID userId);

    List<FileEntity> findByUserIdAndParentIsNullAndLifecycle(UUID userId, FileLifecycle lifecycle);

    Optional<FileEntity> findFirstByUserIdAndParent_FileIdAndNameAndLifecycle(
            UUID userId, UUID parentId, String name, FileLifecycle lifecycle);

    Optional<FileEntity> findFirstByUserIdAndParentIsNullAndNameAndLifecycle(
            UUID userId, String name, FileLifecycle lifecycle);
}
