package org.qbitspark.fileboxstorage.quota_service.repo;

import jakarta.persistence.LockModeType;
import org.qbitspark.fileboxstorage.quota_service.entity.UserQuotaEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface UserQuotaRepository extends JpaRepository<UserQuotaEntity, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select q from UserQuotaEntity q where q.userId = :userId")
    Optional<UserQuotaEntity> findByUserIdForUpdate(@Param("userId") UUID userId);
}
