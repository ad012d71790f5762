package com.ai.clinicbot.repository;

import com.ai.clinicbot.entity.MessageLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import jakarta.persistence.LockModeType;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface MessageLogRepository extends JpaRepository<MessageLog, UUID> {

    boolean existsByProviderMessageId(String providerMessageId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT m FROM MessageLog m WHERE m.providerMessageId = :providerMessageId")
    Optional<MessageLog> findByProviderMessageIdForUpdate(@Param("providerMessageId") String providerMessageId);
}
