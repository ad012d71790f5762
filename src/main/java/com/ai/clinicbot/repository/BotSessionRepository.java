package com.ai.clinicbot.repository;

import com.ai.clinicbot.entity.BotSession;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface BotSessionRepository extends JpaRepository<BotSession, UUID> {
    Optional<BotSession> findByLineIdAndPatientPhone(UUID lineId, String patientPhone);
}
