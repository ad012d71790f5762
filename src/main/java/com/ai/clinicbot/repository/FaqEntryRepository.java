package com.ai.clinicbot.repository;

import com.ai.clinicbot.entity.FaqEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface FaqEntryRepository extends JpaRepository<FaqEntry, UUID> {
    List<FaqEntry> findByOrganizationIdAndActiveTrueOrderByScopePriorityAscDisplayOrderAsc(UUID organizationId);
}
