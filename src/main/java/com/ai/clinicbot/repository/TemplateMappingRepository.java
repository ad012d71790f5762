package com.ai.clinicbot.repository;

import com.ai.clinicbot.entity.MessagingProviderType;
import com.ai.clinicbot.entity.TemplateMapping;
import com.ai.clinicbot.messaging.MessageType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface TemplateMappingRepository extends JpaRepository<TemplateMapping, UUID> {
    List<TemplateMapping> findByLineIdAndLogicalTypeAndProviderAndActiveTrue(
            UUID lineId, MessageType logicalType, MessagingProviderType provider);
}
