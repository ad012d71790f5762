package com.ai.clinicbot.repository;

import com.ai.clinicbot.entity.ChannelLine;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface ChannelLineRepository extends JpaRepository<ChannelLine, UUID> {

    Optional<ChannelLine> findFirstByActiveTrueOrderByCreatedAtDesc();

    Optional<ChannelLine> findFirstByOrganizationIdAndActiveTrueOrderByCreatedAtDesc(UUID organizationId);

    Optional<ChannelLine> findFirstByMetaPhoneNumberIdAndActiveTrue(String metaPhoneNumberId);
}
