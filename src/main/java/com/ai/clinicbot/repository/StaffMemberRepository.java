package com.ai.clinicbot.repository;

import com.ai.clinicbot.entity.StaffMember;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface StaffMemberRepository extends JpaRepository<StaffMember, UUID> {
    Optional<StaffMember> findFirstByOrganizationIdAndRoleAndActiveTrueOrderByCreatedAtAsc(UUID organizationId, StaffMember.Role role);
}
