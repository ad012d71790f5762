package com.ai.clinicbot.service;

import com.ai.clinicbot.component.BotMessages;
import com.ai.clinicbot.entity.StaffMember;
import com.ai.clinicbot.messaging.GatewaySendRequest;
import com.ai.clinicbot.messaging.GatewaySendResult;
import com.ai.clinicbot.messaging.MessageType;
import com.ai.clinicbot.messaging.MessagingGateway;
import com.ai.clinicbot.repository.StaffMemberRepository;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Tells the organization's secretary that a patient asked for a human. Best effort:
 * failures are logged and never reach the patient's conversation.
 */
@Service
public class StaffNotificationService {

    private static final Logger log = LoggerFactory.getLogger(StaffNotificationService.class);

    private final StaffMemberRepository staffMemberRepository;
    private final MessagingGateway messagingGateway;
    private final BotMessages messages;

    public StaffNotificationService(StaffMemberRepository staffMemberRepository,
                                    MessagingGateway messagingGateway,
                                    BotMessages messages) {
        this.staffMemberRepository = staffMemberRepository;
        this.messagingGateway = messagingGateway;
        this.messages = messages;
    }

    public void notifyHandoff(UUID organizationId, UUID lineId, String patientPhone) {
        if (organizationId == null) {
            log.warn("Handoff for {} without organization, nobody to notify", patientPhone);
            return;
        }
        try {
            StaffMember secretary = staffMemberRepository
                    .findFirstByOrganizationIdAndRoleAndActiveTrueOrderByCreatedAtAsc(organizationId, StaffMember.Role.SECRETARY)
                    .orElse(null);
            if (secretary == null) {
                log.info("Handoff for {} in organization {}: no active secretary", patientPhone, organizationId);
                return;
            }
            if (StringUtils.isBlank(secretary.getPhone())) {
                log.info("Handoff for {}: secretary {} has no phone on file", patientPhone, secretary.getId());
                return;
            }
            GatewaySendResult result = messagingGateway.send(GatewaySendRequest.builder()
                    .to(secretary.getPhone())
                    .type(MessageType.GENERIC)
                    .body(messages.staffHandoffNotice(patientPhone))
                    .organizationId(organizationId)
                    .lineId(lineId)
                    .build());
            if (!result.isOk()) {
                log.warn("Handoff notice to secretary {} failed: {} {}", secretary.getId(), result.getErrorCode(), result.getError());
            }
        } catch (RuntimeException e) {
            log.error("Handoff notification failed for organization {}", organizationId, e);
        }
    }
}
