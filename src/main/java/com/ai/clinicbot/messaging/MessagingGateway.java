package com.ai.clinicbot.messaging;

import com.ai.clinicbot.entity.ChannelLine;
import com.ai.clinicbot.entity.DeliveryStatus;
import com.ai.clinicbot.entity.MessageLog;
import com.ai.clinicbot.entity.MessagingProviderType;
import com.ai.clinicbot.entity.TemplateMapping;
import com.ai.clinicbot.messaging.provider.MessagingDefaults;
import com.ai.clinicbot.messaging.provider.MessagingProvider;
import com.ai.clinicbot.messaging.provider.MessagingProviderFactory;
import com.ai.clinicbot.messaging.provider.ProviderRequest;
import com.ai.clinicbot.messaging.provider.ProviderResult;
import com.ai.clinicbot.repository.ChannelLineRepository;
import com.ai.clinicbot.repository.OrganizationRepository;
import com.ai.clinicbot.repository.TemplateMappingRepository;
import com.ai.clinicbot.service.MessageLogService;
import com.ai.clinicbot.utils.PhoneNumbers;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Every outbound WhatsApp message goes through here: line and provider resolution, the
 * organization kill switch, template lookup, delivery and logging. Never throws; failures
 * come back as a {@link GatewaySendResult} with an error code.
 */
@Service
public class MessagingGateway {

    private static final Logger log = LoggerFactory.getLogger(MessagingGateway.class);
    private static final int MIN_PHONE_LENGTH = 5;
    private static final String DEFAULT_LANGUAGE = "es";

    private final ChannelLineRepository lineRepository;
    private final OrganizationRepository organizationRepository;
    private final TemplateMappingRepository templateMappingRepository;
    private final MessagingProviderFactory providerFactory;
    private final MessagingDefaults defaults;
    private final MessageLogService messageLogService;

    public MessagingGateway(ChannelLineRepository lineRepository,
                            OrganizationRepository organizationRepository,
                            TemplateMappingRepository templateMappingRepository,
                            MessagingProviderFactory providerFactory,
                            MessagingDefaults defaults,
                            MessageLogService messageLogService) {
        this.lineRepository = lineRepository;
        this.organizationRepository = organizationRepository;
        this.templateMappingRepository = templateMappingRepository;
        this.providerFactory = providerFactory;
        this.defaults = defaults;
        this.messageLogService = messageLogService;
    }

    public GatewaySendResult send(GatewaySendRequest request) {
        try {
            return doSend(request);
        } catch (RuntimeException e) {
            log.error("Unexpected gateway failure sending to {}", request.getTo(), e);
            return GatewaySendResult.failure(GatewayErrorCodes.UPSTREAM_ERROR, "Internal messaging error", null);
        }
    }

    private GatewaySendResult doSend(GatewaySendRequest request) {
        MessageType type = request.getType() != null ? request.getType() : MessageType.GENERIC;
        if (StringUtils.length(StringUtils.trim(request.getTo())) < MIN_PHONE_LENGTH) {
            return GatewaySendResult.failure(GatewayErrorCodes.VALIDATION_ERROR, "to is required", null);
        }
        String to = PhoneNumbers.normalizeToE164(request.getTo());

        ChannelLine line = resolveLine(request).orElse(null);
        if (line == null) {
            log.error("No active WhatsApp line for organization {}", request.getOrganizationId());
            return GatewaySendResult.failure(GatewayErrorCodes.NO_ACTIVE_LINE, "No active WhatsApp line configured", null);
        }
        UUID organizationId = line.getOrganizationId() != null ? line.getOrganizationId() : request.getOrganizationId();

        if (isMessagingDisabled(organizationId)) {
            log.warn("Messaging disabled for organization {}, blocking {} to {}", organizationId, type.code(), to);
            record(request, line, organizationId, to, type, null, ProviderResult.failed(line.getProvider(),
                    "Organization messaging is disabled", GatewayErrorCodes.MESSAGING_DISABLED));
            return GatewaySendResult.failure(GatewayErrorCodes.MESSAGING_DISABLED,
                    "Messaging is disabled for this organization", line.getProvider());
        }

        MessagingProvider provider = providerFactory.create(line).orElse(null);
        if (provider == null) {
            return GatewaySendResult.failure(GatewayErrorCodes.PROVIDER_NOT_CONFIGURED,
                    "Provider " + line.getProvider().code() + " not configured correctly", line.getProvider());
        }

        ResolvedTemplate template = resolveTemplate(request, type, line);
        if (template == null && StringUtils.isBlank(request.getBody())) {
            if (type != MessageType.GENERIC && hasPendingMapping(line, type)) {
                return GatewaySendResult.failure(GatewayErrorCodes.TEMPLATE_PENDING_APPROVAL,
                        "Template pending provider approval", line.getProvider());
            }
            return GatewaySendResult.failure(GatewayErrorCodes.VALIDATION_ERROR,
                    "A type with a configured template, templateName, or body is required", line.getProvider());
        }

        ProviderRequest providerRequest;
        if (template != null) {
            List<String> payloads = provider.supportsQuickReplies() && request.getAppointmentId() != null && type.hasQuickReplies()
                    ? List.of(request.getAppointmentId().toString(), request.getAppointmentId().toString())
                    : List.of();
            providerRequest = ProviderRequest.template(to, template.name(), template.language(),
                    cleanParams(request.getTemplateParams()), payloads);
        } else {
            providerRequest = ProviderRequest.text(to, request.getBody());
        }

        ProviderResult result;
        try {
            result = provider.sendMessage(providerRequest);
        } catch (RuntimeException e) {
            log.error("{} send to {} failed", provider.type().code(), to, e);
            result = ProviderResult.failed(provider.type(), e.getMessage(), GatewayErrorCodes.UPSTREAM_ERROR);
        }
        log.info("Gateway {} {} to {}: ok={} id={}", provider.type().code(), type.code(), to,
                result.ok(), result.providerMessageId());

        record(request, line, organizationId, to, type, template, result);
        if (result.ok()) {
            return GatewaySendResult.builder()
                    .ok(true)
                    .status("sent")
                    .providerMessageId(result.providerMessageId())
                    .provider(result.provider().code())
                    .build();
        }
        return GatewaySendResult.failure(StringUtils.defaultIfBlank(result.errorCode(), GatewayErrorCodes.UPSTREAM_ERROR),
                StringUtils.defaultIfBlank(result.error(), "Error sending message"), result.provider());
    }

    private Optional<ChannelLine> resolveLine(GatewaySendRequest request) {
        if (request.getLineId() != null) {
            return lineRepository.findById(request.getLineId()).filter(ChannelLine::isActive);
        }
        if (request.getOrganizationId() != null) {
            return lineRepository.findFirstByOrganizationIdAndActiveTrueOrderByCreatedAtDesc(request.getOrganizationId());
        }
        return lineRepository.findFirstByActiveTrueOrderByCreatedAtDesc();
    }

    private boolean isMessagingDisabled(UUID organizationId) {
        if (organizationId == null) return false;
        return organizationRepository.findById(organizationId)
                .map(org -> !org.isMessagingEnabled())
                .orElse(false);
    }

    /**
     * Explicit name first, then an approved mapping for the line, then (Twilio only) the
     * environment content SID for the type.
     */
    private ResolvedTemplate resolveTemplate(GatewaySendRequest request, MessageType type, ChannelLine line) {
        if (StringUtils.isNotBlank(request.getTemplateName())) {
            return new ResolvedTemplate(request.getTemplateName().trim(), DEFAULT_LANGUAGE);
        }
        if (type == MessageType.GENERIC) return null;
        Optional<TemplateMapping> mapping = mappings(line, type).stream()
                .filter(m -> m.getApprovalStatus() == TemplateMapping.ApprovalStatus.APPROVED)
                .findFirst();
        if (mapping.isPresent()) {
            return new ResolvedTemplate(mapping.get().getTemplateName(),
                    StringUtils.defaultIfBlank(mapping.get().getTemplateLanguage(), DEFAULT_LANGUAGE));
        }
        if (line.getProvider() == MessagingProviderType.TWILIO) {
            return defaults.twilioContentSid(type)
                    .map(sid -> new ResolvedTemplate(sid, DEFAULT_LANGUAGE))
                    .orElse(null);
        }
        return null;
    }

    private boolean hasPendingMapping(ChannelLine line, MessageType type) {
        return mappings(line, type).stream()
                .anyMatch(m -> m.getApprovalStatus() == TemplateMapping.ApprovalStatus.PENDING);
    }

    private List<TemplateMapping> mappings(ChannelLine line, MessageType type) {
        return templateMappingRepository.findByLineIdAndLogicalTypeAndProviderAndActiveTrue(
                line.getId(), type, line.getProvider());
    }

    private void record(GatewaySendRequest request, ChannelLine line, UUID organizationId, String to,
                        MessageType type, ResolvedTemplate template, ProviderResult result) {
        String body = request.getBody() != null ? request.getBody()
                : template != null ? "template:" + template.name()
                : "template:" + type.code();
        MessageLog entry = MessageLog.builder()
                .direction(MessageLog.Direction.OUTBOUND)
                .toPhone(to)
                .fromPhone(line.getPhoneNumber())
                .body(StringUtils.abbreviate(body, 4000))
                .templateName(template != null ? template.name() : null)
                .type(type)
                .status(result.ok() ? DeliveryStatus.SENT : DeliveryStatus.FAILED)
                .provider(line.getProvider())
                .providerMessageId(result.providerMessageId())
                .appointmentId(request.getAppointmentId())
                .patientId(request.getPatientId())
                .doctorId(request.getDoctorId())
                .organizationId(organizationId)
                .lineId(line.getId())
                .errorCode(result.errorCode())
                .errorMessage(StringUtils.abbreviate(result.error(), 1000))
                .build();
        try {
            messageLogService.record(entry);
        } catch (RuntimeException e) {
            log.error("Could not log outbound message to {} (provider id {})", to, result.providerMessageId(), e);
        }
    }

    private static Map<String, String> cleanParams(Map<String, String> params) {
        Map<String, String> clean = new LinkedHashMap<>();
        if (params != null) {
            params.forEach((k, v) -> {
                if (k != null && v != null) clean.put(k, v);
            });
        }
        return clean;
    }

    private record ResolvedTemplate(String name, String language) {
    }
}
