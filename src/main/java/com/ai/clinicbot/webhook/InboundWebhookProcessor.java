package com.ai.clinicbot.webhook;

import com.ai.clinicbot.conversation.BotRequest;
import com.ai.clinicbot.conversation.BotResponse;
import com.ai.clinicbot.conversation.ConversationEngine;
import com.ai.clinicbot.entity.ChannelLine;
import com.ai.clinicbot.entity.DeliveryStatus;
import com.ai.clinicbot.entity.MessageLog;
import com.ai.clinicbot.entity.MessagingProviderType;
import com.ai.clinicbot.messaging.GatewaySendRequest;
import com.ai.clinicbot.messaging.GatewaySendResult;
import com.ai.clinicbot.messaging.MessageType;
import com.ai.clinicbot.messaging.MessagingGateway;
import com.ai.clinicbot.repository.ChannelLineRepository;
import com.ai.clinicbot.service.LegacyIntentService;
import com.ai.clinicbot.service.MessageLogService;
import com.ai.clinicbot.utils.PhoneNumbers;
import com.fasterxml.jackson.databind.JsonNode;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Pattern;

/**
 * Processes one Meta webhook delivery after its signature has been checked. Messages and
 * status events of a change run concurrently; each event is isolated so one failure does
 * not abort the others.
 */
@Service
public class InboundWebhookProcessor {

    private static final Logger log = LoggerFactory.getLogger(InboundWebhookProcessor.class);

    static final String WHATSAPP_OBJECT = "whatsapp_business_account";
    private static final Pattern UUID_PATTERN = Pattern.compile(
            "^[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}$", Pattern.CASE_INSENSITIVE);
    private static final int MAX_BODY = 4000;

    private final ChannelLineRepository lineRepository;
    private final MessageLogService messageLogService;
    private final ConversationEngine conversationEngine;
    private final MessagingGateway messagingGateway;
    private final LegacyIntentService legacyIntentService;
    private final Executor executor;

    public InboundWebhookProcessor(ChannelLineRepository lineRepository,
                                   MessageLogService messageLogService,
                                   ConversationEngine conversationEngine,
                                   MessagingGateway messagingGateway,
                                   LegacyIntentService legacyIntentService,
                                   @Qualifier("webhookExecutor") Executor executor) {
        this.lineRepository = lineRepository;
        this.messageLogService = messageLogService;
        this.conversationEngine = conversationEngine;
        this.messagingGateway = messagingGateway;
        this.legacyIntentService = legacyIntentService;
        this.executor = executor;
    }

    public WebhookProcessingSummary process(JsonNode payload) {
        if (payload == null || !WHATSAPP_OBJECT.equals(payload.path("object").asText())) {
            log.debug("Ignoring webhook object {}", payload != null ? payload.path("object").asText() : null);
            return WebhookProcessingSummary.ignored();
        }
        ChannelLine line = resolveLine(payload);

        AtomicInteger messages = new AtomicInteger();
        AtomicInteger duplicates = new AtomicInteger();
        AtomicInteger statuses = new AtomicInteger();
        AtomicInteger failures = new AtomicInteger();

        for (JsonNode entry : payload.path("entry")) {
            for (JsonNode change : entry.path("changes")) {
                JsonNode value = change.path("value");
                List<CompletableFuture<Void>> tasks = new ArrayList<>();
                for (JsonNode message : value.path("messages")) {
                    tasks.add(runIsolated("message " + message.path("id").asText(), failures, () -> {
                        if (handleMessage(message, value.path("metadata"), line)) {
                            messages.incrementAndGet();
                        } else {
                            duplicates.incrementAndGet();
                        }
                    }));
                }
                for (JsonNode status : value.path("statuses")) {
                    tasks.add(runIsolated("status " + status.path("id").asText(), failures, () -> {
                        handleStatus(status);
                        statuses.incrementAndGet();
                    }));
                }
                CompletableFuture.allOf(tasks.toArray(new CompletableFuture[0])).join();
            }
        }
        WebhookProcessingSummary summary = new WebhookProcessingSummary(
                messages.get(), duplicates.get(), statuses.get(), failures.get());
        log.info("Webhook processed: {}", summary);
        return summary;
    }

    private CompletableFuture<Void> runIsolated(String label, AtomicInteger failures, Runnable task) {
        return CompletableFuture.runAsync(() -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                failures.incrementAndGet();
                log.error("Webhook {} failed", label, e);
            }
        }, executor);
    }

    private ChannelLine resolveLine(JsonNode payload) {
        String phoneNumberId = payload.path("entry").path(0).path("changes").path(0)
                .path("value").path("metadata").path("phone_number_id").asText("");
        if (phoneNumberId.isBlank()) return null;
        ChannelLine line = lineRepository.findFirstByMetaPhoneNumberIdAndActiveTrue(phoneNumberId).orElse(null);
        if (line == null) {
            log.warn("No active line for Meta phone number id {}", phoneNumberId);
        } else {
            log.debug("Resolved line {} org={} botEnabled={}", line.getId(), line.getOrganizationId(), line.isBotEnabled());
        }
        return line;
    }

    /** @return false when the message was already processed */
    private boolean handleMessage(JsonNode message, JsonNode metadata, ChannelLine line) {
        String messageId = StringUtils.trimToNull(message.path("id").asText(null));
        String fromPhone = PhoneNumbers.normalizeToE164(message.path("from").asText(""));
        String toPhone = PhoneNumbers.normalizeToE164(metadata.path("display_phone_number").asText(""));
        String text = extractText(message);
        UUID payloadAppointmentId = extractAppointmentId(message);

        MessageLog inbound = MessageLog.builder()
                .direction(MessageLog.Direction.INBOUND)
                .toPhone(toPhone)
                .fromPhone(fromPhone)
                .body(StringUtils.abbreviate(StringUtils.defaultIfEmpty(text, null), MAX_BODY))
                .type(MessageType.PATIENT_REPLY)
                .status(DeliveryStatus.RECEIVED)
                .provider(MessagingProviderType.META)
                .providerMessageId(messageId)
                .organizationId(line != null ? line.getOrganizationId() : null)
                .lineId(line != null ? line.getId() : null)
                .build();
        if (!messageLogService.claimInbound(inbound)) {
            log.info("Duplicate delivery of message {} skipped", messageId);
            return false;
        }
        log.info("Inbound from {} (line {}): payloadAppointment={}", fromPhone,
                line != null ? line.getId() : null, payloadAppointmentId);

        if (line != null && line.isBotEnabled() && payloadAppointmentId == null) {
            replyWithBot(line, fromPhone, text);
        } else {
            legacyIntentService.handle(line, inbound, text, payloadAppointmentId);
        }
        return true;
    }

    private void replyWithBot(ChannelLine line, String fromPhone, String text) {
        BotResponse response = conversationEngine.handle(
                new BotRequest(line.getId(), fromPhone, text, line.getOrganizationId()));
        GatewaySendResult sent = messagingGateway.send(GatewaySendRequest.builder()
                .to(fromPhone)
                .type(MessageType.GENERIC)
                .body(response.render())
                .organizationId(line.getOrganizationId())
                .lineId(line.getId())
                .build());
        if (!sent.isOk()) {
            log.error("Bot reply to {} not delivered: {} {}", fromPhone, sent.getErrorCode(), sent.getError());
        }
    }

    private void handleStatus(JsonNode status) {
        String messageId = status.path("id").asText("");
        String raw = status.path("status").asText("");
        DeliveryStatus mapped = DeliveryStatus.fromProviderStatus(raw);
        if (messageId.isBlank() || mapped == null) {
            log.debug("Skipping status '{}' for message '{}'", raw, messageId);
            return;
        }
        JsonNode error = status.path("errors").path(0);
        String errorCode = error.hasNonNull("code") ? error.get("code").asText() : null;
        String errorMessage = error.hasNonNull("title") ? error.get("title").asText()
                : error.hasNonNull("message") ? error.get("message").asText() : null;
        MessageLogService.StatusUpdate outcome = messageLogService.applyStatus(messageId, mapped, errorCode, errorMessage);
        log.info("Status {} for {}: {}", mapped, messageId, outcome);
    }

    /** Plain text, quick-reply button text, or interactive reply title, in that order. */
    static String extractText(JsonNode message) {
        String type = message.path("type").asText("");
        switch (type) {
            case "text":
                return message.path("text").path("body").asText("");
            case "button": {
                JsonNode button = message.path("button");
                return StringUtils.defaultIfBlank(button.path("text").asText(""), button.path("payload").asText(""));
            }
            case "interactive": {
                JsonNode reply = interactiveReply(message);
                return StringUtils.defaultIfBlank(reply.path("title").asText(""), reply.path("id").asText(""));
            }
            default:
                return "";
        }
    }

    /** Appointment id carried in a quick-reply payload, if the payload has UUID shape. */
    static UUID extractAppointmentId(JsonNode message) {
        String type = message.path("type").asText("");
        String payload;
        if ("button".equals(type)) {
            payload = message.path("button").path("payload").asText("");
        } else if ("interactive".equals(type)) {
            payload = interactiveReply(message).path("id").asText("");
        } else {
            return null;
        }
        payload = payload.trim();
        return UUID_PATTERN.matcher(payload).matches() ? UUID.fromString(payload) : null;
    }

    private static JsonNode interactiveReply(JsonNode message) {
        JsonNode interactive = message.path("interactive");
        return interactive.has("button_reply") ? interactive.path("button_reply") : interactive.path("list_reply");
    }
}
