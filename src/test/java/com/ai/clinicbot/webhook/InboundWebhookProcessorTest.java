package com.ai.clinicbot.webhook;

import com.ai.clinicbot.conversation.BotRequest;
import com.ai.clinicbot.conversation.BotResponse;
import com.ai.clinicbot.conversation.ConversationEngine;
import com.ai.clinicbot.conversation.ConversationState;
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
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class InboundWebhookProcessorTest {

    private static final UUID LINE_ID = UUID.fromString("00000000-0000-0000-0000-0000000000a1");
    private static final UUID ORG_ID = UUID.fromString("00000000-0000-0000-0000-0000000000b1");
    private static final String APPOINTMENT_ID = "3f1c2d9e-8a7b-4c6d-9e0f-112233445566";

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Mock
    private ChannelLineRepository lineRepository;
    @Mock
    private MessageLogService messageLogService;
    @Mock
    private ConversationEngine conversationEngine;
    @Mock
    private MessagingGateway messagingGateway;
    @Mock
    private LegacyIntentService legacyIntentService;

    private InboundWebhookProcessor processor;
    private ChannelLine line;

    @BeforeEach
    void setUp() {
        processor = new InboundWebhookProcessor(lineRepository, messageLogService, conversationEngine,
                messagingGateway, legacyIntentService, Runnable::run);
        line = ChannelLine.builder()
                .id(LINE_ID)
                .organizationId(ORG_ID)
                .phoneNumber("+50422223333")
                .provider(MessagingProviderType.META)
                .metaPhoneNumberId("1098765")
                .botEnabled(true)
                .build();
        lenient().when(lineRepository.findFirstByMetaPhoneNumberIdAndActiveTrue("1098765")).thenReturn(Optional.of(line));
        lenient().when(messagingGateway.send(any())).thenReturn(GatewaySendResult.builder().ok(true).status("sent").build());
    }

    @Test
    void redeliveredMessageReachesTheBotOnce() throws Exception {
        Set<String> claimed = ConcurrentHashMap.newKeySet();
        when(messageLogService.claimInbound(any())).thenAnswer(inv -> claimed.add(inv.<MessageLog>getArgument(0).getProviderMessageId()));
        when(conversationEngine.handle(any())).thenReturn(
                BotResponse.ask("Hola", List.of("Agendar cita"), ConversationState.MAIN_MENU));
        JsonNode payload = textMessage("wamid.1", "hola");

        WebhookProcessingSummary first = processor.process(payload);
        WebhookProcessingSummary second = processor.process(payload);

        assertEquals(1, first.messages());
        assertEquals(0, second.messages());
        assertEquals(1, second.duplicates());
        verify(conversationEngine, times(1)).handle(any());
        verify(messagingGateway, times(1)).send(any());
    }

    @Test
    void botReplyGoesOutOnTheSameLine() throws Exception {
        when(messageLogService.claimInbound(any())).thenReturn(true);
        when(conversationEngine.handle(any())).thenReturn(
                BotResponse.ask("Elija", List.of("Agendar cita", "Preguntas"), ConversationState.MAIN_MENU));

        processor.process(textMessage("wamid.2", "hola"));

        ArgumentCaptor<BotRequest> botRequest = ArgumentCaptor.forClass(BotRequest.class);
        verify(conversationEngine).handle(botRequest.capture());
        assertEquals("+50493133496", botRequest.getValue().patientPhone());
        assertEquals("hola", botRequest.getValue().messageText());
        assertEquals(LINE_ID, botRequest.getValue().lineId());

        ArgumentCaptor<GatewaySendRequest> sent = ArgumentCaptor.forClass(GatewaySendRequest.class);
        verify(messagingGateway).send(sent.capture());
        assertEquals(MessageType.GENERIC, sent.getValue().getType());
        assertEquals(LINE_ID, sent.getValue().getLineId());
        assertEquals("Elija\n1. Agendar cita\n2. Preguntas", sent.getValue().getBody());
    }

    @Test
    void appointmentPayloadBypassesTheBot() throws Exception {
        when(messageLogService.claimInbound(any())).thenReturn(true);
        JsonNode payload = objectMapper.readTree("""
                {"object":"whatsapp_business_account","entry":[{"changes":[{"value":{
                  "metadata":{"phone_number_id":"1098765","display_phone_number":"50422223333"},
                  "messages":[{"id":"wamid.3","from":"50493133496","type":"button",
                    "button":{"text":"Confirmar","payload":"%s"}}]}}]}]}
                """.formatted(APPOINTMENT_ID));

        processor.process(payload);

        verifyNoInteractions(conversationEngine);
        verify(legacyIntentService).handle(eq(line), any(MessageLog.class), eq("Confirmar"), eq(UUID.fromString(APPOINTMENT_ID)));
    }

    @Test
    void unknownLineFallsBackToIntentMatching() throws Exception {
        when(lineRepository.findFirstByMetaPhoneNumberIdAndActiveTrue("1098765")).thenReturn(Optional.empty());
        when(messageLogService.claimInbound(any())).thenReturn(true);

        processor.process(textMessage("wamid.4", "confirmar"));

        verifyNoInteractions(conversationEngine);
        verify(legacyIntentService).handle(isNull(), any(MessageLog.class), eq("confirmar"), isNull());
    }

    @Test
    void statusEventsAreMappedAndOneFailureDoesNotStopTheRest() throws Exception {
        when(messageLogService.applyStatus(any(), any(), any(), any())).thenAnswer(inv -> {
            if ("wamid.bad".equals(inv.getArgument(0))) {
                throw new IllegalStateException("db down");
            }
            return MessageLogService.StatusUpdate.APPLIED;
        });
        JsonNode payload = objectMapper.readTree("""
                {"object":"whatsapp_business_account","entry":[{"changes":[{"value":{
                  "metadata":{"phone_number_id":"1098765"},
                  "statuses":[
                    {"id":"wamid.bad","status":"delivered"},
                    {"id":"wamid.ok","status":"failed","errors":[{"code":131047,"title":"Re-engagement message"}]}
                  ]}}]}]}
                """);

        WebhookProcessingSummary summary = processor.process(payload);

        assertEquals(1, summary.statuses());
        assertEquals(1, summary.failures());
        verify(messageLogService).applyStatus("wamid.ok", DeliveryStatus.FAILED, "131047", "Re-engagement message");
    }

    @Test
    void otherObjectsAreIgnored() throws Exception {
        WebhookProcessingSummary summary = processor.process(objectMapper.readTree("{\"object\":\"page\",\"entry\":[]}"));

        assertEquals(WebhookProcessingSummary.ignored(), summary);
        verifyNoInteractions(lineRepository, messageLogService);
        verify(legacyIntentService, never()).handle(any(), any(), any(), any());
    }

    @Test
    void interactiveReplyTextAndPayloadAreExtracted() throws Exception {
        JsonNode message = objectMapper.readTree("""
                {"type":"interactive","interactive":{"type":"button_reply",
                  "button_reply":{"id":"%s","title":"Reagendar"}}}
                """.formatted(APPOINTMENT_ID));
        JsonNode plainPayload = objectMapper.readTree("""
                {"type":"button","button":{"text":"","payload":"confirmar"}}
                """);

        assertEquals("Reagendar", InboundWebhookProcessor.extractText(message));
        assertEquals(UUID.fromString(APPOINTMENT_ID), InboundWebhookProcessor.extractAppointmentId(message));
        assertEquals("confirmar", InboundWebhookProcessor.extractText(plainPayload));
        assertNull(InboundWebhookProcessor.extractAppointmentId(plainPayload));
    }

    private JsonNode textMessage(String id, String body) throws Exception {
        return objectMapper.readTree("""
                {"object":"whatsapp_business_account","entry":[{"changes":[{"value":{
                  "metadata":{"phone_number_id":"1098765","display_phone_number":"50422223333"},
                  "messages":[{"id":"%s","from":"50493133496","type":"text","text":{"body":"%s"}}]}}]}]}
                """.formatted(id, body));
    }
}
