package com.ai.clinicbot.controller;

import com.ai.clinicbot.webhook.InboundWebhookProcessor;
import com.ai.clinicbot.webhook.WebhookSignatureVerifier;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class MetaWebhookControllerTest {

    private static final String SECRET = "test-app-secret";
    private static final String BODY = "{\"object\":\"whatsapp_business_account\",\"entry\":[]}";

    private final InboundWebhookProcessor processor = mock(InboundWebhookProcessor.class);
    private final WebhookSignatureVerifier verifier = new WebhookSignatureVerifier();
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        MetaWebhookController controller = new MetaWebhookController(processor, verifier, new ObjectMapper());
        ReflectionTestUtils.setField(controller, "verifyToken", "test-verify-token");
        ReflectionTestUtils.setField(controller, "appSecret", SECRET);
        mockMvc = MockMvcBuilders.standaloneSetup(controller).build();
    }

    @Test
    void subscriptionWithMatchingTokenEchoesChallenge() throws Exception {
        mockMvc.perform(get("/webhooks/meta")
                        .param("hub.mode", "subscribe")
                        .param("hub.verify_token", "test-verify-token")
                        .param("hub.challenge", "1158201444"))
                .andExpect(status().isOk())
                .andExpect(content().string("1158201444"));
    }

    @Test
    void subscriptionWithWrongTokenIsForbidden() throws Exception {
        mockMvc.perform(get("/webhooks/meta")
                        .param("hub.mode", "subscribe")
                        .param("hub.verify_token", "guess")
                        .param("hub.challenge", "1158201444"))
                .andExpect(status().isForbidden());
    }

    @Test
    void unsignedDeliveryIsRejectedBeforeParsing() throws Exception {
        mockMvc.perform(post("/webhooks/meta")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("X-Hub-Signature-256", "sha256=" + verifier.sign(BODY, "other-secret"))
                        .content(BODY))
                .andExpect(status().isUnauthorized());

        verifyNoInteractions(processor);
    }

    @Test
    void signedDeliveryIsProcessed() throws Exception {
        mockMvc.perform(post("/webhooks/meta")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("X-Hub-Signature-256", "sha256=" + verifier.sign(BODY, SECRET))
                        .content(BODY))
                .andExpect(status().isOk())
                .andExpect(content().string("OK"));

        verify(processor).process(any());
    }

    @Test
    void processingFailureStillAnswersOk() throws Exception {
        when(processor.process(any())).thenThrow(new IllegalStateException("db down"));

        mockMvc.perform(post("/webhooks/meta")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("X-Hub-Signature-256", "sha256=" + verifier.sign(BODY, SECRET))
                        .content(BODY))
                .andExpect(status().isOk());
    }
}
