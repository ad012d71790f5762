package com.ai.clinicbot.messaging.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class TwilioMessagingProviderTest {

    private static final String URL = "https://api.twilio.com/2010-04-01/Accounts/AC123/Messages.json";

    private MockRestServiceServer server;
    private TwilioMessagingProvider provider;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        provider = new TwilioMessagingProvider(restTemplate, new ObjectMapper(),
                new TwilioCredentials("AC123", "token", "+50422223333", null));
    }

    @Test
    void templateIsSentAsContentSidWithVariables() {
        String basic = "Basic " + Base64.getEncoder().encodeToString("AC123:token".getBytes(StandardCharsets.UTF_8));
        server.expect(requestTo(URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header(HttpHeaders.AUTHORIZATION, basic))
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_FORM_URLENCODED))
                .andExpect(content().formDataContains(Map.of(
                        "To", "whatsapp:+50493133496",
                        "From", "whatsapp:+50422223333",
                        "ContentSid", "HXabc",
                        "ContentVariables", "{\"1\":\"Ana\"}")))
                .andRespond(withSuccess("{\"sid\":\"SM999\",\"status\":\"queued\"}", MediaType.APPLICATION_JSON));

        ProviderResult result = provider.sendMessage(
                ProviderRequest.template("+50493133496", "HXabc", "es", Map.of("1", "Ana"), List.of()));

        server.verify();
        assertTrue(result.ok());
        assertEquals("SM999", result.providerMessageId());
    }

    @Test
    void freeTextUsesBody() {
        server.expect(requestTo(URL))
                .andExpect(content().formDataContains(Map.of("Body", "Hola")))
                .andRespond(withSuccess("{\"sid\":\"SM1\"}", MediaType.APPLICATION_JSON));

        assertTrue(provider.sendMessage(ProviderRequest.text("+50493133496", "Hola")).ok());
        server.verify();
    }

    @Test
    void apiErrorIsReturnedWithTwilioCode() {
        server.expect(requestTo(URL))
                .andRespond(withStatus(HttpStatus.BAD_REQUEST)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"code\":63016,\"message\":\"Outside the allowed window\"}"));

        ProviderResult result = provider.sendMessage(ProviderRequest.text("+50493133496", "Hola"));

        assertFalse(result.ok());
        assertEquals("63016", result.errorCode());
        assertEquals("Outside the allowed window", result.error());
    }
}
