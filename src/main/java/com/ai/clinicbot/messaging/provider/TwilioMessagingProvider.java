package com.ai.clinicbot.messaging.provider;

import com.ai.clinicbot.entity.MessagingProviderType;
import com.ai.clinicbot.utils.PhoneNumbers;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestTemplate;

import java.util.List;

/**
 * Twilio Messages API: form-encoded POST with basic auth. Templates are sent as a
 * content SID plus JSON content variables.
 */
public class TwilioMessagingProvider implements MessagingProvider {

    private static final Logger log = LoggerFactory.getLogger(TwilioMessagingProvider.class);
    static final String TWILIO_API_BASE = "https://api.twilio.com/2010-04-01";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final TwilioCredentials credentials;

    public TwilioMessagingProvider(RestTemplate restTemplate, ObjectMapper objectMapper, TwilioCredentials credentials) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.credentials = credentials;
    }

    @Override
    public MessagingProviderType type() {
        return MessagingProviderType.TWILIO;
    }

    @Override
    public boolean supportsQuickReplies() {
        return false;
    }

    @Override
    public ProviderResult sendMessage(ProviderRequest request) {
        String apiUrl = TWILIO_API_BASE + "/Accounts/" + credentials.accountSid() + "/Messages.json";

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        headers.setBasicAuth(credentials.accountSid(), credentials.authToken());

        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("To", PhoneNumbers.toTwilio(request.to()));
        form.add("From", fromAddress());
        if (StringUtils.isNotBlank(credentials.messagingServiceSid())) {
            form.add("MessagingServiceSid", credentials.messagingServiceSid());
        }
        if (request.isTemplate()) {
            form.add("ContentSid", request.templateName());
            if (!request.templateParams().isEmpty()) {
                form.add("ContentVariables", toJson(request));
            }
        } else {
            form.add("Body", StringUtils.defaultString(request.body()));
        }

        log.info("Twilio send to {} type={}", PhoneNumbers.toTwilio(request.to()), request.isTemplate() ? "template" : "text");
        try {
            ResponseEntity<String> response = restTemplate.postForEntity(apiUrl, new HttpEntity<>(form, headers), String.class);
            String sid = parse(response.getBody()).path("sid").asText("");
            if (sid.isEmpty()) {
                return ProviderResult.failed(type(), "Twilio response without message sid", "");
            }
            return ProviderResult.sent(type(), sid);
        } catch (HttpStatusCodeException e) {
            JsonNode error = parse(e.getResponseBodyAsString());
            String message = StringUtils.firstNonBlank(error.path("error_message").asText(null),
                    error.path("message").asText(null), "Twilio API error");
            String code = StringUtils.firstNonBlank(error.path("error_code").asText(null),
                    error.path("code").asText(null), "");
            log.warn("Twilio rejected message: status={} code={} message={}", e.getStatusCode(), code, message);
            return ProviderResult.failed(type(), message, code);
        }
    }

    private String fromAddress() {
        String from = credentials.from();
        return StringUtils.startsWithIgnoreCase(from, "whatsapp:") ? from : PhoneNumbers.toTwilio(from);
    }

    private String toJson(ProviderRequest request) {
        try {
            return objectMapper.writeValueAsString(request.templateParams());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Template params are not serializable", e);
        }
    }

    private JsonNode parse(String body) {
        if (StringUtils.isBlank(body)) return objectMapper.createObjectNode();
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            log.warn("Unparseable Twilio response: {}", StringUtils.abbreviate(body, 200));
            return objectMapper.createObjectNode();
        }
    }
}
