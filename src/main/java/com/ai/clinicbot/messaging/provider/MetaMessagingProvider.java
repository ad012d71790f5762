package com.ai.clinicbot.messaging.provider;

import com.ai.clinicbot.entity.MessagingProviderType;
import com.ai.clinicbot.utils.PhoneNumbers;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestTemplate;

import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * WhatsApp Cloud API via the Graph API: JSON body with bearer auth. Template parameters
 * are positional; each quick-reply payload becomes its own button component.
 */
public class MetaMessagingProvider implements MessagingProvider {

    private static final Logger log = LoggerFactory.getLogger(MetaMessagingProvider.class);
    static final String GRAPH_API_BASE = "https://graph.facebook.com";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final MetaCredentials credentials;

    public MetaMessagingProvider(RestTemplate restTemplate, ObjectMapper objectMapper, MetaCredentials credentials) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.credentials = credentials;
    }

    @Override
    public MessagingProviderType type() {
        return MessagingProviderType.META;
    }

    @Override
    public boolean supportsQuickReplies() {
        return true;
    }

    @Override
    public ProviderResult sendMessage(ProviderRequest request) {
        String apiUrl = GRAPH_API_BASE + "/" + credentials.graphVersion() + "/" + credentials.phoneNumberId() + "/messages";
        ObjectNode payload = request.isTemplate() ? templatePayload(request) : textPayload(request);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        headers.setBearerAuth(credentials.accessToken());

        log.info("Meta send to {} type={}", PhoneNumbers.toMeta(request.to()), request.isTemplate() ? "template" : "text");
        try {
            ResponseEntity<String> response = restTemplate.postForEntity(apiUrl,
                    new HttpEntity<>(payload.toString(), headers), String.class);
            String messageId = parse(response.getBody()).path("messages").path(0).path("id").asText("");
            if (messageId.isEmpty()) {
                return ProviderResult.failed(type(), "Meta response without message id", "");
            }
            return ProviderResult.sent(type(), messageId);
        } catch (HttpStatusCodeException e) {
            JsonNode error = parse(e.getResponseBodyAsString()).path("error");
            String message = StringUtils.defaultIfBlank(error.path("message").asText(null), "Unknown Meta API error");
            String code = error.path("code").isMissingNode() ? "" : error.path("code").asText("");
            log.warn("Meta rejected message: status={} code={} message={}", e.getStatusCode(), code, message);
            return ProviderResult.failed(type(), message, code);
        }
    }

    ObjectNode templatePayload(ProviderRequest request) {
        ObjectNode root = envelope(request, "template");
        ObjectNode template = root.putObject("template");
        template.put("name", request.templateName());
        template.putObject("language").put("code", StringUtils.defaultIfBlank(request.templateLanguage(), "es"));
        ArrayNode components = template.putArray("components");

        if (!request.templateParams().isEmpty()) {
            ArrayNode parameters = components.addObject().put("type", "body").putArray("parameters");
            request.templateParams().entrySet().stream()
                    .sorted(Comparator.comparingInt(e -> position(e.getKey())))
                    .map(Map.Entry::getValue)
                    .forEach(text -> parameters.addObject().put("type", "text").put("text", text));
        }
        List<String> payloads = request.buttonPayloads();
        for (int i = 0; i < payloads.size(); i++) {
            ObjectNode button = components.addObject();
            button.put("type", "button");
            button.put("sub_type", "quick_reply");
            button.put("index", String.valueOf(i));
            button.putArray("parameters").addObject().put("type", "payload").put("payload", payloads.get(i));
        }
        return root;
    }

    ObjectNode textPayload(ProviderRequest request) {
        ObjectNode root = envelope(request, "text");
        root.putObject("text").put("body", StringUtils.defaultString(request.body()));
        return root;
    }

    private ObjectNode envelope(ProviderRequest request, String type) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("messaging_product", "whatsapp");
        root.put("recipient_type", "individual");
        root.put("to", PhoneNumbers.toMeta(request.to()));
        root.put("type", type);
        return root;
    }

    private static int position(String key) {
        try {
            return Integer.parseInt(key.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Template parameter keys must be positions, got: " + key, e);
        }
    }

    private JsonNode parse(String body) {
        if (StringUtils.isBlank(body)) return objectMapper.createObjectNode();
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            log.warn("Unparseable Meta response: {}", StringUtils.abbreviate(body, 200));
            return objectMapper.createObjectNode();
        }
    }
}
