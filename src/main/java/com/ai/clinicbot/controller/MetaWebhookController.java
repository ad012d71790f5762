package com.ai.clinicbot.controller;

import com.ai.clinicbot.webhook.InboundWebhookProcessor;
import com.ai.clinicbot.webhook.WebhookSignatureVerifier;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/webhooks/meta")
public class MetaWebhookController {

    private static final Logger log = LoggerFactory.getLogger(MetaWebhookController.class);

    private final InboundWebhookProcessor processor;
    private final WebhookSignatureVerifier signatureVerifier;
    private final ObjectMapper objectMapper;

    @Value("${clinicbot.meta.verify-token:}")
    private String verifyToken;

    @Value("${clinicbot.meta.app-secret:}")
    private String appSecret;

    public MetaWebhookController(InboundWebhookProcessor processor,
                                 WebhookSignatureVerifier signatureVerifier,
                                 ObjectMapper objectMapper) {
        this.processor = processor;
        this.signatureVerifier = signatureVerifier;
        this.objectMapper = objectMapper;
    }

    @GetMapping(produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> verify(@RequestParam(value = "hub.mode", required = false) String mode,
                                         @RequestParam(value = "hub.verify_token", required = false) String token,
                                         @RequestParam(value = "hub.challenge", required = false) String challenge) {
        if ("subscribe".equals(mode) && StringUtils.isNotEmpty(token) && token.equals(verifyToken)) {
            log.info("Meta webhook verified");
            return ResponseEntity.ok(StringUtils.defaultString(challenge));
        }
        log.warn("Meta webhook verification failed, mode={}", mode);
        return ResponseEntity.status(HttpStatus.FORBIDDEN).body("Forbidden");
    }

    @PostMapping(produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<?> receive(@RequestBody(required = false) String rawBody,
                                     @RequestHeader(value = "X-Hub-Signature-256", required = false) String signature) {
        if (StringUtils.isBlank(appSecret)) {
            log.error("clinicbot.meta.app-secret is not configured");
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(Map.of("error", "Server configuration error"));
        }
        String body = StringUtils.defaultString(rawBody);
        if (!signatureVerifier.isValid(body, signature, appSecret)) {
            log.warn("Rejected Meta webhook with invalid signature");
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body("Invalid signature");
        }
        try {
            JsonNode payload = objectMapper.readTree(body);
            processor.process(payload);
        } catch (Exception e) {
            // Meta retries anything but 200
            log.error("Meta webhook processing failed", e);
        }
        return ResponseEntity.ok("OK");
    }
}
