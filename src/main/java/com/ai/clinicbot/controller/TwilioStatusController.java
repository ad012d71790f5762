package com.ai.clinicbot.controller;

import com.ai.clinicbot.entity.DeliveryStatus;
import com.ai.clinicbot.service.MessageLogService;
import com.twilio.security.RequestValidator;
import jakarta.servlet.http.HttpServletRequest;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.HashMap;
import java.util.Map;

/**
 * Twilio message status callbacks. Authenticated by a shared token in the query string and,
 * when an auth token is configured, the {@code X-Twilio-Signature} header.
 */
@RestController
public class TwilioStatusController {

    private static final Logger log = LoggerFactory.getLogger(TwilioStatusController.class);

    private final MessageLogService messageLogService;

    @Value("${clinicbot.twilio.status-webhook-token:}")
    private String statusToken;

    @Value("${clinicbot.twilio.auth-token:}")
    private String authToken;

    public TwilioStatusController(MessageLogService messageLogService) {
        this.messageLogService = messageLogService;
    }

    @PostMapping("/webhooks/twilio/status")
    public ResponseEntity<Map<String, Object>> status(@RequestParam Map<String, String> params,
                                                      @RequestHeader(value = "X-Twilio-Signature", required = false) String signature,
                                                      HttpServletRequest request) {
        String token = params.getOrDefault("token", "");
        if (StringUtils.isEmpty(statusToken) || !constantTimeEquals(token, statusToken)) {
            log.warn("Twilio status callback rejected: bad token");
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(Map.of("ok", false, "error", "Unauthorized"));
        }
        if (StringUtils.isNotBlank(authToken) && StringUtils.isNotBlank(signature)
                && !signatureMatches(request, params, signature)) {
            log.warn("Twilio status callback rejected: bad signature");
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(Map.of("ok", false, "error", "Invalid signature"));
        }

        String messageSid = StringUtils.firstNonBlank(params.get("MessageSid"), params.get("SmsSid"));
        String rawStatus = StringUtils.firstNonBlank(params.get("MessageStatus"), params.get("SmsStatus"));
        if (StringUtils.isAnyBlank(messageSid, rawStatus)) {
            return ResponseEntity.badRequest().body(Map.of("ok", false, "error", "Missing MessageSid/MessageStatus"));
        }
        try {
            DeliveryStatus status = DeliveryStatus.fromProviderStatus(rawStatus);
            if (status == null) {
                log.debug("Ignoring Twilio status {} for {}", rawStatus, messageSid);
            } else {
                MessageLogService.StatusUpdate outcome = messageLogService.applyStatus(messageSid, status,
                        StringUtils.trimToNull(params.get("ErrorCode")), StringUtils.trimToNull(params.get("ErrorMessage")));
                log.info("Twilio status {} for {}: {}", status, messageSid, outcome);
            }
        } catch (RuntimeException e) {
            log.error("Twilio status callback for {} failed", messageSid, e);
        }
        return ResponseEntity.ok(Map.of("ok", true));
    }

    private boolean signatureMatches(HttpServletRequest request, Map<String, String> params, String signature) {
        String url = request.getRequestURL().toString();
        if (StringUtils.isNotEmpty(request.getQueryString())) {
            url = url + "?" + request.getQueryString();
        }
        // Twilio signs the POST form fields, not the query string parameters
        Map<String, String> formFields = new HashMap<>(params);
        if (request.getQueryString() != null) {
            for (String pair : request.getQueryString().split("&")) {
                formFields.remove(StringUtils.substringBefore(pair, "="));
            }
        }
        return new RequestValidator(authToken).validate(url, formFields, signature);
    }

    private static boolean constantTimeEquals(String a, String b) {
        return MessageDigest.isEqual(a.getBytes(StandardCharsets.UTF_8), b.getBytes(StandardCharsets.UTF_8));
    }
}
