package com.ai.clinicbot.webhook;

import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Checks the {@code X-Hub-Signature-256} header: {@code sha256=} followed by the hex
 * HMAC-SHA256 of the raw request body keyed with the app secret.
 */
@Component
public class WebhookSignatureVerifier {

    private static final String PREFIX = "sha256=";
    private static final String ALGORITHM = "HmacSHA256";

    public boolean isValid(String rawBody, String signatureHeader, String appSecret) {
        if (StringUtils.isAnyBlank(signatureHeader, appSecret) || rawBody == null) return false;
        if (!signatureHeader.startsWith(PREFIX)) return false;
        String presented = signatureHeader.substring(PREFIX.length()).trim().toLowerCase(Locale.ROOT);
        String expected = sign(rawBody, appSecret);
        return MessageDigest.isEqual(expected.getBytes(StandardCharsets.US_ASCII),
                presented.getBytes(StandardCharsets.US_ASCII));
    }

    public String sign(String rawBody, String appSecret) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(appSecret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            return HexFormat.of().formatHex(mac.doFinal(rawBody.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", e);
        }
    }
}
