package com.ai.clinicbot.webhook;

/**
 * Counts for one webhook delivery; used for logging.
 */
public record WebhookProcessingSummary(int messages, int duplicates, int statuses, int failures) {

    public static WebhookProcessingSummary ignored() {
        return new WebhookProcessingSummary(0, 0, 0, 0);
    }
}
