package com.ai.clinicbot.entity;

import java.util.Locale;

/**
 * Message lifecycle. Updates to a lower {@link #rank()} are ignored; equal ranks are applied,
 * so a late "sent" replaces a failure and a late "failed" replaces a send.
 */
public enum DeliveryStatus {
    RECEIVED(0),
    SENT(1),
    FAILED(1),
    DELIVERED(2),
    READ(3);

    private final int rank;

    DeliveryStatus(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    public boolean regresses(DeliveryStatus current) {
        return current != null && rank < current.rank;
    }

    /**
     * Maps Meta and Twilio status vocabularies. Returns null for statuses that carry no
     * lifecycle information.
     */
    public static DeliveryStatus fromProviderStatus(String raw) {
        if (raw == null) return null;
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "queued", "accepted", "sending", "sent" -> SENT;
            case "delivered" -> DELIVERED;
            case "read" -> READ;
            case "failed", "undelivered" -> FAILED;
            default -> null;
        };
    }
}
