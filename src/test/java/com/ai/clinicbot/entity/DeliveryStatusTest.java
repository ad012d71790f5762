package com.ai.clinicbot.entity;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DeliveryStatusTest {

    @Test
    void lowerRanksRegressButEqualRanksDoNot() {
        assertTrue(DeliveryStatus.SENT.regresses(DeliveryStatus.READ));
        assertTrue(DeliveryStatus.DELIVERED.regresses(DeliveryStatus.READ));
        assertFalse(DeliveryStatus.SENT.regresses(DeliveryStatus.FAILED));
        assertFalse(DeliveryStatus.FAILED.regresses(DeliveryStatus.SENT));
        assertFalse(DeliveryStatus.READ.regresses(DeliveryStatus.DELIVERED));
        assertFalse(DeliveryStatus.RECEIVED.regresses(null));
    }

    @Test
    void providerVocabulariesMapToLifecycle() {
        assertEquals(DeliveryStatus.SENT, DeliveryStatus.fromProviderStatus("queued"));
        assertEquals(DeliveryStatus.DELIVERED, DeliveryStatus.fromProviderStatus(" Delivered "));
        assertEquals(DeliveryStatus.FAILED, DeliveryStatus.fromProviderStatus("undelivered"));
        assertNull(DeliveryStatus.fromProviderStatus("deleted"));
        assertNull(DeliveryStatus.fromProviderStatus(null));
    }
}
