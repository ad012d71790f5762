package com.ai.clinicbot.messaging.provider;

import com.ai.clinicbot.entity.DeliveryStatus;
import com.ai.clinicbot.entity.MessagingProviderType;

public record ProviderResult(boolean ok,
                             DeliveryStatus status,
                             String providerMessageId,
                             MessagingProviderType provider,
                             String error,
                             String errorCode) {

    public static ProviderResult sent(MessagingProviderType provider, String providerMessageId) {
        return new ProviderResult(true, DeliveryStatus.SENT, providerMessageId, provider, null, null);
    }

    public static ProviderResult failed(MessagingProviderType provider, String error, String errorCode) {
        return new ProviderResult(false, DeliveryStatus.FAILED, null, provider, error, errorCode);
    }
}
