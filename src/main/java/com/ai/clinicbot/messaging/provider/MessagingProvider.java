package com.ai.clinicbot.messaging.provider;

import com.ai.clinicbot.entity.MessagingProviderType;

/**
 * One third-party WhatsApp transport. Implementations translate a {@link ProviderRequest}
 * into their native request shape and authenticate their own way.
 */
public interface MessagingProvider {

    MessagingProviderType type();

    /** Whether templates sent through this transport can carry quick-reply payloads. */
    boolean supportsQuickReplies();

    /**
     * Sends one message. Provider-side rejections come back as a failed result; transport
     * failures (timeouts, connection errors) propagate as runtime exceptions.
     */
    ProviderResult sendMessage(ProviderRequest request);
}
