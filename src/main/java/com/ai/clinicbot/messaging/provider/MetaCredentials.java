package com.ai.clinicbot.messaging.provider;

public record MetaCredentials(String phoneNumberId, String accessToken, String graphVersion) {

    @Override
    public String toString() {
        return "MetaCredentials[phoneNumberId=" + phoneNumberId + ", graphVersion=" + graphVersion + "]";
    }
}
