package com.ai.clinicbot.entity;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum MessagingProviderType {
    TWILIO("twilio"),
    META("meta");

    private final String code;

    MessagingProviderType(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public static MessagingProviderType fromCode(String code) {
        if (code == null) {
            throw new IllegalArgumentException("Provider code is required");
        }
        return valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
}
