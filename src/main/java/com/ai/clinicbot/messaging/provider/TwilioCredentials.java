package com.ai.clinicbot.messaging.provider;

public record TwilioCredentials(String accountSid, String authToken, String from, String messagingServiceSid) {

    @Override
    public String toString() {
        return "TwilioCredentials[accountSid=" + accountSid + ", from=" + from + "]";
    }
}
