package com.ai.clinicbot.messaging;

import com.ai.clinicbot.entity.MessagingProviderType;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GatewaySendResult {

    boolean ok;
    String status;
    String providerMessageId;
    String provider;
    String error;
    String errorCode;

    /** Older callers read the Twilio message SID under this name. */
    public String getTwilioSid() {
        return MessagingProviderType.TWILIO.code().equals(provider) ? providerMessageId : null;
    }

    public static GatewaySendResult failure(String errorCode, String error, MessagingProviderType provider) {
        return GatewaySendResult.builder()
                .ok(false)
                .status("failed")
                .errorCode(errorCode)
                .error(error)
                .provider(provider != null ? provider.code() : null)
                .build();
    }
}
