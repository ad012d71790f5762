package com.ai.clinicbot.messaging;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Provider-agnostic send request. {@code templateParams} keys are 1-based positions.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GatewaySendRequest {

    private String to;

    @Builder.Default
    private MessageType type = MessageType.GENERIC;

    /** Explicit template (Meta name or Twilio content SID); skips mapping lookup. */
    private String templateName;

    @Builder.Default
    private Map<String, String> templateParams = new LinkedHashMap<>();

    private String body;

    private UUID appointmentId;
    private UUID patientId;
    private UUID doctorId;
    private UUID organizationId;

    /** Sends from this line instead of the organization's newest active line. */
    private UUID lineId;
}
