package com.ai.clinicbot.messaging.provider;

import com.ai.clinicbot.messaging.MessageType;
import lombok.Getter;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Environment-level provider settings. Second tier of credential resolution, used only
 * where a line stores nothing of its own.
 */
@Component
@Getter
public class MessagingDefaults {

    private final String twilioAccountSid;
    private final String twilioAuthToken;
    private final String twilioFrom;
    private final String twilioMessagingServiceSid;
    private final String metaAccessToken;
    private final String metaGraphVersion;
    private final Map<MessageType, String> twilioContentSids = new EnumMap<>(MessageType.class);

    public MessagingDefaults(@Value("${clinicbot.twilio.account-sid:}") String twilioAccountSid,
                             @Value("${clinicbot.twilio.auth-token:}") String twilioAuthToken,
                             @Value("${clinicbot.twilio.whatsapp-from:}") String twilioFrom,
                             @Value("${clinicbot.twilio.messaging-service-sid:}") String twilioMessagingServiceSid,
                             @Value("${clinicbot.twilio.templates.confirmation:}") String confirmationSid,
                             @Value("${clinicbot.twilio.templates.reminder-24h:}") String reminderSid,
                             @Value("${clinicbot.twilio.templates.reschedule-doctor:}") String rescheduleDoctorSid,
                             @Value("${clinicbot.meta.access-token:}") String metaAccessToken,
                             @Value("${clinicbot.meta.graph-version:v21.0}") String metaGraphVersion) {
        this.twilioAccountSid = twilioAccountSid;
        this.twilioAuthToken = twilioAuthToken;
        this.twilioFrom = twilioFrom;
        this.twilioMessagingServiceSid = twilioMessagingServiceSid;
        this.metaAccessToken = metaAccessToken;
        this.metaGraphVersion = metaGraphVersion;
        putIfPresent(MessageType.CONFIRMATION, confirmationSid);
        putIfPresent(MessageType.REMINDER_24H, reminderSid);
        putIfPresent(MessageType.RESCHEDULE_DOCTOR, rescheduleDoctorSid);
    }

    /** Content SID configured for a logical type, used when a Twilio line has no mapping. */
    public Optional<String> twilioContentSid(MessageType type) {
        return Optional.ofNullable(twilioContentSids.get(type));
    }

    private void putIfPresent(MessageType type, String sid) {
        if (StringUtils.isNotBlank(sid)) {
            twilioContentSids.put(type, sid.trim());
        }
    }
}
