package com.ai.clinicbot.messaging.provider;

import com.ai.clinicbot.entity.ChannelLine;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Two-tier credential lookup: values stored on the line first, environment defaults second.
 * Returns empty when the combined result is still incomplete.
 */
@Component
public class ProviderCredentialsResolver {

    private final MessagingDefaults defaults;

    public ProviderCredentialsResolver(MessagingDefaults defaults) {
        this.defaults = defaults;
    }

    public Optional<TwilioCredentials> twilio(ChannelLine line) {
        String accountSid = StringUtils.firstNonBlank(line.getTwilioAccountSid(), defaults.getTwilioAccountSid());
        String authToken = StringUtils.firstNonBlank(line.getTwilioAuthToken(), defaults.getTwilioAuthToken());
        String from = StringUtils.firstNonBlank(line.getTwilioPhoneFrom(), defaults.getTwilioFrom());
        String serviceSid = StringUtils.firstNonBlank(line.getTwilioMessagingServiceSid(),
                defaults.getTwilioMessagingServiceSid());
        if (accountSid == null || authToken == null || from == null) {
            return Optional.empty();
        }
        return Optional.of(new TwilioCredentials(accountSid, authToken, from, serviceSid));
    }

    public Optional<MetaCredentials> meta(ChannelLine line) {
        String phoneNumberId = StringUtils.trimToNull(line.getMetaPhoneNumberId());
        String accessToken = StringUtils.firstNonBlank(line.getMetaAccessToken(), defaults.getMetaAccessToken());
        if (phoneNumberId == null || accessToken == null) {
            return Optional.empty();
        }
        return Optional.of(new MetaCredentials(phoneNumberId, accessToken,
                StringUtils.defaultIfBlank(defaults.getMetaGraphVersion(), "v21.0")));
    }
}
