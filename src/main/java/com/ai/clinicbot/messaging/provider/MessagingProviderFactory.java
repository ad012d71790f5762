package com.ai.clinicbot.messaging.provider;

import com.ai.clinicbot.entity.ChannelLine;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.util.Optional;

/**
 * Builds the adapter for a line's stored provider with credentials from
 * {@link ProviderCredentialsResolver}.
 */
@Component
public class MessagingProviderFactory {

    private static final Logger log = LoggerFactory.getLogger(MessagingProviderFactory.class);

    private final ProviderCredentialsResolver credentialsResolver;
    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    public MessagingProviderFactory(ProviderCredentialsResolver credentialsResolver,
                                    RestTemplate messagingRestTemplate,
                                    ObjectMapper objectMapper) {
        this.credentialsResolver = credentialsResolver;
        this.restTemplate = messagingRestTemplate;
        this.objectMapper = objectMapper;
    }

    public Optional<MessagingProvider> create(ChannelLine line) {
        if (line.getProvider() == null) {
            log.error("Line {} has no provider configured", line.getId());
            return Optional.empty();
        }
        Optional<MessagingProvider> provider = switch (line.getProvider()) {
            case TWILIO -> credentialsResolver.twilio(line)
                    .<MessagingProvider>map(c -> new TwilioMessagingProvider(restTemplate, objectMapper, c));
            case META -> credentialsResolver.meta(line)
                    .<MessagingProvider>map(c -> new MetaMessagingProvider(restTemplate, objectMapper, c));
        };
        if (provider.isEmpty()) {
            log.error("{} configuration incomplete on line {}", line.getProvider(), line.getId());
        }
        return provider;
    }
}
