package com.ai.clinicbot.messaging.provider;

import org.apache.commons.lang3.StringUtils;

import java.util.List;
import java.util.Map;

/**
 * What the gateway hands to an adapter: a resolved template or a free-text body.
 * {@code to} is already E.164; adapters convert it to their own address format.
 */
public record ProviderRequest(String to,
                              String templateName,
                              String templateLanguage,
                              Map<String, String> templateParams,
                              List<String> buttonPayloads,
                              String body) {

    public ProviderRequest {
        templateParams = templateParams == null ? Map.of() : Map.copyOf(templateParams);
        buttonPayloads = buttonPayloads == null ? List.of() : List.copyOf(buttonPayloads);
    }

    public boolean isTemplate() {
        return StringUtils.isNotBlank(templateName);
    }

    public static ProviderRequest template(String to, String templateName, String language,
                                           Map<String, String> params, List<String> buttonPayloads) {
        return new ProviderRequest(to, templateName, language, params, buttonPayloads, null);
    }

    public static ProviderRequest text(String to, String body) {
        return new ProviderRequest(to, null, null, null, null, body);
    }
}
