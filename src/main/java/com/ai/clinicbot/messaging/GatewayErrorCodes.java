package com.ai.clinicbot.messaging;

public final class GatewayErrorCodes {

    public static final String VALIDATION_ERROR = "VALIDATION_ERROR";
    public static final String NO_ACTIVE_LINE = "NO_ACTIVE_LINE";
    public static final String MESSAGING_DISABLED = "MESSAGING_DISABLED";
    public static final String PROVIDER_NOT_CONFIGURED = "PROVIDER_NOT_CONFIGURED";
    public static final String TEMPLATE_PENDING_APPROVAL = "TEMPLATE_PENDING_APPROVAL";
    public static final String UPSTREAM_ERROR = "UPSTREAM_ERROR";

    private GatewayErrorCodes() {
    }
}
