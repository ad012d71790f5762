package com.ai.clinicbot.controller;

import com.ai.clinicbot.messaging.GatewayErrorCodes;
import com.ai.clinicbot.messaging.GatewaySendRequest;
import com.ai.clinicbot.messaging.GatewaySendResult;
import com.ai.clinicbot.messaging.MessagingGateway;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/internal/messaging")
public class MessagingController {

    private final MessagingGateway messagingGateway;

    public MessagingController(MessagingGateway messagingGateway) {
        this.messagingGateway = messagingGateway;
    }

    @PostMapping("/send")
    public ResponseEntity<GatewaySendResult> send(@RequestBody GatewaySendRequest request) {
        GatewaySendResult result = messagingGateway.send(request);
        return ResponseEntity.status(statusFor(result)).body(result);
    }

    static HttpStatus statusFor(GatewaySendResult result) {
        if (result.isOk()) return HttpStatus.OK;
        String code = result.getErrorCode();
        if (GatewayErrorCodes.MESSAGING_DISABLED.equals(code)) return HttpStatus.FORBIDDEN;
        if (GatewayErrorCodes.TEMPLATE_PENDING_APPROVAL.equals(code)) return HttpStatus.SERVICE_UNAVAILABLE;
        if (GatewayErrorCodes.VALIDATION_ERROR.equals(code)) return HttpStatus.BAD_REQUEST;
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }
}
