package com.ai.clinicbot.controller;

import com.ai.clinicbot.conversation.BotRequest;
import com.ai.clinicbot.conversation.BotResponse;
import com.ai.clinicbot.conversation.ConversationEngine;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Direct access to the conversation engine, used by tooling and the staff simulator.
 */
@RestController
@RequestMapping("/internal/bot")
public class BotController {

    private final ConversationEngine conversationEngine;

    public BotController(ConversationEngine conversationEngine) {
        this.conversationEngine = conversationEngine;
    }

    @PostMapping("/messages")
    public BotResponse handle(@RequestBody BotRequest request) {
        return conversationEngine.handle(request);
    }
}
