package com.ai.clinicbot.conversation.context;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.UUID;

@Getter
@Setter
@NoArgsConstructor
public final class FaqContext extends FlowContext {

    public enum FaqStep {
        QUERY,
        AFTER_ANSWER,
        AFTER_MISS
    }

    private FaqStep step = FaqStep.QUERY;
    private UUID doctorId;
    private UUID clinicId;
}
