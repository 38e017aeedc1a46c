package com.teenagi.agent.core;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class LoopSettings {

    /** Upper bound on model round-trips per respond call */
    @Builder.Default
    int maxIterations = 5;

    /** Re-prompts allowed after a response that contains nothing usable */
    @Builder.Default
    int malformedDecisionRetries = 1;

    public static LoopSettings defaults() {
        return LoopSettings.builder().build();
    }
}
