package com.teenagi.agent.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentResponse {

    public enum Outcome {
        /** The model produced a final answer */
        COMPLETED,
        /** The round-trip cap was hit; finalAnswer summarizes the partial results */
        MAX_ITERATIONS_EXCEEDED
    }

    private String finalAnswer;
    private Outcome outcome;

    @Builder.Default
    private List<FunctionCall> functionCallsExecuted = new ArrayList<>();

    /** History of this call only; not kept after the response is returned */
    @Builder.Default
    private List<ConversationTurn> turns = new ArrayList<>();

    private int iterationsUsed;

    public boolean isMaxIterationsReached() {
        return outcome == Outcome.MAX_ITERATIONS_EXCEEDED;
    }
}
