package com.teenagi.agent.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Normalized outcome of one model round-trip: either a final answer or a
 * proposal to call functions. Backend-specific response shapes never get
 * past the adapter.
 */
@Value
@Builder
public class Decision {

    public enum Type {
        FINAL_ANSWER, CALL_PROPOSAL
    }

    Type type;

    /** Non-null for FINAL_ANSWER */
    String content;

    /** Non-empty for CALL_PROPOSAL, in the order the backend proposed them */
    @Singular
    List<FunctionCall> calls;

    @Builder.Default
    int promptTokens = 0;

    @Builder.Default
    int completionTokens = 0;

    public boolean isFinalAnswer() {
        return type == Type.FINAL_ANSWER;
    }

    public static Decision finalAnswer(String content) {
        return Decision.builder().type(Type.FINAL_ANSWER).content(content).build();
    }

    public static Decision callProposal(List<FunctionCall> calls) {
        return Decision.builder().type(Type.CALL_PROPOSAL).calls(calls).build();
    }
}
