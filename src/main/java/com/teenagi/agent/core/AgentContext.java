package com.teenagi.agent.core;

import com.teenagi.agent.model.ConversationTurn;
import com.teenagi.agent.model.FunctionCall;
import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Holds all mutable state for a single {@code respond} call.
 * Owned by one thread and thrown away when the call returns.
 */
@Data
@Builder
public class AgentContext {

    private String userInput;
    private List<ConversationTurn> turns;
    private List<FunctionCall> executedCalls;
    private int currentIteration;

    public static AgentContext start(String userInput) {
        AgentContext context = AgentContext.builder()
                .userInput(userInput)
                .turns(new ArrayList<>())
                .executedCalls(new ArrayList<>())
                .currentIteration(0)
                .build();
        context.append(ConversationTurn.userMessage(userInput));
        return context;
    }

    public void append(ConversationTurn turn) {
        turns.add(turn);
    }

    /** Immutable copy handed to the adapter, so a round-trip never sees later appends. */
    public List<ConversationTurn> snapshot() {
        return List.copyOf(turns);
    }

    public int nextIteration() {
        return ++currentIteration;
    }
}
