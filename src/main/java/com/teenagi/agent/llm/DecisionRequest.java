package com.teenagi.agent.llm;

import com.teenagi.agent.function.FunctionDescriptor;
import com.teenagi.agent.model.ConversationTurn;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Provider-agnostic snapshot handed to the adapter for one round-trip.
 */
@Value
@Builder
public class DecisionRequest {

    String systemPrompt;
    List<FunctionDescriptor> functions;
    List<ConversationTurn> turns;

    public Set<String> functionNames() {
        return functions.stream().map(FunctionDescriptor::getName).collect(Collectors.toSet());
    }
}
