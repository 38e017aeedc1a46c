package com.teenagi.agent.core;

import com.teenagi.agent.function.FunctionDescriptor;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds the system prompt from the agent's name, learned capabilities and
 * declared functions. Capabilities keep their learning order, which is the
 * order the model reads them in.
 */
public class PromptBuilder {

    public String build(String agentName, List<String> capabilities, List<FunctionDescriptor> functions) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("You are ").append(agentName)
                .append(", an AI assistant with the following capabilities:\n\n")
                .append(bullets(capabilities))
                .append("\n\n");

        if (!functions.isEmpty()) {
            prompt.append("You can call the following functions:\n\n")
                    .append(bullets(functions.stream().map(FunctionDescriptor::signature).toList()))
                    .append("\n\n");
        }

        prompt.append("""
                When responding to user requests, decide which capabilities to use and which functions to call.

                Rules:
                - Call functions through the tool interface, one at a time when a call depends on an earlier result.
                - If a function result starts with ERROR, read it. Correct the arguments and try again, \
                or take another approach. Do not repeat a call that failed the same way.
                - Once you have what you need, or when no function applies, answer the user directly in plain text.
                """);
        return prompt.toString();
    }

    private static String bullets(List<String> lines) {
        return lines.stream().map(line -> "- " + line).collect(Collectors.joining("\n"));
    }
}
