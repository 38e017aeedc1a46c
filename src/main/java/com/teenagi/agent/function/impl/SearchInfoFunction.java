package com.teenagi.agent.function.impl;

import com.teenagi.agent.function.AgentFunction;
import com.teenagi.agent.function.FunctionDescriptor;
import com.teenagi.agent.function.ParameterSpec;
import com.teenagi.agent.function.ParameterType;
import com.teenagi.agent.function.TypedArguments;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Canned search results, for demos and for exercising the loop without a search API.
 * Output is a numbered list, which models read more reliably than prose.
 */
@Component
@Slf4j
public class SearchInfoFunction implements AgentFunction {

    private static final int MAX_RESULTS = 3;

    private static final FunctionDescriptor DESCRIPTOR = FunctionDescriptor.builder()
            .name("search_info")
            .description("Search for information on a topic")
            .parameter(ParameterSpec.required("query", ParameterType.STRING, "The search query"))
            .parameter(ParameterSpec.optional("count", ParameterType.INTEGER, MAX_RESULTS,
                    "Number of results to return (1-" + MAX_RESULTS + ")"))
            .returnType("string")
            .build();

    @Override
    public FunctionDescriptor getDescriptor() {
        return DESCRIPTOR;
    }

    @Override
    public Object invoke(TypedArguments arguments) {
        String query = arguments.getString("query");
        if (query.isBlank()) {
            throw new IllegalArgumentException("'query' must not be blank");
        }
        int count = (int) Math.min(Math.max(arguments.getLong("count"), 1), MAX_RESULTS);
        log.info("search_info: query='{}' count={}", query, count);

        List<String> results = new ArrayList<>(List.of(
                query + " is a popular topic with many resources available.",
                "The latest research on " + query + " shows promising results.",
                "Experts in " + query + " recommend starting with basic concepts."));

        StringBuilder out = new StringBuilder("Here are the search results for '").append(query).append("':");
        for (int i = 0; i < count; i++) {
            out.append('\n').append(i + 1).append(". ").append(results.get(i));
        }
        return out.toString();
    }
}
