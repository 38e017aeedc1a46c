package com.teenagi.agent.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.teenagi.agent.exception.MalformedDecisionException;
import com.teenagi.agent.function.FunctionDescriptor;
import com.teenagi.agent.model.ConversationTurn;
import com.teenagi.agent.model.Decision;
import com.teenagi.agent.model.FunctionCall;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.web.client.RestClient;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Anthropic Messages API adapter.
 *
 * The system prompt travels as a top-level field, not as a message. Tool calls
 * and their results are content blocks:
 *   FUNCTION_CALL   -> {role: assistant, content: [{type: tool_use, id, name, input}]}
 *   FUNCTION_RESULT -> {role: user, content: [{type: tool_result, tool_use_id, content, is_error}]}
 * Because every call is followed by its result, the history alternates
 * user/assistant as the API requires.
 */
@Slf4j
public class AnthropicProviderAdapter extends HttpProviderAdapter {

    static final String DEFAULT_API_VERSION = "2023-06-01";

    public AnthropicProviderAdapter(LlmProviderProperties props,
                                    ObjectMapper objectMapper,
                                    RestClient.Builder restClientBuilder) {
        super(LlmProvider.ANTHROPIC, props, objectMapper, restClientBuilder);
    }

    @Override
    protected void applyAuthHeaders(HttpHeaders headers) {
        headers.set("x-api-key", props.getApiKey());
        headers.set("anthropic-version",
                props.getApiVersion() != null ? props.getApiVersion() : DEFAULT_API_VERSION);
    }

    @Override
    public Decision decide(DecisionRequest request) {
        Map<String, Object> requestBody = buildRequestBody(request);

        log.debug("Sending {} turns and {} functions to anthropic [model={}]",
                request.getTurns().size(), request.getFunctions().size(), props.getModel());

        JsonNode response = post("/messages", requestBody);
        return parseResponse(response, request);
    }

    private Map<String, Object> buildRequestBody(DecisionRequest request) {
        Map<String, Object> body = new HashMap<>();
        body.put("model", props.getModel());
        body.put("max_tokens", props.getMaxTokens());
        body.put("temperature", props.getTemperature());
        body.put("system", request.getSystemPrompt());
        body.put("messages", request.getTurns().stream().map(this::formatTurn).toList());

        if (!request.getFunctions().isEmpty()) {
            body.put("tools", request.getFunctions().stream().map(this::toToolSchema).toList());
        }
        return body;
    }

    private Map<String, Object> toToolSchema(FunctionDescriptor descriptor) {
        return Map.of(
                "name", descriptor.getName(),
                "description", descriptor.getDescription(),
                "input_schema", descriptor.toJsonSchema()
        );
    }

    private Map<String, Object> formatTurn(ConversationTurn turn) {
        return switch (turn.getType()) {
            case USER_MESSAGE -> Map.of("role", "user", "content", turn.getContent());
            case FINAL_ANSWER -> Map.of("role", "assistant", "content", turn.getContent());
            case FUNCTION_CALL -> {
                FunctionCall call = turn.getCall();
                Map<String, Object> block = new HashMap<>();
                block.put("type", "tool_use");
                block.put("id", call.getId());
                block.put("name", call.getFunctionName());
                block.put("input", call.getArguments() != null ? call.getArguments() : Map.of());
                yield Map.of("role", "assistant", "content", List.of(block));
            }
            case FUNCTION_RESULT -> {
                Map<String, Object> block = new HashMap<>();
                block.put("type", "tool_result");
                block.put("tool_use_id", turn.getCallId());
                block.put("content", turn.getContent() != null ? turn.getContent() : "");
                block.put("is_error", turn.isError());
                yield Map.of("role", "user", "content", List.of(block));
            }
        };
    }

    private Decision parseResponse(JsonNode response, DecisionRequest request) {
        JsonNode content = response.path("content");
        if (!content.isArray()) {
            throw new MalformedDecisionException("anthropic response has no content array");
        }

        JsonNode usage = response.path("usage");
        int inputTokens = usage.path("input_tokens").asInt(0);
        int outputTokens = usage.path("output_tokens").asInt(0);
        log.debug("Token usage - input={} output={} stop_reason={}",
                inputTokens, outputTokens, response.path("stop_reason").asText(null));

        List<FunctionCall> calls = new ArrayList<>();
        StringBuilder text = new StringBuilder();

        for (JsonNode block : content) {
            String type = block.path("type").asText("");
            if ("tool_use".equals(type)) {
                calls.add(parseToolUse(block));
            } else if ("text".equals(type)) {
                if (text.length() > 0) {
                    text.append('\n');
                }
                text.append(block.path("text").asText(""));
            }
        }

        // Text next to tool_use blocks is the model thinking aloud; the calls win.
        if (!calls.isEmpty()) {
            return proposal(calls, request, inputTokens, outputTokens);
        }
        if (text.toString().isBlank()) {
            throw new MalformedDecisionException("anthropic response has neither text nor tool_use blocks");
        }
        return finalAnswer(text.toString(), inputTokens, outputTokens);
    }

    private FunctionCall parseToolUse(JsonNode block) {
        String name = block.path("name").asText(null);
        if (name == null || name.isBlank()) {
            throw new MalformedDecisionException("anthropic tool_use block has no name: " + block);
        }

        FunctionCall.FunctionCallBuilder call = FunctionCall.builder()
                .id(callIdOrGenerate(block.path("id").asText(null)))
                .functionName(name);

        Map<String, Object> arguments = toArgumentMap(block.get("input"));
        if (arguments == null) {
            return call.parseError("Arguments for '" + name + "' must be a JSON object but were: "
                    + block.get("input")).build();
        }
        return call.arguments(arguments).build();
    }
}
