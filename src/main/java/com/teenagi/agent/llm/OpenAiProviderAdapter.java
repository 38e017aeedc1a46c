package com.teenagi.agent.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
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
 * OpenAI Chat Completions adapter (also works with OpenAI-compatible endpoints).
 *
 * History mapping:
 *   USER_MESSAGE    -> {role: user}
 *   FUNCTION_CALL   -> {role: assistant, tool_calls: [...]}
 *   FUNCTION_RESULT -> {role: tool, tool_call_id}
 *   FINAL_ANSWER    -> {role: assistant, content}
 */
@Slf4j
public class OpenAiProviderAdapter extends HttpProviderAdapter {

    public OpenAiProviderAdapter(LlmProviderProperties props,
                                 ObjectMapper objectMapper,
                                 RestClient.Builder restClientBuilder) {
        super(LlmProvider.OPENAI, props, objectMapper, restClientBuilder);
    }

    @Override
    protected void applyAuthHeaders(HttpHeaders headers) {
        headers.setBearerAuth(props.getApiKey());
    }

    @Override
    public Decision decide(DecisionRequest request) {
        Map<String, Object> requestBody = buildRequestBody(request);

        log.debug("Sending {} turns and {} functions to openai [model={}]",
                request.getTurns().size(), request.getFunctions().size(), props.getModel());

        JsonNode response = post("/chat/completions", requestBody);
        return parseResponse(response, request);
    }

    private Map<String, Object> buildRequestBody(DecisionRequest request) {
        List<Map<String, Object>> messages = new ArrayList<>();
        messages.add(Map.of("role", "system", "content", request.getSystemPrompt()));
        request.getTurns().forEach(turn -> messages.add(formatTurn(turn)));

        Map<String, Object> body = new HashMap<>();
        body.put("model", props.getModel());
        body.put("max_tokens", props.getMaxTokens());
        body.put("temperature", props.getTemperature());
        body.put("messages", messages);

        if (!request.getFunctions().isEmpty()) {
            body.put("tools", request.getFunctions().stream().map(this::toToolSchema).toList());
            body.put("tool_choice", "auto");
        }

        return body;
    }

    /**
     * OpenAI expects: { "type": "function", "function": { "name", "description", "parameters" } }
     */
    private Map<String, Object> toToolSchema(FunctionDescriptor descriptor) {
        return Map.of(
                "type", "function",
                "function", Map.of(
                        "name", descriptor.getName(),
                        "description", descriptor.getDescription(),
                        "parameters", descriptor.toJsonSchema()
                )
        );
    }

    private Map<String, Object> formatTurn(ConversationTurn turn) {
        Map<String, Object> m = new HashMap<>();
        switch (turn.getType()) {
            case USER_MESSAGE -> {
                m.put("role", "user");
                m.put("content", turn.getContent());
            }
            case FUNCTION_CALL -> {
                // The assistant message must carry tool_calls, otherwise the
                // following tool message has nothing to correlate with.
                FunctionCall call = turn.getCall();
                Map<String, Object> fn = new HashMap<>();
                fn.put("name", call.getFunctionName());
                fn.put("arguments", argumentsAsJson(call.getArguments()));

                Map<String, Object> toolCall = new HashMap<>();
                toolCall.put("id", call.getId());
                toolCall.put("type", "function");
                toolCall.put("function", fn);

                m.put("role", "assistant");
                m.put("content", null);
                m.put("tool_calls", List.of(toolCall));
            }
            case FUNCTION_RESULT -> {
                m.put("role", "tool");
                m.put("tool_call_id", turn.getCallId());
                m.put("content", turn.getContent());
            }
            case FINAL_ANSWER -> {
                m.put("role", "assistant");
                m.put("content", turn.getContent());
            }
        }
        return m;
    }

    private Decision parseResponse(JsonNode response, DecisionRequest request) {
        JsonNode choices = response.path("choices");
        if (!choices.isArray() || choices.isEmpty()) {
            throw new MalformedDecisionException("openai returned no choices in response");
        }

        JsonNode usage = response.path("usage");
        int promptTokens = usage.path("prompt_tokens").asInt(0);
        int completionTokens = usage.path("completion_tokens").asInt(0);
        log.debug("Token usage - prompt={} completion={}", promptTokens, completionTokens);

        JsonNode choice = choices.get(0);
        JsonNode message = choice.path("message");
        log.debug("openai finish_reason: {}", choice.path("finish_reason").asText(null));

        JsonNode toolCalls = message.path("tool_calls");
        if (toolCalls.isArray() && !toolCalls.isEmpty()) {
            List<FunctionCall> calls = new ArrayList<>();
            for (JsonNode toolCall : toolCalls) {
                calls.add(parseToolCall(toolCall));
            }
            return proposal(calls, request, promptTokens, completionTokens);
        }

        JsonNode content = message.path("content");
        if (!content.isTextual() || content.asText().isBlank()) {
            throw new MalformedDecisionException(
                    "openai response has neither content nor tool calls");
        }
        return finalAnswer(content.asText(), promptTokens, completionTokens);
    }

    private FunctionCall parseToolCall(JsonNode toolCall) {
        JsonNode function = toolCall.path("function");
        String name = function.path("name").asText(null);
        if (name == null || name.isBlank()) {
            throw new MalformedDecisionException("openai tool call has no function name: " + toolCall);
        }

        FunctionCall.FunctionCallBuilder call = FunctionCall.builder()
                .id(callIdOrGenerate(toolCall.path("id").asText(null)))
                .functionName(name);

        // arguments arrive as a JSON string, not an object
        String rawArguments = function.path("arguments").asText("");
        if (rawArguments.isBlank()) {
            return call.arguments(Map.of()).build();
        }
        try {
            Map<String, Object> arguments = toArgumentMap(objectMapper.readTree(rawArguments));
            if (arguments == null) {
                return call.parseError("Arguments for '" + name + "' must be a JSON object but were: "
                        + rawArguments).build();
            }
            return call.arguments(arguments).build();
        } catch (JsonProcessingException e) {
            return call.parseError("Arguments for '" + name + "' are not valid JSON: " + rawArguments).build();
        }
    }
}
