package com.teenagi.agent.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.teenagi.agent.exception.MalformedDecisionException;
import com.teenagi.agent.exception.ProviderCommunicationException;
import com.teenagi.agent.model.Decision;
import com.teenagi.agent.model.FunctionCall;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * HTTP plumbing shared by the backend adapters.
 *
 * Error mapping:
 *
 * | Condition                   | Result                                   |
 * |-----------------------------|------------------------------------------|
 * | API key not configured      | ProviderCommunicationException, no call  |
 * | 401 / 403                   | ProviderCommunicationException (auth)    |
 * | other 4xx / 5xx             | ProviderCommunicationException           |
 * | network error               | ProviderCommunicationException           |
 * | body is not JSON            | ProviderCommunicationException           |
 * | unknown function proposed   | MalformedDecisionException (salvageable) |
 */
@Slf4j
public abstract class HttpProviderAdapter implements ProviderAdapter {

    protected final LlmProviderProperties props;
    protected final ObjectMapper objectMapper;
    private final LlmProvider provider;
    private final RestClient restClient;

    protected HttpProviderAdapter(LlmProvider provider,
                                  LlmProviderProperties props,
                                  ObjectMapper objectMapper,
                                  RestClient.Builder restClientBuilder) {
        this.provider = provider;
        this.props = props;
        this.objectMapper = objectMapper;
        this.restClient = restClientBuilder
                .baseUrl(props.getBaseUrl())
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    @Override
    public String providerName() {
        return provider.id();
    }

    public String getModel() {
        return props.getModel();
    }

    /** Adds the backend's authentication headers to every request. */
    protected abstract void applyAuthHeaders(HttpHeaders headers);

    protected JsonNode post(String uri, Map<String, Object> body) {
        requireCredentials();

        String responseBody;
        try {
            responseBody = restClient.post()
                    .uri(uri)
                    .headers(this::applyAuthHeaders)
                    .body(body)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, (req, res) -> {
                        String errorBody = new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
                        log.error("{} error [{}]: {}", provider.id(), res.getStatusCode(), errorBody);
                        throw statusError(res.getStatusCode().value(), errorBody);
                    })
                    .body(String.class);
        } catch (RestClientException e) {
            throw new ProviderCommunicationException(
                    provider.id() + " request failed: " + e.getMessage(), e);
        }

        if (responseBody == null || responseBody.isBlank()) {
            throw new ProviderCommunicationException(provider.id() + " returned an empty response body");
        }
        try {
            return objectMapper.readTree(responseBody);
        } catch (JsonProcessingException e) {
            throw new ProviderCommunicationException(provider.id() + " returned a response that is not JSON", e);
        }
    }

    /**
     * Credentials are checked on first use, not at construction, so an agent
     * can be built before the environment is complete.
     */
    private void requireCredentials() {
        if (props.getApiKey() == null || props.getApiKey().isBlank()) {
            throw new ProviderCommunicationException(
                    provider.id() + " API key not found. Set the " + provider.apiKeyEnvVar()
                    + " environment variable");
        }
    }

    private ProviderCommunicationException statusError(int statusCode, String body) {
        if (statusCode == 401 || statusCode == 403) {
            return new ProviderCommunicationException(
                    provider.id() + " rejected the API key [" + statusCode + "]. Check your "
                    + provider.apiKeyEnvVar() + " environment variable");
        }
        if (statusCode == 429) {
            return new ProviderCommunicationException(provider.id() + " rate limit exceeded [429]: " + body);
        }
        return new ProviderCommunicationException(
                provider.id() + " returned HTTP " + statusCode + ": " + body);
    }

    /**
     * Builds a CALL_PROPOSAL from parsed calls. Calls naming a function that was
     * not declared in the request are marked, and the whole decision is raised as
     * salvageable so the loop can report the problem back to the model.
     */
    protected Decision proposal(List<FunctionCall> parsedCalls, DecisionRequest request,
                                int promptTokens, int completionTokens) {
        Set<String> declared = request.functionNames();
        List<FunctionCall> calls = new ArrayList<>(parsedCalls.size());
        boolean malformed = false;

        for (FunctionCall call : parsedCalls) {
            FunctionCall checked = call;
            if (!call.isMalformed() && !declared.contains(call.getFunctionName())) {
                checked = call.toBuilder()
                        .parseError(String.format("Function '%s' is not available. Available functions: %s",
                                call.getFunctionName(), declared))
                        .build();
            }
            malformed |= checked.isMalformed();
            calls.add(checked);
        }

        Decision decision = Decision.builder()
                .type(Decision.Type.CALL_PROPOSAL)
                .calls(calls)
                .promptTokens(promptTokens)
                .completionTokens(completionTokens)
                .build();

        if (malformed) {
            String reasons = calls.stream()
                    .filter(FunctionCall::isMalformed)
                    .map(FunctionCall::getParseError)
                    .reduce((a, b) -> a + "; " + b)
                    .orElse("");
            throw new MalformedDecisionException(
                    provider.id() + " proposed unusable function calls: " + reasons, decision, null);
        }
        return decision;
    }

    protected Decision finalAnswer(String content, int promptTokens, int completionTokens) {
        return Decision.builder()
                .type(Decision.Type.FINAL_ANSWER)
                .content(content)
                .promptTokens(promptTokens)
                .completionTokens(completionTokens)
                .build();
    }

    /**
     * Converts a JSON object node to a raw argument map. Returns null when the
     * node is not an object; callers mark the call malformed in that case.
     */
    protected Map<String, Object> toArgumentMap(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return Map.of();
        }
        if (!node.isObject()) {
            return null;
        }
        return objectMapper.convertValue(node, new TypeReference<Map<String, Object>>() {});
    }

    protected String argumentsAsJson(Map<String, Object> arguments) {
        try {
            return objectMapper.writeValueAsString(arguments != null ? arguments : Map.of());
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize function arguments, sending empty object: {}", e.getMessage());
            return "{}";
        }
    }

    protected static String callIdOrGenerate(String id) {
        return id != null && !id.isBlank() ? id : "call_" + UUID.randomUUID().toString().replace("-", "").substring(0, 24);
    }
}
