package com.teenagi.agent.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.teenagi.agent.exception.MalformedDecisionException;
import com.teenagi.agent.exception.ProviderCommunicationException;
import com.teenagi.agent.function.FunctionDescriptor;
import com.teenagi.agent.function.ParameterSpec;
import com.teenagi.agent.function.ParameterType;
import com.teenagi.agent.model.ConversationTurn;
import com.teenagi.agent.model.Decision;
import com.teenagi.agent.model.FunctionCall;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class AnthropicProviderAdapterTest {

    private static final String URL = "https://api.anthropic.com/v1/messages";

    private MockRestServiceServer server;
    private AnthropicProviderAdapter adapter;

    private final FunctionDescriptor calculate = FunctionDescriptor.builder()
            .name("calculate")
            .description("Calculate")
            .parameter(ParameterSpec.required("expression", ParameterType.STRING, null))
            .build();

    @BeforeEach
    void setUp() {
        LlmProviderProperties props = new LlmProviderProperties();
        props.setApiKey("ant-test");
        props.setBaseUrl("https://api.anthropic.com/v1");
        props.setModel("claude-3-haiku-20240307");

        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        adapter = new AnthropicProviderAdapter(props, new ObjectMapper(), builder);
    }

    private DecisionRequest request(List<ConversationTurn> turns) {
        return DecisionRequest.builder()
                .systemPrompt("You are TeenAGI")
                .functions(List.of(calculate))
                .turns(turns)
                .build();
    }

    @Test
    void decide_textBlocks_areFinalAnswer() {
        server.expect(requestTo(URL))
                .andExpect(header("x-api-key", "ant-test"))
                .andExpect(header("anthropic-version", "2023-06-01"))
                .andExpect(jsonPath("$.system").value("You are TeenAGI"))
                .andExpect(jsonPath("$.messages[0].role").value("user"))
                .andExpect(jsonPath("$.tools[0].name").value("calculate"))
                .andExpect(jsonPath("$.tools[0].input_schema.type").value("object"))
                .andRespond(withSuccess("""
                        {"content":[{"type":"text","text":"Hello"},{"type":"text","text":"there"}],
                         "stop_reason":"end_turn","usage":{"input_tokens":10,"output_tokens":3}}
                        """, MediaType.APPLICATION_JSON));

        Decision decision = adapter.decide(request(List.of(ConversationTurn.userMessage("Hi"))));

        assertThat(decision.isFinalAnswer()).isTrue();
        assertThat(decision.getContent()).isEqualTo("Hello\nthere");
        assertThat(decision.getPromptTokens()).isEqualTo(10);
        server.verify();
    }

    @Test
    void decide_toolUse_winsOverText() {
        server.expect(requestTo(URL))
                .andRespond(withSuccess("""
                        {"content":[
                          {"type":"text","text":"Let me calculate that."},
                          {"type":"tool_use","id":"toolu_1","name":"calculate","input":{"expression":"2+2"}}
                        ],"stop_reason":"tool_use"}
                        """, MediaType.APPLICATION_JSON));

        Decision decision = adapter.decide(request(List.of(ConversationTurn.userMessage("2+2?"))));

        assertThat(decision.getType()).isEqualTo(Decision.Type.CALL_PROPOSAL);
        assertThat(decision.getCalls()).hasSize(1);
        assertThat(decision.getCalls().get(0).getId()).isEqualTo("toolu_1");
        assertThat(decision.getCalls().get(0).getArguments()).containsEntry("expression", "2+2");
    }

    @Test
    void decide_sendsToolUseAndToolResultBlocks() {
        FunctionCall call = FunctionCall.builder()
                .id("toolu_1").functionName("calculate").arguments(Map.of("expression", "1/0")).build();

        server.expect(requestTo(URL))
                .andExpect(jsonPath("$.messages[1].role").value("assistant"))
                .andExpect(jsonPath("$.messages[1].content[0].type").value("tool_use"))
                .andExpect(jsonPath("$.messages[1].content[0].input.expression").value("1/0"))
                .andExpect(jsonPath("$.messages[2].role").value("user"))
                .andExpect(jsonPath("$.messages[2].content[0].type").value("tool_result"))
                .andExpect(jsonPath("$.messages[2].content[0].tool_use_id").value("toolu_1"))
                .andExpect(jsonPath("$.messages[2].content[0].is_error").value(true))
                .andRespond(withSuccess("{\"content\":[{\"type\":\"text\",\"text\":\"Cannot divide by zero.\"}]}",
                        MediaType.APPLICATION_JSON));

        adapter.decide(request(List.of(
                ConversationTurn.userMessage("1/0?"),
                ConversationTurn.functionCall(call),
                ConversationTurn.functionError(call, "ERROR: Division by zero"))));

        server.verify();
    }

    @Test
    void decide_inputNotObject_isSalvageable() {
        server.expect(requestTo(URL))
                .andRespond(withSuccess("""
                        {"content":[{"type":"tool_use","id":"toolu_1","name":"calculate","input":"2+2"}]}
                        """, MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> adapter.decide(request(List.of(ConversationTurn.userMessage("2+2?")))))
                .isInstanceOfSatisfying(MalformedDecisionException.class,
                        e -> assertThat(e.getSalvageableDecision().getCalls().get(0).getParseError())
                                .contains("must be a JSON object"));
    }

    @Test
    void decide_emptyContent_isMalformed() {
        server.expect(requestTo(URL)).andRespond(withSuccess("{\"content\":[]}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> adapter.decide(request(List.of(ConversationTurn.userMessage("Hi")))))
                .isInstanceOf(MalformedDecisionException.class);
    }

    @Test
    void decide_rateLimited_isProviderFailure() {
        server.expect(requestTo(URL)).andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS).body("slow down"));

        assertThatThrownBy(() -> adapter.decide(request(List.of(ConversationTurn.userMessage("Hi")))))
                .isInstanceOf(ProviderCommunicationException.class)
                .hasMessageContaining("rate limit");
    }
}
