package com.teenagi.agent.api;

import com.teenagi.agent.core.Agent;
import com.teenagi.agent.exception.GlobalExceptionHandler;
import com.teenagi.agent.exception.ProviderCommunicationException;
import com.teenagi.agent.function.impl.WeatherFunction;
import com.teenagi.agent.model.AgentResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class AgentControllerTest {

    private Agent agent;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        agent = mock(Agent.class);
        when(agent.getName()).thenReturn("TeenAGI");
        when(agent.getProvider()).thenReturn("openai");
        when(agent.getModel()).thenReturn("gpt-4o-mini");
        mockMvc = MockMvcBuilders.standaloneSetup(new AgentController(agent))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void respond_returnsAgentResponse() throws Exception {
        when(agent.run("Hi")).thenReturn(AgentResponse.builder()
                .finalAnswer("Hello!")
                .outcome(AgentResponse.Outcome.COMPLETED)
                .functionCallsExecuted(List.of())
                .turns(List.of())
                .iterationsUsed(1)
                .build());

        mockMvc.perform(post("/api/v1/agent/respond")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"input\":\"Hi\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.finalAnswer").value("Hello!"))
                .andExpect(jsonPath("$.outcome").value("COMPLETED"))
                .andExpect(jsonPath("$.iterationsUsed").value(1));
    }

    @Test
    void respond_blankInput_isBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/agent/respond")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"input\":\" \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("input: input must not be blank"));
        verify(agent, never()).run(anyString());
    }

    @Test
    void respond_providerFailure_isBadGateway() throws Exception {
        when(agent.run("Hi")).thenThrow(new ProviderCommunicationException("openai returned HTTP 500: oops"));

        mockMvc.perform(post("/api/v1/agent/respond")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"input\":\"Hi\"}"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.error").value("openai returned HTTP 500: oops"));
    }

    @Test
    void learn_returnsCreatedWithCapabilities() throws Exception {
        when(agent.learn("doing math")).thenReturn(true);
        when(agent.getCapabilities()).thenReturn(List.of("doing math"));

        mockMvc.perform(post("/api/v1/agent/capabilities")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"statement\":\"doing math\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.capabilities[0]").value("doing math"));
    }

    @Test
    void functions_listsDescriptors() throws Exception {
        when(agent.getFunctions()).thenReturn(List.of(new WeatherFunction().getDescriptor()));

        mockMvc.perform(get("/api/v1/agent/functions"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].name").value("get_weather"))
                .andExpect(jsonPath("$[0].parameters.required[0]").value("location"));
    }

    @Test
    void health_reportsAgent() throws Exception {
        mockMvc.perform(get("/api/v1/agent/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.provider").value("openai"));
    }
}
