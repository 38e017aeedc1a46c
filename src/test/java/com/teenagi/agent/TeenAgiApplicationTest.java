package com.teenagi.agent;

import com.teenagi.agent.core.Agent;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
        "agent.provider=anthropic",
        "agent.capabilities[0]=doing math"
})
class TeenAgiApplicationTest {

    @Autowired
    private Agent agent;

    @Test
    void contextLoads_withBuiltInFunctionsRegistered() {
        assertThat(agent.getProvider()).isEqualTo("anthropic");
        assertThat(agent.getCapabilities()).containsExactly("doing math");
        assertThat(agent.getFunctions())
                .extracting(d -> d.getName())
                .contains("get_weather", "calculate", "get_current_time", "search_info");
    }
}
