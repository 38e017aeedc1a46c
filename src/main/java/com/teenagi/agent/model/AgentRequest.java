package com.teenagi.agent.model;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class AgentRequest {

    @NotBlank(message = "input must not be blank")
    private String input;
}
