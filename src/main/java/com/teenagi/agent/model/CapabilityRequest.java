package com.teenagi.agent.model;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class CapabilityRequest {

    @NotBlank(message = "statement must not be blank")
    private String statement;
}
