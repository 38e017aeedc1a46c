package com.teenagi.agent.function.impl;

import com.teenagi.agent.function.AgentFunction;
import com.teenagi.agent.function.FunctionDescriptor;
import com.teenagi.agent.function.TypedArguments;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

@Component
public class CurrentTimeFunction implements AgentFunction {

    private static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private static final FunctionDescriptor DESCRIPTOR = FunctionDescriptor.builder()
            .name("get_current_time")
            .description("Get the current date and time")
            .returnType("string")
            .build();

    private final Clock clock;

    public CurrentTimeFunction() {
        this(Clock.systemDefaultZone());
    }

    // Visible for testing
    CurrentTimeFunction(Clock clock) {
        this.clock = clock;
    }

    @Override
    public FunctionDescriptor getDescriptor() {
        return DESCRIPTOR;
    }

    @Override
    public Object invoke(TypedArguments arguments) {
        return LocalDateTime.now(clock).format(FORMAT);
    }
}
