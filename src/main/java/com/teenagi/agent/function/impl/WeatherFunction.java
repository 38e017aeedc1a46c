package com.teenagi.agent.function.impl;

import com.teenagi.agent.function.AgentFunction;
import com.teenagi.agent.function.FunctionDescriptor;
import com.teenagi.agent.function.ParameterSpec;
import com.teenagi.agent.function.ParameterType;
import com.teenagi.agent.function.TypedArguments;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Demo weather lookup returning fixed readings for any location.
 */
@Component
public class WeatherFunction implements AgentFunction {

    private static final FunctionDescriptor DESCRIPTOR = FunctionDescriptor.builder()
            .name("get_weather")
            .description("Get current weather information for a location")
            .parameter(ParameterSpec.required("location", ParameterType.STRING, "City name or location"))
            .returnType("object")
            .build();

    @Override
    public FunctionDescriptor getDescriptor() {
        return DESCRIPTOR;
    }

    @Override
    public Object invoke(TypedArguments arguments) {
        Map<String, Object> weather = new LinkedHashMap<>();
        weather.put("location", arguments.getString("location"));
        weather.put("temperature", 72);
        weather.put("condition", "Sunny");
        weather.put("humidity", 65);
        weather.put("wind_speed", 5);
        return weather;
    }
}
