package com.teenagi.agent;

import com.teenagi.agent.config.AgentProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(AgentProperties.class)
public class TeenAgiApplication {
    public static void main(String[] args) {
        SpringApplication.run(TeenAgiApplication.class, args);
    }
}
