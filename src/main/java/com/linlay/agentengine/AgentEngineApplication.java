package com.linlay.agentengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class AgentEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(AgentEngineApplication.class, args);
    }
}
