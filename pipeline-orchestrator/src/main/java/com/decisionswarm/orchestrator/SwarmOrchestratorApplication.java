package com.decisionswarm.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.decisionswarm")
public class SwarmOrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(SwarmOrchestratorApplication.class, args);
    }
}
