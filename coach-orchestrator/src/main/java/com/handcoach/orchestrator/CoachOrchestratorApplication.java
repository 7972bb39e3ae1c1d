package com.handcoach.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CoachOrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(CoachOrchestratorApplication.class, args);
    }
}
