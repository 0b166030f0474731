package com.identityplatform.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class IdentityOrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(IdentityOrchestratorApplication.class, args);
    }
}
