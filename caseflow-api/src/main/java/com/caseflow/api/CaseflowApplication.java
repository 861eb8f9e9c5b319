package com.caseflow.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.ComponentScan;

/**
 * Main application entry point for the lifecycle orchestrator.
 */
@SpringBootApplication
@ComponentScan(basePackages = {
    "com.caseflow.api",
    "com.caseflow.engine",
    "com.caseflow.recovery"
})
public class CaseflowApplication {

    public static void main(String[] args) {
        SpringApplication.run(CaseflowApplication.class, args);
    }
}
