package com.vteam.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * RFE workflow orchestrator.
 *
 * To run against a local workspace directory:
 *   VTEAM_WORKSPACE_MODE=local VTEAM_WORKSPACE_LOCAL_ROOT=/tmp/ws mvn spring-boot:run
 */
@SpringBootApplication
public class OrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(OrchestratorApplication.class, args);
    }
}
