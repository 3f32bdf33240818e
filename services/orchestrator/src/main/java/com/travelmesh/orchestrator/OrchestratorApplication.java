package com.travelmesh.orchestrator;

import com.travelmesh.orchestrator.config.OrchestratorProperties;
import com.travelmesh.support.config.ServiceSupportConfiguration;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Travel planner: classifies chat messages and routes them to the worker agents.
 */
@SpringBootApplication
@EnableConfigurationProperties(OrchestratorProperties.class)
@EnableScheduling
@Import(ServiceSupportConfiguration.class)
public class OrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(OrchestratorApplication.class, args);
    }
}
