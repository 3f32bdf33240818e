package com.travelmesh.agent;

import com.travelmesh.agent.config.AgentProperties;
import com.travelmesh.support.config.ServiceSupportConfiguration;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Import;

/**
 * Worker agent: one booking domain, rule-based dispatch onto that domain's tool gateway.
 */
@SpringBootApplication
@EnableConfigurationProperties(AgentProperties.class)
@Import(ServiceSupportConfiguration.class)
public class AgentApplication {

    public static void main(String[] args) {
        SpringApplication.run(AgentApplication.class, args);
    }
}
