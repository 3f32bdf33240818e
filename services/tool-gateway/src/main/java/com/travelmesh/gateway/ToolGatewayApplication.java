package com.travelmesh.gateway;

import com.travelmesh.gateway.config.GatewayProperties;
import com.travelmesh.support.config.ServiceSupportConfiguration;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Tool gateway: gRPC for worker agents, HTTP for health and identity. One instance serves one
 * domain, selected by {@code travelmesh.gateway.domain}.
 */
@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties(GatewayProperties.class)
@Import(ServiceSupportConfiguration.class)
public class ToolGatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(ToolGatewayApplication.class, args);
    }
}
