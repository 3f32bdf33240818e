package com.travelmesh.pdp;

import com.travelmesh.pdp.config.PolicyProperties;
import com.travelmesh.support.config.ServiceSupportConfiguration;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Import;

/**
 * Policy Decision Point: answers "may caller X reach target Y at path P" from an immutable
 * registry loaded at startup. Not itself behind an Enforcement Point.
 */
@SpringBootApplication
@EnableConfigurationProperties(PolicyProperties.class)
@Import(ServiceSupportConfiguration.class)
public class PolicyDecisionPointApplication {

    public static void main(String[] args) {
        SpringApplication.run(PolicyDecisionPointApplication.class, args);
    }
}
