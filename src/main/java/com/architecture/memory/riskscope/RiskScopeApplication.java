package com.architecture.memory.riskscope;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
public class RiskScopeApplication {

    public static void main(String[] args) {
        SpringApplication.run(RiskScopeApplication.class, args);
    }
}
