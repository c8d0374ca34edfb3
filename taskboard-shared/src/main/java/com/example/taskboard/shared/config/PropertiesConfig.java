package com.example.taskboard.shared.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class PropertiesConfig {

    @Value("${service.name:${SERVICE_NAME:taskboard-realtime-0}}")
    private String serviceName;

    @Bean
    @ConfigurationProperties(prefix = "taskboard")
    public AppProperties appProperties() {
        AppProperties properties = new AppProperties();

        // Instance name comes from the environment; the rest is bound from taskboard.*
        properties.getService().setName(serviceName);
        return properties;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
