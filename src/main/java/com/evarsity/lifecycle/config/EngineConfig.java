package com.evarsity.lifecycle.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(LifecycleProperties.class)
public class EngineConfig {

    @Bean
    public Clock engineClock(LifecycleProperties properties) {
        return Clock.system(properties.zoneId());
    }
}
