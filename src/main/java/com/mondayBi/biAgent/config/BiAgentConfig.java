package com.mondayBi.biAgent.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties({BoardProperties.class, ColumnClassificationProperties.class})
public class BiAgentConfig {

    /**
     * Source of "today" for overdue checks, prompts and the rate limiter.
     */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
