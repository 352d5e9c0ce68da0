package com.taskherd.engine.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class EngineConfig {

    // Injected wherever "now" matters so tests can pin time.
    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }
}
