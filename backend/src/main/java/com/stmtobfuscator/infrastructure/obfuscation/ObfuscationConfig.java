package com.stmtobfuscator.infrastructure.obfuscation;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ObfuscationConfig {

    @Bean
    public Clock obfuscationClock() {
        return Clock.systemDefaultZone();
    }
}
