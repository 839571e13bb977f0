package com.vouch.auth.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties({TokenProperties.class, NotifierProperties.class})
public class TokenConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
