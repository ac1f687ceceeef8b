package com.infomedia.abacox.feeschedule.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class CacheConfig {

    /**
     * Time source for lookup cache expiry.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
