package com.voltquery.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Time source shared by breakers, the response cache and the freshness oracle.
 */
@Configuration
public class ResilienceConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
