package com.tokenledger.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Time source for ledger timestamps and reward windows.
 * Tests replace the bean with a fixed or adjustable clock.
 */
@Configuration
@EnableConfigurationProperties(LedgerPolicyProperties.class)
public class ClockConfig {

    @Bean
    Clock ledgerClock() {
        return Clock.systemUTC();
    }
}
