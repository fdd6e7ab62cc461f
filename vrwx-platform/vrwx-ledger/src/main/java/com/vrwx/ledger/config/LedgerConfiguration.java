package com.vrwx.ledger.config;

import com.vrwx.ledger.token.TokenLedger;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Beans shared by the ledger services: the two token ledgers, the system accounts and the clock.
 */
@Configuration
@EnableConfigurationProperties(LedgerProperties.class)
public class LedgerConfiguration {

    @Bean
    public SystemAccounts systemAccounts(LedgerProperties properties) {
        return SystemAccounts.from(properties);
    }

    @Bean
    public TokenLedger stableToken() {
        return new TokenLedger("USDC");
    }

    @Bean
    public TokenLedger vrwxToken() {
        return new TokenLedger("VRWX");
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
