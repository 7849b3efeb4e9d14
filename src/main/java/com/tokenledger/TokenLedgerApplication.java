package com.tokenledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Token ledger service: per-user VDO token accounts, an append-only
 * transaction ledger, daily rewards and staking.
 */
@SpringBootApplication
@EnableTransactionManagement
public class TokenLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(TokenLedgerApplication.class, args);
    }

}
