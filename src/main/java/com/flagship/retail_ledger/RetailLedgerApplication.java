package com.flagship.retail_ledger;

import com.flagship.retail_ledger.config.LedgerProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties(LedgerProperties.class)
public class RetailLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(RetailLedgerApplication.class, args);
    }
}
