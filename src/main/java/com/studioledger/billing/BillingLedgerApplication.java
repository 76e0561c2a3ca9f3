package com.studioledger.billing;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class BillingLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(BillingLedgerApplication.class, args);
    }

}
