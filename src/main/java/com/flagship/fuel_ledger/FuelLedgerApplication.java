package com.flagship.fuel_ledger;

import com.flagship.fuel_ledger.config.FuelLedgerProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(FuelLedgerProperties.class)
public class FuelLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(FuelLedgerApplication.class, args);
    }
}
