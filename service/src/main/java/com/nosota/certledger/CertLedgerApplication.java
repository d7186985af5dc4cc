package com.nosota.certledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class CertLedgerApplication {
    public static void main(String[] args) {
        SpringApplication.run(CertLedgerApplication.class, args);
    }
}
