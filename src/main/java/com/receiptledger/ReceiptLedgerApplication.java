package com.receiptledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ReceiptLedgerApplication {
  public static void main(String[] args) {
    SpringApplication.run(ReceiptLedgerApplication.class, args);
  }
}
