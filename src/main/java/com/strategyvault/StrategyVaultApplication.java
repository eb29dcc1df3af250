package com.strategyvault;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class StrategyVaultApplication {

    public static void main(String[] args) {
        SpringApplication.run(StrategyVaultApplication.class, args);
    }
}
