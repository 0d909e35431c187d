package com.kpAnalyzer.financeEngine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FinanceEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(FinanceEngineApplication.class, args);
    }
}
