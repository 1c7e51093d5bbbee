package com.example.securebudget;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SecureBudgetApplication {

    public static void main(String[] args) {
        SpringApplication.run(SecureBudgetApplication.class, args);
    }
}
