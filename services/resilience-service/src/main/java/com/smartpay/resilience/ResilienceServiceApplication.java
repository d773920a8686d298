package com.smartpay.resilience;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ResilienceServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(ResilienceServiceApplication.class, args);
    }
}
