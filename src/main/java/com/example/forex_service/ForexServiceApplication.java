package com.example.forex_service;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ForexServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(ForexServiceApplication.class, args);
    }
}
