package com.cinelink.federation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FederationServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(FederationServiceApplication.class, args);
    }
}
