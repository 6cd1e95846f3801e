package com.vaultstake;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class VaultstakeApplication {
    public static void main(String[] args) {
        SpringApplication.run(VaultstakeApplication.class, args);
    }
}
