package com.ecoimpact.indicators;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EcosystemIndicatorsApplication {
    public static void main(String[] args) {
        SpringApplication.run(EcosystemIndicatorsApplication.class, args);
    }
}
