package com.paircraft.engine.runner;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.paircraft.engine.config.ObjectMapperFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

/**
 * Command-line application around the pairing engine.
 */
@SpringBootApplication(scanBasePackages = "com.paircraft.engine")
public class PairingEngineApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(PairingEngineApplication.class, args)));
    }

    @Bean
    public ObjectMapper objectMapper() {
        return ObjectMapperFactory.create();
    }
}
