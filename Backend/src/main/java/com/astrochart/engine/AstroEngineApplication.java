package com.astrochart.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AstroEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(AstroEngineApplication.class, args);
    }
}
