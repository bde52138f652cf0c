package com.taleforge.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application entry point for the Taleforge turn engine.
 */
@SpringBootApplication
public class TaleforgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(TaleforgeApplication.class, args);
    }
}
